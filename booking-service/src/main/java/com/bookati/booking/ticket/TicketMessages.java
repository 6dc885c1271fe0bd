package com.bookati.booking.ticket;

import com.bookati.booking.domain.TicketLanguage;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * Customer-facing texts that accompany the ticket, in English and Arabic.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class TicketMessages {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    public static String fileName(Long bookingId) {
        return "booking_ticket_" + bookingId + ".pdf";
    }

    public static String whatsAppCaption(TicketLanguage language, TicketReason reason) {
        if (reason == TicketReason.RESCHEDULED) {
            return language == TicketLanguage.AR
                    ? "تم تغيير موعد حجزك! يرجى الاطلاع على التذكرة المحدثة المرفقة."
                    : "Your booking time has been changed! Please find your updated ticket attached.";
        }
        return language == TicketLanguage.AR
                ? "تم تأكيد حجزك! يرجى الاطلاع على التذكرة المرفقة."
                : "Your booking is confirmed! Please find your ticket attached.";
    }

    public static String emailSubject(TicketLanguage language) {
        return language == TicketLanguage.AR ? "تذكرة الحجز - Booking Ticket" : "Booking Ticket";
    }

    public static String emailBody(TicketAttachment attachment) {
        TicketSnapshot booking = attachment.booking();
        String date = DATE.format(booking.slotStart());
        String time = TIME.format(booking.slotStart()) + " - " + TIME.format(booking.slotEnd());

        if (attachment.language() == TicketLanguage.AR) {
            return String.join("\n",
                    whatsAppCaption(TicketLanguage.AR, attachment.reason()),
                    "",
                    "رقم الحجز: " + booking.bookingId(),
                    "التاريخ: " + date,
                    "الوقت: " + time,
                    "",
                    "يرجى إحضار هذه التذكرة عند الوصول.");
        }
        return String.join("\n",
                whatsAppCaption(TicketLanguage.EN, attachment.reason()),
                "",
                "Booking ID: " + booking.bookingId(),
                "Date: " + date,
                "Time: " + time,
                "",
                "Please bring this ticket with you on arrival.");
    }
}
