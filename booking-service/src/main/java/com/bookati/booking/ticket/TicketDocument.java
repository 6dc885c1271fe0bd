package com.bookati.booking.ticket;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Last generated ticket PDF of a booking, kept so a single channel can be re-sent
 * without rendering again. The reason is the one the PDF was generated for, so re-sends
 * and re-runs keep the same caption.
 */
@Entity
@Table(name = "ticket_documents")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TicketDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long bookingId;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 100)
    private String fileName;

    @Basic(fetch = FetchType.LAZY)
    @Column(nullable = false)
    private byte[] content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TicketReason reason;

    @Column(nullable = false)
    private int version;

    @Column(nullable = false)
    private LocalDateTime generatedAt;

    public TicketDocument(Long bookingId, String tenantId, String fileName, byte[] content, TicketReason reason) {
        this.bookingId = bookingId;
        this.tenantId = tenantId;
        this.fileName = fileName;
        this.content = content;
        this.reason = reason;
        this.version = 1;
        this.generatedAt = LocalDateTime.now();
    }

    public void replace(byte[] content, TicketReason reason) {
        this.content = content;
        this.reason = reason;
        this.version++;
        this.generatedAt = LocalDateTime.now();
    }
}
