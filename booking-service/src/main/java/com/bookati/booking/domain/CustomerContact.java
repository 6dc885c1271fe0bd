package com.bookati.booking.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerContact {

    @Column(name = "customer_name", nullable = false, length = 200)
    private String name;

    @Column(name = "customer_email", length = 320)
    private String email;

    @Column(name = "customer_phone", length = 20)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "customer_language", nullable = false, length = 2)
    private TicketLanguage language;

    public CustomerContact(String name, String email, String phone, TicketLanguage language) {
        this.name = name;
        this.email = email;
        this.phone = phone;
        this.language = language != null ? language : TicketLanguage.EN;
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    public boolean hasPhone() {
        return phone != null && !phone.isBlank();
    }
}
