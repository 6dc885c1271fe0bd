package com.bookati.booking.service;

/**
 * Contact data as submitted, before phone normalization and language resolution.
 */
public record CustomerDetails(String name, String email, String phone, String language) {
}
