package com.bookati.booking.service;

public record ServiceSelection(Long serviceId, int quantity) {
}
