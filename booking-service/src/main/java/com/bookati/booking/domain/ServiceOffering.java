package com.bookati.booking.domain;

import java.math.BigDecimal;

public record ServiceOffering(Long serviceId, String name, BigDecimal unitPrice, boolean active) {
}
