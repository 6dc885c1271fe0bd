package com.bookati.booking.service;

import java.math.BigDecimal;

public record ResolvedLineItem(Long serviceId, String serviceName, int quantity, BigDecimal unitPrice) {

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
