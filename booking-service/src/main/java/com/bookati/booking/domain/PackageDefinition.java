package com.bookati.booking.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * A package as read from the catalog in one query: header plus its service entries.
 * Entries whose service row no longer exists carry a null name and price.
 */
public record PackageDefinition(Long packageId, String tenantId, String name, boolean active, List<Entry> entries) {

    public PackageDefinition {
        entries = List.copyOf(entries);
    }

    public record Entry(Long serviceId, String serviceName, int quantity, BigDecimal unitPrice, boolean serviceActive) {

        public boolean serviceExists() {
            return serviceName != null && unitPrice != null;
        }
    }
}
