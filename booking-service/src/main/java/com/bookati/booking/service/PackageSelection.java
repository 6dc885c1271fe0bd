package com.bookati.booking.service;

import java.util.List;

/**
 * What the customer books: either a catalog package or an explicit list of services.
 */
public record PackageSelection(Long packageId, List<ServiceSelection> services) {

    public PackageSelection {
        services = services == null ? List.of() : List.copyOf(services);
    }

    public static PackageSelection ofPackage(Long packageId) {
        return new PackageSelection(packageId, List.of());
    }

    public static PackageSelection ofServices(List<ServiceSelection> services) {
        return new PackageSelection(null, services);
    }

    public boolean isPackage() {
        return packageId != null;
    }
}
