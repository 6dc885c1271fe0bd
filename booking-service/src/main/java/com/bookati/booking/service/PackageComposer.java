package com.bookati.booking.service;

import com.bookati.booking.domain.PackageDefinition;
import com.bookati.booking.domain.ServiceOffering;
import com.bookati.booking.exception.InvalidPackageException;
import com.bookati.booking.jooq.PackageCatalogJooqRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves what a booking contains into line items, one per distinct service, ordered by
 * service id. Called inside the booking transaction so the items come from the same read
 * that the booking is written against.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PackageComposer {

    private final PackageCatalogJooqRepository catalogRepository;

    public List<ResolvedLineItem> resolve(String tenantId, PackageSelection selection) {
        if (selection.isPackage()) {
            if (!selection.services().isEmpty()) {
                throw new InvalidPackageException("Specify either a package or services, not both");
            }
            return resolveLineItems(tenantId, selection.packageId());
        }
        return resolveLineItems(tenantId, selection.services());
    }

    public List<ResolvedLineItem> resolveLineItems(String tenantId, Long packageId) {
        PackageDefinition definition = catalogRepository.findPackage(tenantId, packageId)
                .orElseThrow(() -> new InvalidPackageException("Package not found: " + packageId));

        if (!definition.active()) {
            throw new InvalidPackageException("Package is inactive: " + packageId);
        }
        if (definition.entries().isEmpty()) {
            throw new InvalidPackageException("Package has no services: " + packageId);
        }

        Set<Long> seen = new HashSet<>();
        List<ResolvedLineItem> items = new ArrayList<>();
        for (PackageDefinition.Entry entry : definition.entries()) {
            if (!seen.add(entry.serviceId())) {
                throw new InvalidPackageException(
                        "Package " + packageId + " lists service " + entry.serviceId() + " more than once");
            }
            if (!entry.serviceExists() || !entry.serviceActive()) {
                throw new InvalidPackageException(
                        "Package " + packageId + " references unavailable service " + entry.serviceId());
            }
            if (entry.quantity() <= 0) {
                throw new InvalidPackageException(
                        "Package " + packageId + " has non-positive quantity for service " + entry.serviceId());
            }
            items.add(new ResolvedLineItem(entry.serviceId(), entry.serviceName(), entry.quantity(), entry.unitPrice()));
        }

        log.debug("Package resolved: tenantId={}, packageId={}, services={}", tenantId, packageId, seen);
        return List.copyOf(items);
    }

    /**
     * Direct service selection. A service named twice has its quantities merged.
     */
    public List<ResolvedLineItem> resolveLineItems(String tenantId, List<ServiceSelection> selections) {
        if (selections == null || selections.isEmpty()) {
            throw new InvalidPackageException("No services selected");
        }

        Map<Long, Integer> quantities = new TreeMap<>();
        for (ServiceSelection selection : selections) {
            if (selection.serviceId() == null || selection.quantity() <= 0) {
                throw new InvalidPackageException("Invalid service selection: " + selection);
            }
            quantities.merge(selection.serviceId(), selection.quantity(), Integer::sum);
        }

        Map<Long, ServiceOffering> offerings = catalogRepository.findServices(tenantId, quantities.keySet()).stream()
                .collect(Collectors.toMap(ServiceOffering::serviceId, Function.identity()));

        List<ResolvedLineItem> items = new ArrayList<>();
        quantities.forEach((serviceId, quantity) -> {
            ServiceOffering offering = offerings.get(serviceId);
            if (offering == null || !offering.active()) {
                throw new InvalidPackageException("Service not available: " + serviceId);
            }
            items.add(new ResolvedLineItem(serviceId, offering.name(), quantity, offering.unitPrice()));
        });
        return List.copyOf(items);
    }
}
