package com.bookati.booking.dto.request;

import com.bookati.booking.service.CustomerDetails;
import com.bookati.booking.service.PackageSelection;
import com.bookati.booking.service.ServiceSelection;
import com.bookati.booking.service.SlotRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Used by both the direct booking and the checkout hold endpoints.
 * Exactly one of {@code packageId} and {@code services} must be given.
 */
public record CreateBookingRequest(
        @NotBlank @Size(max = 64) String resourceId,
        @NotNull LocalDateTime start,
        @Positive @Max(1440) int durationMinutes,
        @NotNull @Valid Customer customer,
        Long packageId,
        @Valid List<ServiceItem> services
) {

    public record Customer(
            @NotBlank @Size(max = 200) String name,
            @Email @Size(max = 320) String email,
            @Size(max = 32) String phone,
            @Size(max = 10) String language
    ) {
    }

    public record ServiceItem(@NotNull Long serviceId, @Positive int quantity) {
    }

    @AssertTrue(message = "Specify either packageId or services")
    public boolean isSelectionValid() {
        boolean hasServices = services != null && !services.isEmpty();
        return (packageId != null) != hasServices;
    }

    public SlotRequest toSlotRequest() {
        return new SlotRequest(resourceId, start, durationMinutes);
    }

    public CustomerDetails toCustomerDetails() {
        return new CustomerDetails(customer.name(), customer.email(), customer.phone(), customer.language());
    }

    public PackageSelection toSelection() {
        if (packageId != null) {
            return PackageSelection.ofPackage(packageId);
        }
        return PackageSelection.ofServices(services.stream()
                .map(item -> new ServiceSelection(item.serviceId(), item.quantity()))
                .toList());
    }
}
