package com.openonboarding.onboarding.domain.model;

import lombok.Builder;

/**
 * House rules shown to guests. Every sub-policy is optional; absent ones lower the policy clarity score.
 */
@Builder
public record HotelPolicies(
        CheckIn checkIn,
        CheckOut checkOut,
        Cancellation cancellation,
        Booking booking,
        Pet pet,
        Smoking smoking
) {

    public record CheckIn(String standardTime, String process) {
    }

    public record CheckOut(String standardTime, Boolean lateCheckoutAvailable, String process) {
    }

    public record Cancellation(String type, Integer freeUntilHours, Integer penaltyPercentage,
                               String noShowPolicy, String details) {
    }

    public record Booking(Integer advanceBookingDays, Boolean instantBooking, String paymentTerms) {
    }

    public record Pet(Boolean allowed, String fee) {
    }

    public record Smoking(Boolean allowed) {
    }
}
