package se.ironpass_be.pojo.enums;

public enum MembershipStatus {
    PENDING_PAYMENT, // Created, waiting for the first payment
    ACTIVE,          // Currently in use
    FROZEN,          // Paused by staff, end date already extended
    CANCELLED,       // Cancelled by staff
    EXPIRED          // The service period has ended
}
