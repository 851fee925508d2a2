package se.ironpass_be.pojo.enums;

public enum PaymentStatus {
    PAID,     // Nothing left to pay
    PARTIAL,  // Some payments recorded, balance left, still inside the grace window
    PENDING,  // No payments yet, still inside the grace window
    OVERDUE   // Balance left after deadline + grace days
}
