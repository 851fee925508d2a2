package se.ironpass_be.pojo.enums;

public enum PaymentMethod {
    CASH,
    TRANSFER,
    CARD
}
