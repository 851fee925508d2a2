package se.ironpass_be.pojo.enums;

public enum AccessMethod {
    QR,
    MANUAL
}
