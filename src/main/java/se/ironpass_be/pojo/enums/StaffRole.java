package se.ironpass_be.pojo.enums;

public enum StaffRole {
    ADMIN,
    RECEPTION
}
