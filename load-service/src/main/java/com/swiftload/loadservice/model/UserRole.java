package com.swiftload.loadservice.model;

public enum UserRole {
    SHIPPER,
    TRUCKER,
    ADMIN
}
