package com.swiftload.loadservice.model;

public enum BidStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    WITHDRAWN
}
