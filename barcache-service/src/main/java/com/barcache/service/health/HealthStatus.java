package com.barcache.service.health;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
