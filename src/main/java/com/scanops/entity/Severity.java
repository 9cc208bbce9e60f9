package com.scanops.entity;

public enum Severity {
    INFO(0),
    LOW(1),
    MEDIUM(4),
    HIGH(7),
    CRITICAL(10);

    private final int riskWeight;

    Severity(int riskWeight) {
        this.riskWeight = riskWeight;
    }

    public int riskWeight() {
        return riskWeight;
    }
}
