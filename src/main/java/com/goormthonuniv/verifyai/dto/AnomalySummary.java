package com.goormthonuniv.verifyai.dto;

public record AnomalySummary(int total, int high, int medium, int low) {

    public static AnomalySummary empty() {
        return new AnomalySummary(0, 0, 0, 0);
    }
}
