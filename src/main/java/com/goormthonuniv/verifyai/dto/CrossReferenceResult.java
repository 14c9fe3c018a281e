package com.goormthonuniv.verifyai.dto;

public record CrossReferenceResult(
        double combinedScore,        // 0.0~1.0 가중 평균
        Verdict preliminaryVerdict,  // 레드팀 이전 판정
        String reasoning,
        AnomalySummary anomalySummary
) {}
