package com.goormthonuniv.verifyai.service;

import com.goormthonuniv.verifyai.dto.SourceKinds;

import java.util.Map;

/**
 * 의견 소스별 가중치 테이블.
 * 포렌식(0.35) > 물리(0.25) > 맥락/AI 탐지(0.20), 모르는 소스는 0.10.
 * 표시용 한글 이름도 함께 관리한다.
 */
public final class SourceWeightPolicy {

    public static final double DEFAULT_WEIGHT = 0.10;

    private static final Map<String, Double> WEIGHTS = Map.of(
            SourceKinds.FORENSIC_TECHNICAL, 0.35,
            SourceKinds.PHYSICAL, 0.25,
            SourceKinds.CONTEXTUAL, 0.20,
            SourceKinds.AI_GENERATION, 0.20
    );

    private static final Map<String, String> DISPLAY_NAMES = Map.of(
            SourceKinds.FORENSIC_TECHNICAL, "포렌식-기술",
            SourceKinds.PHYSICAL, "물리",
            SourceKinds.CONTEXTUAL, "맥락",
            SourceKinds.AI_GENERATION, "AI 생성 탐지"
    );

    private SourceWeightPolicy() {}

    public static double weightOf(String sourceKind) {
        if (sourceKind == null) return DEFAULT_WEIGHT;
        return WEIGHTS.getOrDefault(sourceKind, DEFAULT_WEIGHT);
    }

    public static String displayName(String sourceKind) {
        return DISPLAY_NAMES.getOrDefault(sourceKind, sourceKind);
    }
}
