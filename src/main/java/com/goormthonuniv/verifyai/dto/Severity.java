package com.goormthonuniv.verifyai.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 이상 징후/챌린지 심각도. 코어는 항상 세 단계만 사용한다.
 */
public enum Severity {
    LOW(0.03),
    MEDIUM(0.08),
    HIGH(0.15);

    /** 포렌식 신뢰도 산정 시 이상 징후 1건당 감점 */
    private final double penalty;

    Severity(double penalty) {
        this.penalty = penalty;
    }

    public double penalty() {
        return penalty;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 외부 응답(LLM 등)용 관대한 파싱: 모르는 값은 medium, critical은 high로 접는다. */
    @JsonCreator
    public static Severity parse(String raw) {
        if (raw == null) return MEDIUM;
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "high", "critical" -> HIGH;
            default -> MEDIUM;
        };
    }
}
