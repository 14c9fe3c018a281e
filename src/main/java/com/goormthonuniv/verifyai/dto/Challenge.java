package com.goormthonuniv.verifyai.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Challenge(
        String kind,          // "false_positive_risk" | "consistency_gap" | "verdict_challenge" ...
        String targetSource,  // 선택
        String challenge,
        Severity severity,
        String impact
) {
    public static final String VERDICT_CHALLENGE = "verdict_challenge";

    public boolean isVerdictChallenge() {
        return VERDICT_CHALLENGE.equals(kind);
    }
}
