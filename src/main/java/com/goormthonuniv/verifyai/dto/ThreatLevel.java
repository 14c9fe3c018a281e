package com.goormthonuniv.verifyai.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 레드팀이 평가한 "현재 판정이 얼마나 불안한가" */
public enum ThreatLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
