package com.goormthonuniv.verifyai.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Verdict {
    AUTHENTIC,
    FORGED,
    INCONCLUSIVE;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
