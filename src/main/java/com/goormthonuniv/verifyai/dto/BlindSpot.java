package com.goormthonuniv.verifyai.dto;

public record BlindSpot(
        String source,  // 소스 태그 또는 "system"
        String issue,
        String risk     // "false_negative" | "missing_capability" | "missing_agent"
) {}
