package com.goormthonuniv.verifyai.dto;

/** OpinionRecord.sourceKind 로 쓰이는 알려진 태그 */
public final class SourceKinds {
    public static final String FORENSIC_TECHNICAL = "forensic_technical";
    public static final String PHYSICAL = "physical";
    public static final String CONTEXTUAL = "contextual";
    public static final String AI_GENERATION = "ai_generation";

    private SourceKinds() {}
}
