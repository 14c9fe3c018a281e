package com.goormthonuniv.verifyai.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
        String fileHash,                      // SHA-256 (chain of custody)
        MediaKind mediaKind,
        List<OpinionRecord> opinions,
        CrossReferenceResult crossReference,
        CritiqueResult critique,
        Verdict verdict,
        double confidence,
        boolean hitlRequired,
        String hitlRecommendation             // hitlRequired 일 때만
) {}
