package com.goormthonuniv.verifyai.dto;

import java.util.List;

public record CritiqueResult(
        List<Challenge> challenges,
        List<BlindSpot> blindSpots,
        List<String> recommendations,
        double confidenceAdjustment,
        ThreatLevel threatLevel,
        String summary,
        int historySize
) {
    public CritiqueResult {
        challenges = List.copyOf(challenges);
        blindSpots = List.copyOf(blindSpots);
        recommendations = List.copyOf(recommendations);
    }

    public boolean hasVerdictChallenge() {
        return challenges.stream().anyMatch(Challenge::isVerdictChallenge);
    }
}
