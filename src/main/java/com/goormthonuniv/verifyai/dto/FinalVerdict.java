package com.goormthonuniv.verifyai.dto;

/** 분석 1회당 한 번 만들어지는 최종 판정. 이후 변경하지 않는다. */
public record FinalVerdict(
        Verdict verdict,
        double confidence,
        boolean hitlRequired
) {}
