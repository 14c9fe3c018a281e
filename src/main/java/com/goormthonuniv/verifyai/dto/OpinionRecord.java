package com.goormthonuniv.verifyai.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 모든 의견 소스(내부 포렌식, 외부 비전 모델)가 내놓는 공통 결과.
 * confidence 는 이 소스가 혼자 판단한 "진본일 확률"이다.
 */
public record OpinionRecord(
        String sourceKind,
        double confidence,             // 0.0~1.0
        Map<String, Object> findings,  // 소스별 자유 형식
        List<Anomaly> anomalies
) {
    public OpinionRecord {
        Objects.requireNonNull(sourceKind, "sourceKind");
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        findings = findings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(findings));
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    public long count(Severity severity) {
        return anomalies.stream().filter(a -> a.severity() == severity).count();
    }
}
