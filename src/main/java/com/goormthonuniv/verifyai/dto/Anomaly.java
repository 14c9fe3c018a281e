package com.goormthonuniv.verifyai.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Anomaly(
        String type,          // "metadata" | "ela" | "double_compression" | "shadows" ...
        String description,
        Severity severity,
        Location location     // 선택: 이미지 내 퍼센트 좌표
) {
    public Anomaly {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        description = description == null ? "" : description;
    }

    public static Anomaly of(String type, String description, Severity severity) {
        return new Anomaly(type, description, severity, null);
    }

    public static Anomaly at(String type, String description, Severity severity, int x, int y) {
        return new Anomaly(type, description, severity, new Location(x, y));
    }

    /** 0~100 퍼센트 좌표 */
    public record Location(int x, int y) {
        public Location {
            x = Math.max(0, Math.min(100, x));
            y = Math.max(0, Math.min(100, y));
        }
    }
}
