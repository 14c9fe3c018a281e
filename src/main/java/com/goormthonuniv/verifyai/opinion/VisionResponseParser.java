package com.goormthonuniv.verifyai.opinion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** 비전 모델의 JSON 응답 해석. ```json 펜스가 붙어 와도 허용한다. */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisionResponseParser {

    private final ObjectMapper om;

    public Optional<JsonNode> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String t = text.strip();
        if (t.startsWith("```")) {
            int firstNewline = t.indexOf('\n');
            int lastFence = t.lastIndexOf("```");
            t = (firstNewline > 0 && lastFence > firstNewline) ? t.substring(firstNewline + 1, lastFence) : "";
        }
        try {
            JsonNode node = om.readTree(t);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("[VerifyAI] vision response is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** [{type, description, severity, location{x,y}}] -> Anomaly 목록. type 없는 항목은 버린다. */
    public List<Anomaly> anomalies(JsonNode array) {
        List<Anomaly> out = new ArrayList<>();
        if (array == null || !array.isArray()) return out;
        for (JsonNode n : array) {
            String type = n.path("type").asText("");
            if (type.isBlank()) continue;
            JsonNode loc = n.path("location");
            Anomaly.Location location = loc.isObject() && loc.has("x") && loc.has("y")
                    ? new Anomaly.Location(loc.path("x").asInt(), loc.path("y").asInt())
                    : null;
            out.add(new Anomaly(type, n.path("description").asText(""),
                    Severity.parse(n.path("severity").asText(null)), location));
        }
        return out;
    }

    /** 0~1 신뢰도. 0~100 으로 답한 경우 백분율로 보고 나눈다. */
    public double confidence(JsonNode node, String field, double fallback) {
        JsonNode v = node.path(field);
        if (!v.isNumber()) return fallback;
        double d = v.asDouble();
        if (d > 1.0 && d <= 100.0) d = d / 100.0;
        return Math.max(0.0, Math.min(1.0, d));
    }
}
