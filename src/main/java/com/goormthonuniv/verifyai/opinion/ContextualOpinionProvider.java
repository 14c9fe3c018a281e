package com.goormthonuniv.verifyai.opinion;

import com.fasterxml.jackson.databind.JsonNode;
import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.OpinionRecord;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.dto.SourceKinds;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** 시대/장소/문화적 맥락과 맞지 않는 요소(복장, 기술, 건축, 식생, 표기) */
@Component
@RequiredArgsConstructor
public class ContextualOpinionProvider implements OpinionProvider {

    static final double DEFAULT_CONFIDENCE = 0.7;
    static final double PLACEHOLDER_CONFIDENCE = 0.65;

    static final VisionPrompt PROMPT = new VisionPrompt(SourceKinds.CONTEXTUAL, """
            You are a historical and contextual forensic expert. Analyze the image for:
            1. Elements that don't match the apparent time period (uniforms, weapons, technology, vehicles)
            2. Architectural styles that don't match the location or era
            3. Vegetation inconsistent with the geographic region
            4. Anachronistic typography, signs, or symbols
            5. Clothing styles, hairstyles, or accessories that don't fit

            RESPOND ONLY WITH JSON in this exact format:
            {"anomalies": [{"type": "period/uniforms/technology/architecture/vegetation", "description": "detailed description in Korean", "severity": "high/medium/low", "location": {"x": 0-100, "y": 0-100}}], "confidence_score": 0.0-1.0, "summary": "short summary in Korean"}

            If nothing appears anachronistic, return empty anomalies and high confidence_score.""",
            "Analyze this image for historical and contextual inconsistencies. Identify any element that doesn't belong to the apparent time period, location, or cultural context. Be thorough and specific.");

    private final VisionGateway gateway;
    private final VisionResponseParser parser;

    @Override
    public String sourceKind() {
        return SourceKinds.CONTEXTUAL;
    }

    @Override
    public OpinionRecord analyze(byte[] fileBytes, String filename) {
        Optional<VisionAnswer> answer = gateway.ask(fileBytes, PROMPT);
        Optional<JsonNode> parsed = answer.flatMap(a -> parser.parse(a.text()));
        if (parsed.isEmpty()) return placeholder();

        JsonNode n = parsed.get();
        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("summary", n.path("summary").asText(""));
        findings.put("source", answer.get().client());
        return new OpinionRecord(sourceKind(),
                parser.confidence(n, "confidence_score", DEFAULT_CONFIDENCE),
                findings,
                parser.anomalies(n.path("anomalies")));
    }

    OpinionRecord placeholder() {
        return new OpinionRecord(sourceKind(), PLACEHOLDER_CONFIDENCE,
                Map.of("summary", "대체 의견입니다. 실제 분석을 하려면 비전 API 키를 설정하세요.", "source", "placeholder"),
                List.of(Anomaly.at("period",
                        "이미지 속 요소가 제시된 시대와 맞지 않을 수 있습니다. 비전 API 를 통한 정밀 분석이 필요합니다.",
                        Severity.MEDIUM, 60, 40)));
    }
}
