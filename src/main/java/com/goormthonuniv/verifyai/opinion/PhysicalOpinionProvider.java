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

/** 그림자/조명/원근/반사/비율 등 물리적 일관성 */
@Component
@RequiredArgsConstructor
public class PhysicalOpinionProvider implements OpinionProvider {

    static final double DEFAULT_CONFIDENCE = 0.7;
    static final double PLACEHOLDER_CONFIDENCE = 0.68;

    static final VisionPrompt PROMPT = new VisionPrompt(SourceKinds.PHYSICAL, """
            You are a forensic physics expert analyzing images for authenticity.
            Analyze the image and look for:
            1. Shadow direction inconsistencies between objects
            2. Lighting issues - conflicting light sources
            3. Perspective errors - mismatched vanishing points
            4. Inconsistent reflections
            5. Unnatural proportions

            RESPOND ONLY WITH JSON in this exact format:
            {"anomalies": [{"type": "shadows/lighting/perspective/reflections/proportions", "description": "detailed description in Korean", "severity": "high/medium/low", "location": {"x": 0-100, "y": 0-100}}], "confidence_score": 0.0-1.0, "summary": "short summary in Korean"}

            If the image appears authentic with no issues, return empty anomalies array and high confidence_score.""",
            "Analyze this image for physical inconsistencies - shadows, lighting, perspective, reflections, and proportions. Identify every anomaly. Be thorough but avoid false positives.");

    private final VisionGateway gateway;
    private final VisionResponseParser parser;

    @Override
    public String sourceKind() {
        return SourceKinds.PHYSICAL;
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

    /** 비전 API 를 쓸 수 없을 때의 고정 의견 */
    OpinionRecord placeholder() {
        return new OpinionRecord(sourceKind(), PLACEHOLDER_CONFIDENCE,
                Map.of("summary", "대체 의견입니다. 실제 분석을 하려면 비전 API 키를 설정하세요.", "source", "placeholder"),
                List.of(
                        Anomaly.at("shadows",
                                "중심 객체의 그림자 방향이 배경의 그림자 방향과 어긋납니다. 합성되었을 가능성이 있습니다.",
                                Severity.HIGH, 50, 60),
                        Anomaly.at("perspective",
                                "배경 선들의 소실점이 전경 객체의 원근과 맞지 않습니다.",
                                Severity.MEDIUM, 25, 75)
                ));
    }
}
