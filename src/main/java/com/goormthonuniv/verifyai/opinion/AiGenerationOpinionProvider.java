package com.goormthonuniv.verifyai.opinion;

import com.fasterxml.jackson.databind.JsonNode;
import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.OpinionRecord;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.dto.SourceKinds;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 생성형 AI 이미지 탐지 + 추정 생성 도구.
 * findings: isAiGenerated(boolean), likelyTool, summary, source
 */
@Component
@RequiredArgsConstructor
public class AiGenerationOpinionProvider implements OpinionProvider {

    /** 응답에 confidence 가 없을 때와 대체 의견 모두 이 값 */
    static final double NEUTRAL_CONFIDENCE = 0.7;

    static final VisionPrompt PROMPT = new VisionPrompt(SourceKinds.AI_GENERATION, """
            You are an expert in detecting AI-generated images. Analyze the image and determine:
            1. Is this image AI-generated? (DALL-E, Midjourney, Stable Diffusion, Firefly, etc.)
            2. If yes - which tool/model most likely created it?
            3. Key indicators: unnatural hands/fingers, distorted text, repetitive textures, asymmetric eyes, unnatural skin texture, impossible geometry, blurred backgrounds

            RESPOND ONLY WITH JSON in this exact format:
            {"is_ai_generated": true/false, "likely_tool": "tool name or unknown", "confidence": 0.0-1.0, "indicators": [{"type": "indicator name", "description": "description in Korean", "severity": "high/medium/low", "location": {"x": 0-100, "y": 0-100}}], "summary": "summary in Korean"}""",
            "Determine if this image was generated by AI. If so, identify the likely tool and all telltale signs. Be precise and avoid false positives.");

    private final VisionGateway gateway;
    private final VisionResponseParser parser;

    @Override
    public String sourceKind() {
        return SourceKinds.AI_GENERATION;
    }

    @Override
    public OpinionRecord analyze(byte[] fileBytes, String filename) {
        Optional<VisionAnswer> answer = gateway.ask(fileBytes, PROMPT);
        Optional<JsonNode> parsed = answer.flatMap(a -> parser.parse(a.text()));
        if (parsed.isEmpty()) return placeholder();

        JsonNode n = parsed.get();
        boolean synthetic = n.path("is_ai_generated").asBoolean(false);
        String tool = n.path("likely_tool").asText("unknown");

        List<Anomaly> anomalies = new ArrayList<>();
        if (synthetic) {
            anomalies.add(Anomaly.at("ai_generated",
                    "AI 로 생성된 이미지로 판단됩니다. 추정 도구: " + tool + ".",
                    Severity.HIGH, 50, 50));
        }
        anomalies.addAll(parser.anomalies(n.path("indicators")));

        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("isAiGenerated", synthetic);
        findings.put("likelyTool", tool);
        findings.put("summary", n.path("summary").asText(""));
        findings.put("source", answer.get().client());
        return new OpinionRecord(sourceKind(),
                parser.confidence(n, "confidence", NEUTRAL_CONFIDENCE),
                findings, anomalies);
    }

    OpinionRecord placeholder() {
        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("isAiGenerated", false);
        findings.put("likelyTool", "unknown");
        findings.put("summary", "대체 의견입니다. 실제 분석을 하려면 비전 API 키를 설정하세요.");
        findings.put("source", "placeholder");
        return new OpinionRecord(sourceKind(), NEUTRAL_CONFIDENCE, findings,
                List.of(Anomaly.at("ai_check",
                        "비전 API 연결 없이는 AI 생성 여부를 확정할 수 없습니다.",
                        Severity.LOW, 50, 50)));
    }
}
