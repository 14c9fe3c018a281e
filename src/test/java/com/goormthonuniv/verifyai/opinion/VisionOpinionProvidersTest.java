package com.goormthonuniv.verifyai.opinion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.OpinionRecord;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.dto.SourceKinds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VisionOpinionProvidersTest {

    private static final byte[] IMAGE = {1, 2, 3};

    @Mock
    private VisionGateway gateway;

    private final VisionResponseParser parser = new VisionResponseParser(new ObjectMapper());

    @Test
    void physicalFallsBackToPlaceholderWithoutAnswer() {
        when(gateway.ask(any(), eq(PhysicalOpinionProvider.PROMPT))).thenReturn(Optional.empty());

        OpinionRecord r = new PhysicalOpinionProvider(gateway, parser).analyze(IMAGE, "p.jpg");

        assertThat(r.sourceKind()).isEqualTo(SourceKinds.PHYSICAL);
        assertThat(r.confidence()).isEqualTo(0.68);
        assertThat(r.anomalies()).extracting(Anomaly::type).containsExactly("shadows", "perspective");
        assertThat(r.findings()).containsEntry("source", "placeholder");
    }

    @Test
    void physicalParsesModelAnswer() {
        when(gateway.ask(any(), eq(PhysicalOpinionProvider.PROMPT))).thenReturn(Optional.of(new VisionAnswer("anthropic",
                "{\"anomalies\": [{\"type\": \"lighting\", \"description\": \"광원 충돌\", \"severity\": \"high\"}], \"confidence_score\": 0.42, \"summary\": \"조명 불일치\"}")));

        OpinionRecord r = new PhysicalOpinionProvider(gateway, parser).analyze(IMAGE, "p.jpg");

        assertThat(r.confidence()).isEqualTo(0.42);
        assertThat(r.anomalies()).singleElement().satisfies(a -> assertThat(a.severity()).isEqualTo(Severity.HIGH));
        assertThat(r.findings()).containsEntry("source", "anthropic").containsEntry("summary", "조명 불일치");
    }

    @Test
    void unparseableAnswerAlsoFallsBack() {
        when(gateway.ask(any(), eq(ContextualOpinionProvider.PROMPT)))
                .thenReturn(Optional.of(new VisionAnswer("openai", "Sorry, I can't help with that.")));

        OpinionRecord r = new ContextualOpinionProvider(gateway, parser).analyze(IMAGE, "c.jpg");

        assertThat(r.sourceKind()).isEqualTo(SourceKinds.CONTEXTUAL);
        assertThat(r.confidence()).isEqualTo(0.65);
        assertThat(r.anomalies()).extracting(Anomaly::type).containsExactly("period");
    }

    @Test
    void syntheticAnswerPrependsHighAnomaly() {
        when(gateway.ask(any(), eq(AiGenerationOpinionProvider.PROMPT))).thenReturn(Optional.of(new VisionAnswer("anthropic", """
                {"is_ai_generated": true, "likely_tool": "Midjourney", "confidence": 0.12,
                 "indicators": [{"type": "hands", "description": "손가락 6개", "severity": "medium"}],
                 "summary": "생성 이미지"}""")));

        OpinionRecord r = new AiGenerationOpinionProvider(gateway, parser).analyze(IMAGE, "a.png");

        assertThat(r.anomalies()).extracting(Anomaly::type).containsExactly("ai_generated", "hands");
        assertThat(r.anomalies().get(0).severity()).isEqualTo(Severity.HIGH);
        assertThat(r.findings()).containsEntry("isAiGenerated", true).containsEntry("likelyTool", "Midjourney");
        assertThat(r.confidence()).isEqualTo(0.12);
    }

    @Test
    void aiAnswerWithoutConfidenceUsesTheNeutralValue() {
        when(gateway.ask(any(), eq(AiGenerationOpinionProvider.PROMPT))).thenReturn(Optional.of(new VisionAnswer("openai",
                "{\"is_ai_generated\": false, \"indicators\": [], \"summary\": \"판단 근거 부족\"}")));

        OpinionRecord r = new AiGenerationOpinionProvider(gateway, parser).analyze(IMAGE, "a.png");

        assertThat(r.confidence()).isEqualTo(AiGenerationOpinionProvider.NEUTRAL_CONFIDENCE);
        assertThat(r.findings()).containsEntry("isAiGenerated", false).containsEntry("source", "openai");
    }

    @Test
    void aiPlaceholderIsUndetermined() {
        when(gateway.ask(any(), eq(AiGenerationOpinionProvider.PROMPT))).thenReturn(Optional.empty());

        OpinionRecord r = new AiGenerationOpinionProvider(gateway, parser).analyze(IMAGE, "a.png");

        assertThat(r.confidence()).isEqualTo(0.70);
        assertThat(r.findings()).containsEntry("isAiGenerated", false);
        assertThat(r.anomalies()).singleElement().satisfies(a -> assertThat(a.severity()).isEqualTo(Severity.LOW));
    }
}
