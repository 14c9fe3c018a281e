package com.goormthonuniv.verifyai.service;

import com.goormthonuniv.verifyai.config.AsyncConfig;
import com.goormthonuniv.verifyai.critique.AdversarialCritiqueEngine;
import com.goormthonuniv.verifyai.critique.CritiqueHistory;
import com.goormthonuniv.verifyai.dto.AnalysisResponse;
import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.AnomalySummary;
import com.goormthonuniv.verifyai.dto.BlindSpot;
import com.goormthonuniv.verifyai.dto.Challenge;
import com.goormthonuniv.verifyai.dto.CritiqueResult;
import com.goormthonuniv.verifyai.dto.CrossReferenceResult;
import com.goormthonuniv.verifyai.dto.FinalVerdict;
import com.goormthonuniv.verifyai.dto.MediaKind;
import com.goormthonuniv.verifyai.dto.OpinionRecord;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.dto.SourceKinds;
import com.goormthonuniv.verifyai.dto.ThreatLevel;
import com.goormthonuniv.verifyai.dto.Verdict;
import com.goormthonuniv.verifyai.opinion.OpinionProvider;
import com.goormthonuniv.verifyai.support.TestImages;
import com.goormthonuniv.verifyai.util.Digests;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisOrchestratorTest {

    private static final byte[] PHOTO = TestImages.png(TestImages.solid(640, 480, 120));

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void imageRunsAllFourSourcesInSelectionOrder() {
        AnalysisOrchestrator orchestrator = orchestrator(List.of(
                fixed(SourceKinds.AI_GENERATION, 0.7),
                fixed(SourceKinds.CONTEXTUAL, 0.65),
                fixed(SourceKinds.PHYSICAL, 0.68),
                fixed(SourceKinds.FORENSIC_TECHNICAL, 0.8)));

        AnalysisResponse res = orchestrator.analyze(PHOTO, "p.png", MediaKind.IMAGE);

        assertThat(res.opinions()).extracting(OpinionRecord::sourceKind).containsExactly(
                SourceKinds.FORENSIC_TECHNICAL, SourceKinds.PHYSICAL, SourceKinds.CONTEXTUAL, SourceKinds.AI_GENERATION);
        assertThat(res.fileHash()).isEqualTo(Digests.sha256(PHOTO));
        assertThat(res.mediaKind()).isEqualTo(MediaKind.IMAGE);
    }

    @Test
    void mediaKindSelectsSources() {
        AnalysisOrchestrator orchestrator = orchestrator(List.of(
                fixed(SourceKinds.FORENSIC_TECHNICAL, 0.8),
                fixed(SourceKinds.PHYSICAL, 0.8),
                fixed(SourceKinds.CONTEXTUAL, 0.8),
                fixed(SourceKinds.AI_GENERATION, 0.8)));

        assertThat(orchestrator.selectProviders(MediaKind.VIDEO)).extracting(OpinionProvider::sourceKind)
                .containsExactly(SourceKinds.FORENSIC_TECHNICAL, SourceKinds.PHYSICAL, SourceKinds.CONTEXTUAL);
        assertThat(orchestrator.selectProviders(MediaKind.AUDIO)).extracting(OpinionProvider::sourceKind)
                .containsExactly(SourceKinds.FORENSIC_TECHNICAL);
        assertThat(orchestrator.selectProviders(MediaKind.DOCUMENT)).extracting(OpinionProvider::sourceKind)
                .containsExactly(SourceKinds.FORENSIC_TECHNICAL, SourceKinds.CONTEXTUAL);
        assertThat(orchestrator.selectProviders(MediaKind.UNKNOWN)).extracting(OpinionProvider::sourceKind)
                .containsExactly(SourceKinds.FORENSIC_TECHNICAL);
    }

    @Test
    void failingAndSlowProvidersAreDropped() {
        OpinionProvider failing = new OpinionProvider() {
            @Override public String sourceKind() { return SourceKinds.PHYSICAL; }
            @Override public OpinionRecord analyze(byte[] b, String f) { throw new IllegalStateException("vision down"); }
        };
        OpinionProvider slow = new OpinionProvider() {
            @Override public String sourceKind() { return SourceKinds.CONTEXTUAL; }
            @Override public OpinionRecord analyze(byte[] b, String f) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new OpinionRecord(sourceKind(), 0.9, Map.of(), List.of());
            }
        };
        AnalysisOrchestrator orchestrator = orchestrator(List.of(
                fixed(SourceKinds.FORENSIC_TECHNICAL, 0.8), failing, slow, fixed(SourceKinds.AI_GENERATION, 0.7)));

        AnalysisResponse res = orchestrator.analyze(PHOTO, "p.png", MediaKind.IMAGE);

        assertThat(res.opinions()).extracting(OpinionRecord::sourceKind)
                .containsExactly(SourceKinds.FORENSIC_TECHNICAL, SourceKinds.AI_GENERATION);
    }

    @Test
    void saturatedPoolDropsProvidersInsteadOfFailing() throws Exception {
        ThreadPoolTaskExecutor executor = new AsyncConfig().opinionExecutor(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            // 작업 스레드 1개 + 큐 16칸을 모두 채운다
            for (int i = 0; i < 17; i++) {
                executor.execute(() -> {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            AnalysisOrchestrator orchestrator = orchestrator(List.of(fixed(SourceKinds.FORENSIC_TECHNICAL, 0.9)), executor);

            AnalysisResponse res = orchestrator.analyze(PHOTO, "p.png", MediaKind.AUDIO);

            assertThat(res.opinions()).isEmpty();
            assertThat(res.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
            assertThat(res.hitlRequired()).isTrue();
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void highAnomalyKeepsConfidentProvidersOutOfAuthentic() {
        OpinionProvider flagged = provider(SourceKinds.FORENSIC_TECHNICAL, 0.9,
                Anomaly.at("ela", "압축 오차가 국소적으로 튑니다.", Severity.HIGH, 40, 40));
        AnalysisOrchestrator orchestrator = orchestrator(List.of(
                flagged, fixed(SourceKinds.CONTEXTUAL, 0.9)));

        AnalysisResponse res = orchestrator.analyze(PHOTO, "p.png", MediaKind.IMAGE);

        assertThat(res.crossReference().preliminaryVerdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(res.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(res.hitlRequired()).isTrue();
    }

    @Test
    void authenticWithHighAnomalyIsChallengedThroughThePipeline() {
        // 가중치 보정이 틀어져 high 이상 징후가 있어도 authentic 을 내는 집계기
        CrossReferenceAggregator miscalibrated = new CrossReferenceAggregator() {
            @Override
            public CrossReferenceResult aggregate(List<OpinionRecord> opinions) {
                return cross(0.9, Verdict.AUTHENTIC);
            }
        };
        OpinionProvider flagged = provider(SourceKinds.FORENSIC_TECHNICAL, 0.9,
                Anomaly.at("ela", "압축 오차가 국소적으로 튑니다.", Severity.HIGH, 40, 40));
        AnalysisOrchestrator orchestrator = new AnalysisOrchestrator(
                List.of(flagged, fixed(SourceKinds.CONTEXTUAL, 0.9)), miscalibrated,
                new AdversarialCritiqueEngine(new CritiqueHistory(20)), pool, 1);

        AnalysisResponse res = orchestrator.analyze(PHOTO, "p.png", MediaKind.IMAGE);

        assertThat(res.critique().challenges()).filteredOn(Challenge::isVerdictChallenge)
                .singleElement()
                .satisfies(c -> assertThat(c.severity()).isEqualTo(Severity.HIGH));
        assertThat(res.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(res.hitlRequired()).isTrue();
    }

    @Test
    void noOpinionsEndInconclusiveWithHitl() {
        AnalysisResponse res = orchestrator(List.of()).analyze(PHOTO, "p.png", MediaKind.IMAGE);

        assertThat(res.opinions()).isEmpty();
        assertThat(res.crossReference().combinedScore()).isEqualTo(0.5);
        assertThat(res.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(res.hitlRequired()).isTrue();
        assertThat(res.hitlRecommendation()).isNotBlank();
    }

    @Test
    void confidenceIsClamped() {
        FinalVerdict high = AnalysisOrchestrator.decide(cross(1.0, Verdict.AUTHENTIC), critique(0.05, ThreatLevel.LOW));
        assertThat(high.confidence()).isEqualTo(0.99);

        FinalVerdict low = AnalysisOrchestrator.decide(cross(0.0, Verdict.FORGED), critique(-0.03, ThreatLevel.LOW));
        assertThat(low.confidence()).isEqualTo(0.05);
    }

    @Test
    void verdictChallengeForcesInconclusiveAndHitl() {
        Challenge challenge = new Challenge(Challenge.VERDICT_CHALLENGE, null, "", Severity.HIGH, "");
        CritiqueResult critique = new CritiqueResult(List.of(challenge), List.of(), List.of(), 0.0,
                ThreatLevel.MEDIUM, "", 1);

        FinalVerdict fin = AnalysisOrchestrator.decide(cross(0.8, Verdict.AUTHENTIC), critique);

        assertThat(fin.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(fin.hitlRequired()).isTrue();
        assertThat(fin.confidence()).isEqualTo(0.8);
    }

    @Test
    void cleanAuthenticNeedsNoReview() {
        FinalVerdict fin = AnalysisOrchestrator.decide(cross(0.85, Verdict.AUTHENTIC), critique(0.0, ThreatLevel.LOW));

        assertThat(fin.verdict()).isEqualTo(Verdict.AUTHENTIC);
        assertThat(fin.hitlRequired()).isFalse();
    }

    @Test
    void authenticFallsToInconclusiveWhenAdjustedBelowThreshold() {
        FinalVerdict fin = AnalysisOrchestrator.decide(cross(0.76, Verdict.AUTHENTIC), critique(-0.03, ThreatLevel.LOW));

        assertThat(fin.verdict()).isEqualTo(Verdict.INCONCLUSIVE);
        assertThat(fin.confidence()).isEqualTo(0.73);
        assertThat(fin.hitlRequired()).isTrue();
    }

    @Test
    void forgedStaysForgedButBlindSpotsRequireReview() {
        CritiqueResult critique = new CritiqueResult(List.of(),
                List.of(new BlindSpot("system", "", "missing_capability"), new BlindSpot("system", "", "missing_agent")),
                List.of(), 0.0, ThreatLevel.LOW, "", 1);

        FinalVerdict fin = AnalysisOrchestrator.decide(cross(0.3, Verdict.FORGED), critique);

        assertThat(fin.verdict()).isEqualTo(Verdict.FORGED);
        assertThat(fin.hitlRequired()).isTrue();
    }

    @Test
    void mediumThreatRequiresReview() {
        FinalVerdict fin = AnalysisOrchestrator.decide(cross(0.9, Verdict.AUTHENTIC), critique(0.0, ThreatLevel.MEDIUM));

        assertThat(fin.verdict()).isEqualTo(Verdict.AUTHENTIC);
        assertThat(fin.hitlRequired()).isTrue();
    }

    private AnalysisOrchestrator orchestrator(List<OpinionProvider> providers) {
        return orchestrator(providers, pool);
    }

    private static AnalysisOrchestrator orchestrator(List<OpinionProvider> providers, Executor executor) {
        return new AnalysisOrchestrator(providers, new CrossReferenceAggregator(),
                new AdversarialCritiqueEngine(new CritiqueHistory(20)), executor, 1);
    }

    private static OpinionProvider fixed(String kind, double confidence) {
        return provider(kind, confidence);
    }

    private static OpinionProvider provider(String kind, double confidence, Anomaly... anomalies) {
        return new OpinionProvider() {
            @Override public String sourceKind() { return kind; }
            @Override public OpinionRecord analyze(byte[] b, String f) {
                return new OpinionRecord(kind, confidence, Map.of(), List.of(anomalies));
            }
        };
    }

    private static CrossReferenceResult cross(double score, Verdict verdict) {
        return new CrossReferenceResult(score, verdict, "", AnomalySummary.empty());
    }

    private static CritiqueResult critique(double adjustment, ThreatLevel threat) {
        return new CritiqueResult(List.of(), List.of(), List.of(), adjustment, threat, "", 1);
    }
}
