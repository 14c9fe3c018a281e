package com.goormthonuniv.verifyai.service;

import com.goormthonuniv.verifyai.config.AsyncConfig;
import com.goormthonuniv.verifyai.critique.AdversarialCritiqueEngine;
import com.goormthonuniv.verifyai.dto.AnalysisResponse;
import com.goormthonuniv.verifyai.dto.CritiqueResult;
import com.goormthonuniv.verifyai.dto.CrossReferenceResult;
import com.goormthonuniv.verifyai.dto.FinalVerdict;
import com.goormthonuniv.verifyai.dto.MediaKind;
import com.goormthonuniv.verifyai.dto.OpinionRecord;
import com.goormthonuniv.verifyai.dto.SourceKinds;
import com.goormthonuniv.verifyai.dto.ThreatLevel;
import com.goormthonuniv.verifyai.dto.Verdict;
import com.goormthonuniv.verifyai.opinion.OpinionProvider;
import com.goormthonuniv.verifyai.util.Digests;
import com.goormthonuniv.verifyai.util.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 4단계 분석:
 * (1) 미디어 종류별 의견 provider 병렬 실행 (2) 교차 집계 (3) 레드팀 비평 (4) 최종 판정 + HITL
 */
@Slf4j
@Service
public class AnalysisOrchestrator {

    static final double MIN_CONFIDENCE = 0.05;
    static final double MAX_CONFIDENCE = 0.99;
    static final double AUTHENTIC_THRESHOLD = 0.75;

    static final String HITL_RECOMMENDATION =
            "신뢰도가 기준에 못 미치거나 레드팀이 위험 요소를 지적했습니다. 전문가(HITL) 검토를 권장합니다.";

    /** 미디어 종류별 실행할 의견 소스 */
    static final Map<MediaKind, List<String>> SOURCES_BY_MEDIA = new EnumMap<>(Map.of(
            MediaKind.IMAGE, List.of(SourceKinds.FORENSIC_TECHNICAL, SourceKinds.PHYSICAL,
                    SourceKinds.CONTEXTUAL, SourceKinds.AI_GENERATION),
            MediaKind.VIDEO, List.of(SourceKinds.FORENSIC_TECHNICAL, SourceKinds.PHYSICAL, SourceKinds.CONTEXTUAL),
            MediaKind.AUDIO, List.of(SourceKinds.FORENSIC_TECHNICAL),
            MediaKind.DOCUMENT, List.of(SourceKinds.FORENSIC_TECHNICAL, SourceKinds.CONTEXTUAL)
    ));

    private final Map<String, OpinionProvider> providers;
    private final CrossReferenceAggregator aggregator;
    private final AdversarialCritiqueEngine critiqueEngine;
    private final Executor executor;
    private final Duration providerTimeout;

    public AnalysisOrchestrator(List<OpinionProvider> providers,
                                CrossReferenceAggregator aggregator,
                                AdversarialCritiqueEngine critiqueEngine,
                                @Qualifier(AsyncConfig.OPINION_EXECUTOR) Executor executor,
                                @Value("${verifyai.orchestrator.provider-timeout-seconds:120}") long providerTimeoutSeconds) {
        this.providers = providers.stream().collect(Collectors.toMap(
                OpinionProvider::sourceKind, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        this.aggregator = aggregator;
        this.critiqueEngine = critiqueEngine;
        this.executor = executor;
        this.providerTimeout = Duration.ofSeconds(providerTimeoutSeconds);
    }

    /** 메인 엔트리 */
    public AnalysisResponse analyze(byte[] fileBytes, String filename, MediaKind mediaKind) {
        MediaKind kind = mediaKind == null ? MediaKind.UNKNOWN : mediaKind;
        String fileHash = Digests.sha256(fileBytes);
        MDC.put("fileHash", fileHash.substring(0, 16));
        try {
            // 1) 의견 수집
            List<OpinionRecord> opinions = collectOpinions(fileBytes, filename, selectProviders(kind));

            // 2) 교차 집계
            CrossReferenceResult cross = aggregator.aggregate(opinions);

            // 3) 레드팀
            CritiqueResult critique = critiqueEngine.challenge(fileBytes, filename, opinions, cross);

            // 4) 최종 판정
            FinalVerdict fin = decide(cross, critique);

            log.info("[VerifyAI] file={} kind={} opinions={} preliminary={} final={} confidence={} hitl={}",
                    filename, kind.tag(), opinions.size(), cross.preliminaryVerdict().tag(),
                    fin.verdict().tag(), fin.confidence(), fin.hitlRequired());

            return new AnalysisResponse(fileHash, kind, opinions, cross, critique,
                    fin.verdict(), fin.confidence(), fin.hitlRequired(),
                    fin.hitlRequired() ? HITL_RECOMMENDATION : null);
        } finally {
            MDC.remove("fileHash");
        }
    }

    // ===================== 내부 =====================

    List<OpinionProvider> selectProviders(MediaKind kind) {
        List<String> wanted = SOURCES_BY_MEDIA.getOrDefault(kind, List.of(SourceKinds.FORENSIC_TECHNICAL));
        List<OpinionProvider> out = new ArrayList<>();
        for (String sourceKind : wanted) {
            OpinionProvider p = providers.get(sourceKind);
            if (p != null) out.add(p);
            else log.warn("[VerifyAI] no provider registered for source={}", sourceKind);
        }
        return out;
    }

    /** 전부 띄우고 전부 기다린 뒤 성공한 것만 모은다. 실패/타임아웃은 의견에서 빠질 뿐 실행을 멈추지 않는다. */
    private List<OpinionRecord> collectOpinions(byte[] bytes, String filename, List<OpinionProvider> selected) {
        List<CompletableFuture<OpinionRecord>> futures = selected.stream()
                .map(p -> submit(p, bytes, filename)
                        .orTimeout(providerTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(ex -> {
                            log.warn("[VerifyAI] provider={} dropped: {}", p.sourceKind(), rootMessage(ex));
                            return null;
                        }))
                .toList();

        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .toList();
    }

    /** 풀이 가득 차 거절되면 실패한 future 로 돌려 다른 실패와 똑같이 버려지게 한다. */
    private CompletableFuture<OpinionRecord> submit(OpinionProvider p, byte[] bytes, String filename) {
        try {
            return CompletableFuture.supplyAsync(() -> p.analyze(bytes, filename), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** 레드팀 결과를 반영한 최종 판정 */
    static FinalVerdict decide(CrossReferenceResult cross, CritiqueResult critique) {
        double adjusted = Numbers.clamp(cross.combinedScore() + critique.confidenceAdjustment(),
                MIN_CONFIDENCE, MAX_CONFIDENCE);
        Verdict base = cross.preliminaryVerdict();

        Verdict verdict;
        if (critique.hasVerdictChallenge() && (base == Verdict.AUTHENTIC || base == Verdict.FORGED)) {
            verdict = Verdict.INCONCLUSIVE;
        } else if (adjusted >= AUTHENTIC_THRESHOLD && base == Verdict.AUTHENTIC) {
            verdict = Verdict.AUTHENTIC;
        } else if (base == Verdict.FORGED) {
            verdict = Verdict.FORGED;
        } else {
            verdict = Verdict.INCONCLUSIVE;
        }

        boolean hitl = verdict == Verdict.INCONCLUSIVE
                || critique.threatLevel() == ThreatLevel.MEDIUM
                || critique.threatLevel() == ThreatLevel.HIGH
                || critique.blindSpots().size() >= 2;

        return new FinalVerdict(verdict, Numbers.round(adjusted, 3), hitl);
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        return t.getClass().getSimpleName() + (t.getMessage() == null ? "" : ": " + t.getMessage());
    }
}
