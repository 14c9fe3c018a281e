package com.goormthonuniv.verifyai.critique;

import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.BlindSpot;
import com.goormthonuniv.verifyai.dto.Challenge;
import com.goormthonuniv.verifyai.dto.CritiqueResult;
import com.goormthonuniv.verifyai.dto.CrossReferenceResult;
import com.goormthonuniv.verifyai.dto.OpinionRecord;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.dto.SourceKinds;
import com.goormthonuniv.verifyai.dto.ThreatLevel;
import com.goormthonuniv.verifyai.dto.Verdict;
import com.goormthonuniv.verifyai.forensic.DecodedImage;
import com.goormthonuniv.verifyai.util.Digests;
import com.goormthonuniv.verifyai.util.Numbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 레드팀. 1차 판정과 각 의견을 반박해 보고, 놓친 부분(사각지대)과 신뢰도 보정을 제안한다.
 *
 * 다섯 개의 독립 모듈을 같은 입력에 대해 돌린다:
 * <ol>
 *   <li>오탐(false positive) 점검</li>
 *   <li>미탐(false negative)/사각지대 점검</li>
 *   <li>소스 간 일관성 점검</li>
 *   <li>엣지 케이스(해상도, 흑백, 디코딩 불가)</li>
 *   <li>판정 자체에 대한 반박</li>
 * </ol>
 * 입력(opinions, crossReference)은 불변 레코드이며 여기서 바꾸지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdversarialCritiqueEngine {

    static final double SOCIAL_RECOMPRESSION_BPP = 0.3;
    static final double RECOMPRESSION_ADJUSTMENT = 0.05;
    static final double SILENT_CONFIDENCE = 0.8;
    static final double CONSISTENCY_GAP = 0.30;
    static final double DISAGREEMENT_ADJUSTMENT = -0.03;
    static final double FORENSIC_CONTEXT_GAP = 0.25;
    /** 포렌식/맥락 비교에서 의견이 없는 쪽의 점수 */
    static final double MISSING_SOURCE_SCORE = 0.5;
    static final int MIN_RELIABLE_SIDE = 200;
    static final int CROP_CHECK_SIDE = 5000;
    static final double FORGED_SCORE_CONTRADICTION = 0.7;
    static final int TREND_WINDOW = 5;
    static final double OVER_SENSITIVE_AVERAGE = 3.0;

    private static final Set<String> ELA_TYPES = Set.of("ela", "ela_global");

    private final CritiqueHistory history;

    /** 모듈 하나의 산출물. adjustment 가 null 이면 보정 제안 없음(0 과 다름). */
    private record ModuleOutcome(List<Challenge> challenges,
                                 List<BlindSpot> blindSpots,
                                 List<String> recommendations,
                                 Double adjustment) {

        static ModuleOutcome challenges(List<Challenge> challenges, Double adjustment) {
            return new ModuleOutcome(challenges, List.of(), List.of(), adjustment);
        }

        static ModuleOutcome blindSpots(List<BlindSpot> blindSpots) {
            return new ModuleOutcome(List.of(), blindSpots, List.of(), null);
        }
    }

    public CritiqueResult challenge(byte[] fileBytes, String filename,
                                    List<OpinionRecord> opinions, CrossReferenceResult crossReference) {
        List<OpinionRecord> ops = opinions == null ? List.of() : opinions;
        Optional<DecodedImage> image = DecodedImage.decode(fileBytes);
        int fileSize = fileBytes == null ? 0 : fileBytes.length;

        List<ModuleOutcome> outcomes = List.of(
                run("false_positive", () -> checkFalsePositives(ops, image, fileSize)),
                run("false_negative", () -> checkFalseNegatives(ops)),
                run("cross_consistency", () -> checkCrossConsistency(ops)),
                run("edge_case", () -> checkEdgeCases(image)),
                run("verdict", () -> challengeVerdict(crossReference, ops))
        );

        List<Challenge> challenges = new ArrayList<>();
        List<BlindSpot> blindSpots = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        List<Double> adjustments = new ArrayList<>();
        for (ModuleOutcome o : outcomes) {
            challenges.addAll(o.challenges());
            blindSpots.addAll(o.blindSpots());
            recommendations.addAll(o.recommendations());
            if (o.adjustment() != null) adjustments.add(o.adjustment());
        }

        double adjustment = Numbers.round(
                adjustments.stream().mapToDouble(Double::doubleValue).average().orElse(0.0), 3);
        boolean verdictChallenged = challenges.stream().anyMatch(Challenge::isVerdictChallenge);

        // 이력: 최근 5건 추세를 읽고 이번 실행을 추가 (한 번에)
        CritiqueHistory.Trend trend = history.recordRun(new CritiqueHistory.Entry(
                Instant.now(), Digests.shortSha256(fileBytes), challenges.size(), blindSpots.size(),
                adjustment, verdictChallenged), TREND_WINDOW);

        recommendations.addAll(recommend(challenges, blindSpots, trend));
        ThreatLevel threat = threatLevel(challenges, blindSpots);

        log.info("[VerifyAI] red-team file={} challenges={} blindSpots={} adjustment={} threat={}",
                filename, challenges.size(), blindSpots.size(), adjustment, threat.tag());

        return new CritiqueResult(challenges, blindSpots, recommendations, adjustment, threat,
                summary(challenges, blindSpots, recommendations, threat), trend.size());
    }

    // ===================== 모듈 =====================

    /** 1) 오탐: ELA 이상이 SNS 재압축 때문일 수 있는지, EXIF 부재가 정말 의심스러운지 */
    private ModuleOutcome checkFalsePositives(List<OpinionRecord> opinions, Optional<DecodedImage> image, int fileSize) {
        Optional<OpinionRecord> forensic = opinions.stream()
                .filter(o -> SourceKinds.FORENSIC_TECHNICAL.equals(o.sourceKind()))
                .findFirst();
        if (forensic.isEmpty()) return ModuleOutcome.challenges(List.of(), null);

        List<Challenge> out = new ArrayList<>();
        Double adjustment = null;
        List<Anomaly> items = forensic.get().anomalies();

        boolean hasEla = items.stream().anyMatch(a -> ELA_TYPES.contains(a.type()));
        if (hasEla && image.isPresent() && image.get().isJpeg()) {
            double bpp = image.get().bytesPerPixel(fileSize);
            if (bpp < SOCIAL_RECOMPRESSION_BPP) {
                out.add(new Challenge("false_positive_risk", SourceKinds.FORENSIC_TECHNICAL,
                        "ELA 이상은 SNS/메신저 공유 과정의 정상적인 반복 압축 때문일 수 있습니다. 압축 비율이 여러 번 저장된 파일의 특징을 보입니다.",
                        Severity.MEDIUM,
                        "포렌식 신뢰도가 과소평가되었을 수 있습니다(오탐)."));
                adjustment = RECOMPRESSION_ADJUSTMENT;
            }
        }

        if (items.stream().anyMatch(a -> "metadata".equals(a.type()))) {
            out.add(new Challenge("false_positive_risk", SourceKinds.FORENSIC_TECHNICAL,
                    "EXIF 부재가 곧 위조를 뜻하지는 않습니다. 많은 플랫폼이 업로드 시 메타데이터를 자동으로 제거합니다.",
                    Severity.LOW,
                    "EXIF 부재만으로는 충분한 증거가 되지 않습니다."));
        }
        return ModuleOutcome.challenges(out, adjustment);
    }

    /** 2) 미탐: 아무것도 못 찾고 확신만 높은 소스, 빠진 탐지 능력/에이전트 */
    private ModuleOutcome checkFalseNegatives(List<OpinionRecord> opinions) {
        List<BlindSpot> out = new ArrayList<>();

        for (OpinionRecord o : opinions) {
            if (!o.hasAnomalies() && o.confidence() > SILENT_CONFIDENCE) {
                out.add(new BlindSpot(o.sourceKind(),
                        "%s 소스가 발견 사항 없이 높은 신뢰도(%s)를 보고했습니다. 충분히 검사했는지 의문입니다."
                                .formatted(o.sourceKind(), Numbers.percent(o.confidence())),
                        "false_negative"));
            }
        }

        boolean cloneChecked = opinions.stream()
                .flatMap(o -> o.anomalies().stream())
                .map(a -> a.type().toLowerCase(Locale.ROOT))
                .anyMatch(t -> t.contains("clone") || t.contains("copy_move") || t.contains("copy-move"));
        if (!cloneChecked) {
            out.add(new BlindSpot("system",
                    "copy-move/clone 탐지가 수행되지 않았습니다. 현재 에이전트들을 피해갈 수 있는 흔한 위조 기법입니다.",
                    "missing_capability"));
        }

        if (opinions.stream().noneMatch(o -> SourceKinds.AI_GENERATION.equals(o.sourceKind()))) {
            out.add(new BlindSpot("system",
                    "AI 생성 탐지 에이전트가 실행되지 않았습니다. GAN/diffusion 이미지가 탐지되지 않고 통과할 수 있습니다.",
                    "missing_agent"));
        }
        return ModuleOutcome.blindSpots(out);
    }

    /** 3) 일관성: 소스 간 점수 격차, 포렌식 vs 맥락 불일치 */
    private ModuleOutcome checkCrossConsistency(List<OpinionRecord> opinions) {
        // 같은 소스가 여러 번이면 마지막 값
        Map<String, Double> scores = new LinkedHashMap<>();
        for (OpinionRecord o : opinions) scores.put(o.sourceKind(), o.confidence());

        List<Challenge> out = new ArrayList<>();
        Double adjustment = null;

        if (scores.size() >= 2) {
            Map.Entry<String, Double> hi = null;
            Map.Entry<String, Double> lo = null;
            for (Map.Entry<String, Double> e : scores.entrySet()) {
                if (hi == null || e.getValue() > hi.getValue()) hi = e;
                if (lo == null || e.getValue() < lo.getValue()) lo = e;
            }
            double gap = hi.getValue() - lo.getValue();
            if (gap > CONSISTENCY_GAP) {
                out.add(new Challenge("consistency_gap", null,
                        "%s(%s)와 %s(%s) 사이에 큰 격차(%s)가 있습니다. 둘 중 하나가 틀렸을 수 있습니다."
                                .formatted(hi.getKey(), Numbers.percent(hi.getValue()),
                                        lo.getKey(), Numbers.percent(lo.getValue()), Numbers.percent(gap)),
                        Severity.HIGH,
                        "가중 점수가 오해를 낳을 수 있습니다."));
                adjustment = DISAGREEMENT_ADJUSTMENT;
            }
        }

        double forensic = scores.getOrDefault(SourceKinds.FORENSIC_TECHNICAL, MISSING_SOURCE_SCORE);
        double contextual = scores.getOrDefault(SourceKinds.CONTEXTUAL, MISSING_SOURCE_SCORE);
        if (Math.abs(forensic - contextual) > FORENSIC_CONTEXT_GAP) {
            out.add(new Challenge("cross_disagreement", null,
                    "포렌식과 맥락 분석의 결론이 엇갈립니다. 한 층위만 통과한 정교한 위조이거나, 다른 층위의 오탐일 수 있습니다.",
                    Severity.MEDIUM,
                    "겹치는 지점을 사람이 직접 확인해야 합니다."));
        }
        return ModuleOutcome.challenges(out, adjustment);
    }

    /** 4) 엣지 케이스: 저해상도, 초고해상도(크롭 의심), 흑백, 디코딩 불가 */
    private ModuleOutcome checkEdgeCases(Optional<DecodedImage> image) {
        List<Challenge> challenges = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        if (image.isEmpty()) {
            challenges.add(new Challenge("parse_error", null,
                    "엣지 케이스 점검을 위해 파일을 해석할 수 없었습니다.",
                    Severity.LOW,
                    "엣지 케이스 점검을 건너뛰었습니다."));
            return new ModuleOutcome(challenges, List.of(), recommendations, null);
        }

        DecodedImage img = image.get();
        if (img.width() < MIN_RELIABLE_SIDE || img.height() < MIN_RELIABLE_SIDE) {
            challenges.add(new Challenge("low_resolution", null,
                    "해상도가 낮습니다(%dx%d). 작은 이미지에서는 ELA와 압축 흔적 분석의 신뢰도가 떨어집니다."
                            .formatted(img.width(), img.height()),
                    Severity.HIGH,
                    "모든 발견 사항을 신중하게 해석해야 합니다."));
        }
        if (img.width() > CROP_CHECK_SIDE || img.height() > CROP_CHECK_SIDE) {
            recommendations.add("매우 높은 해상도의 이미지입니다. 더 큰 원본에서 잘라낸(crop) 것인지 확인해 보세요.");
        }
        if (img.isGrayscale()) {
            challenges.add(new Challenge("grayscale", null,
                    "흑백 이미지입니다. 색상/조명 분석과 일부 AI 탐지 검사의 신뢰도가 떨어집니다.",
                    Severity.MEDIUM,
                    "물리/맥락 에이전트가 이상을 놓쳤을 수 있습니다."));
        }
        return new ModuleOutcome(challenges, List.of(), recommendations, null);
    }

    /** 5) 판정 반박: 높은 심각도가 있는데 authentic, 점수가 높은데 forged */
    private ModuleOutcome challengeVerdict(CrossReferenceResult cross, List<OpinionRecord> opinions) {
        List<Challenge> out = new ArrayList<>();
        if (cross == null) return ModuleOutcome.challenges(out, null);

        if (cross.preliminaryVerdict() == Verdict.AUTHENTIC) {
            long high = opinions.stream().mapToLong(o -> o.count(Severity.HIGH)).sum();
            if (high > 0) {
                out.add(new Challenge(Challenge.VERDICT_CHALLENGE, null,
                        "높은 심각도의 이상 징후가 %d건 있는데도 'authentic' 판정이 나왔습니다. 가중치 보정이 잘못되었을 수 있습니다."
                                .formatted(high),
                        Severity.HIGH,
                        "위험한 미탐일 수 있습니다."));
            }
        }

        if (cross.preliminaryVerdict() == Verdict.FORGED && cross.combinedScore() > FORGED_SCORE_CONTRADICTION) {
            out.add(new Challenge(Challenge.VERDICT_CHALLENGE, null,
                    "'forged' 판정이지만 가중 신뢰도가 높습니다(%s). 높은 점수는 진본을 가리켜야 합니다."
                            .formatted(Numbers.percent(cross.combinedScore())),
                    Severity.MEDIUM,
                    "점수와 판정이 서로 모순됩니다."));
        }
        return ModuleOutcome.challenges(out, null);
    }

    // ===================== 집계 =====================

    private List<String> recommend(List<Challenge> challenges, List<BlindSpot> blindSpots, CritiqueHistory.Trend trend) {
        List<String> recs = new ArrayList<>();
        if (challenges.stream().anyMatch(c -> c.severity() == Severity.HIGH)) {
            recs.add("높은 수준의 챌린지가 있습니다. 전문가(HITL) 검증을 권장합니다.");
        }
        if (blindSpots.size() >= 2) {
            recs.add("사각지대가 여러 개 확인되었습니다. 에이전트 구성을 확장하는 것을 검토하세요(clone 탐지, 주파수 분석).");
        }
        trend.recentAverageChallenges().ifPresent(avg -> {
            if (avg > OVER_SENSITIVE_AVERAGE) {
                recs.add(String.format(Locale.ROOT,
                        "최근 %d건의 분석에서 평균 %.1f건의 챌린지가 나왔습니다. 시스템이 과민(over-sensitive)할 수 있습니다.",
                        TREND_WINDOW, avg));
            }
        });
        return recs;
    }

    static ThreatLevel threatLevel(List<Challenge> challenges, List<BlindSpot> blindSpots) {
        long high = challenges.stream().filter(c -> c.severity() == Severity.HIGH).count();
        return threatLevel(high, challenges.size() + blindSpots.size());
    }

    static ThreatLevel threatLevel(long highChallenges, int total) {
        if (highChallenges >= 2 || total >= 5) return ThreatLevel.HIGH;
        if (highChallenges >= 1 || total >= 3) return ThreatLevel.MEDIUM;
        return ThreatLevel.LOW;
    }

    private static String summary(List<Challenge> challenges, List<BlindSpot> blindSpots,
                                  List<String> recommendations, ThreatLevel threat) {
        StringBuilder sb = new StringBuilder()
                .append("레드팀이 챌린지 %d건, 사각지대 %d건을 찾았습니다. ".formatted(challenges.size(), blindSpots.size()))
                .append("위협 수준: ").append(threat.tag()).append('.');
        if (!recommendations.isEmpty()) {
            sb.append(" 개선 권고 ").append(recommendations.size()).append("건.");
        }
        return sb.toString();
    }

    /** 모듈 내부 오류는 low 챌린지로 보고하고 나머지 모듈은 계속 돈다. */
    private ModuleOutcome run(String module, Supplier<ModuleOutcome> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.warn("[VerifyAI] red-team module={} failed: {}", module, e.toString());
            return ModuleOutcome.challenges(List.of(new Challenge("module_error", null,
                    "레드팀 모듈 '" + module + "'을(를) 평가할 수 없었습니다.",
                    Severity.LOW,
                    "해당 점검을 건너뛰었습니다.")), null);
        }
    }
}
