package com.goormthonuniv.verifyai.service;

import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.AnomalySummary;
import com.goormthonuniv.verifyai.dto.CrossReferenceResult;
import com.goormthonuniv.verifyai.dto.OpinionRecord;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.dto.SourceKinds;
import com.goormthonuniv.verifyai.dto.Verdict;
import com.goormthonuniv.verifyai.util.Numbers;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 여러 의견을 하나의 가중 점수 + 1차 판정으로 교차 집계한다.
 * 입력 순서와 무관한 결과를 낸다(가중합/개수 모두 교환법칙 성립, 이름 목록은 정렬).
 */
@Service
public class CrossReferenceAggregator {

    static final double AUTHENTIC_THRESHOLD = 0.75;
    static final double LOW_CONFIDENCE = 0.6;
    static final double NEUTRAL_SCORE = 0.5;

    public CrossReferenceResult aggregate(List<OpinionRecord> opinions) {
        if (opinions == null || opinions.isEmpty()) {
            return new CrossReferenceResult(NEUTRAL_SCORE, Verdict.INCONCLUSIVE,
                    "분석 에이전트로부터 받은 의견이 없습니다. 전문가(HITL) 검토를 권장합니다.",
                    AnomalySummary.empty());
        }

        // 1) 가중 평균
        double weightedSum = 0;
        double totalWeight = 0;
        for (OpinionRecord o : opinions) {
            double w = SourceWeightPolicy.weightOf(o.sourceKind());
            weightedSum += o.confidence() * w;
            totalWeight += w;
        }
        double combined = totalWeight > 0 ? Numbers.round(weightedSum / totalWeight, 3) : NEUTRAL_SCORE;

        // 2) 이상 징후 집계
        List<Anomaly> all = opinions.stream().flatMap(o -> o.anomalies().stream()).toList();
        int high = count(all, Severity.HIGH);
        int medium = count(all, Severity.MEDIUM);
        int low = count(all, Severity.LOW);
        AnomalySummary summary = new AnomalySummary(all.size(), high, medium, low);

        // 3) 판정 (순서대로 첫 매치)
        Verdict verdict;
        if (high >= 3 || (high >= 2 && combined < 0.5)) {
            verdict = Verdict.FORGED;
        } else if (combined >= AUTHENTIC_THRESHOLD && high == 0) {
            verdict = Verdict.AUTHENTIC;
        } else {
            verdict = Verdict.INCONCLUSIVE;
        }

        return new CrossReferenceResult(combined, verdict, reasoning(opinions, combined, summary, verdict), summary);
    }

    private String reasoning(List<OpinionRecord> opinions, double combined, AnomalySummary s, Verdict verdict) {
        List<String> parts = new ArrayList<>();
        parts.add("분석 에이전트 %d개의 의견을 교차 검토했습니다. 가중 신뢰도: %s."
                .formatted(opinions.size(), Numbers.percent(combined)));
        parts.add("이상 징후 %d건 (높음 %d, 중간 %d, 낮음 %d)."
                .formatted(s.total(), s.high(), s.medium(), s.low()));

        List<String> weak = opinions.stream()
                .filter(o -> o.confidence() < LOW_CONFIDENCE)
                .map(OpinionRecord::sourceKind)
                .distinct()
                .sorted()
                .map(SourceWeightPolicy::displayName)
                .toList();
        if (!weak.isEmpty()) {
            parts.add("신뢰도가 낮은 소스: " + String.join(", ", weak) + ".");
        }

        opinions.stream()
                .filter(o -> SourceKinds.AI_GENERATION.equals(o.sourceKind()))
                .filter(o -> Boolean.TRUE.equals(o.findings().get("isAiGenerated")))
                .map(o -> Objects.toString(o.findings().get("likelyTool"), "unknown"))
                .sorted(Comparator.naturalOrder())
                .findFirst()
                .ifPresent(tool -> parts.add("AI 생성 이미지로 판단되었습니다 (추정 도구: " + tool + ")."));

        if (verdict == Verdict.INCONCLUSIVE) {
            parts.add("판정이 불확실하므로 전문가(HITL) 검토를 권장합니다.");
        }
        return String.join(" ", parts);
    }

    private static int count(List<Anomaly> anomalies, Severity severity) {
        return (int) anomalies.stream().filter(a -> a.severity() == severity).count();
    }
}
