package com.goormthonuniv.verifyai.forensic;

import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.OpinionRecord;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.dto.SourceKinds;
import com.goormthonuniv.verifyai.opinion.OpinionProvider;
import com.goormthonuniv.verifyai.util.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 포렌식-기술 분석기. 외부 API 없이 이미지 바이트만으로 조작 흔적을 찾는다.
 * - 메타데이터(EXIF): 제거 여부, 편집 툴 서명, 촬영/수정 시각 불일치
 * - ELA: 재저장 오차 맵의 국소/전역 이상
 * - 압축: 양자화 테이블 분산(이중 압축), 바이트/픽셀
 * - 치수: 생성형 모델의 전형적 출력 해상도
 *
 * 같은 바이트에 대해 항상 같은 결과를 낸다(난수/시간 의존 없음).
 */
@Slf4j
@Component
public class SignalAnalyzer implements OpinionProvider {

    static final double BASE_CONFIDENCE = 0.92;
    static final double CONFIDENCE_FLOOR = 0.15;
    static final double DEGRADED_CONFIDENCE = 0.5;

    static final double QTABLE_STD_LIMIT = 25.0;
    static final double MIN_JPEG_BYTES_PER_PIXEL = 0.1;

    static final List<String> EDITING_TOOLS = List.of("photoshop", "gimp", "lightroom", "snapseed", "picsart", "canva");

    /** 생성형 모델(DALL-E, Midjourney, Stable Diffusion 등)의 대표 출력 크기 */
    static final Set<String> GENERATIVE_DIMENSIONS = Set.of(
            "512x512", "768x768", "1024x1024", "1024x1792", "1792x1024",
            "512x768", "768x512", "1024x768", "768x1024"
    );

    private final ErrorLevelAnalyzer ela = new ErrorLevelAnalyzer();

    @Override
    public String sourceKind() {
        return SourceKinds.FORENSIC_TECHNICAL;
    }

    @Override
    public OpinionRecord analyze(byte[] fileBytes, String filename) {
        try {
            return DecodedImage.decode(fileBytes)
                    .map(img -> inspect(fileBytes, img))
                    .orElseGet(() -> degraded("파일을 이미지로 열 수 없습니다."));
        } catch (RuntimeException e) {
            log.warn("[VerifyAI] forensic analysis failed file={} error={}", filename, e.toString());
            return degraded("이미지 분석 중 오류가 발생했습니다: " + e.getMessage());
        }
    }

    private OpinionRecord inspect(byte[] bytes, DecodedImage img) {
        List<Anomaly> anomalies = new ArrayList<>();
        Map<String, Object> findings = new LinkedHashMap<>();
        JpegSegments segments = img.isJpeg() ? JpegSegments.read(bytes) : JpegSegments.read(null);

        // 1) 메타데이터
        findings.put("exif", checkMetadata(segments, anomalies));

        // 2) ELA
        findings.put("ela", checkErrorLevel(img, anomalies));

        // 3) 압축
        findings.put("compression", checkCompression(bytes, img, segments, anomalies));

        // 4) 치수
        findings.put("dimensions", checkDimensions(img, anomalies));

        return new OpinionRecord(sourceKind(), score(anomalies), findings, anomalies);
    }

    // ===================== 세부 분석 =====================

    private Map<String, Object> checkMetadata(JpegSegments segments, List<Anomaly> out) {
        Map<String, String> exif = segments.hasExif() ? readExif(segments.exifPayload()) : Map.of();

        Map<String, Object> f = new LinkedHashMap<>();
        f.put("hasExif", !exif.isEmpty());
        f.put("exifTagsCount", exif.size());

        if (exif.isEmpty()) {
            out.add(Anomaly.at("metadata",
                    "EXIF 메타데이터가 전혀 없습니다. 출처를 숨기기 위해 의도적으로 제거되었을 수 있습니다.",
                    Severity.MEDIUM, 90, 10));
            return f;
        }

        String software = exif.getOrDefault(ExifReader.SOFTWARE, "");
        if (!software.isBlank()) {
            f.put("software", software);
            String lower = software.toLowerCase(Locale.ROOT);
            if (EDITING_TOOLS.stream().anyMatch(lower::contains)) {
                out.add(Anomaly.at("editing_software",
                        "메타데이터에서 편집 프로그램이 확인되었습니다: " + software + ". 이미지가 가공되었습니다.",
                        Severity.MEDIUM, 85, 8));
            }
        }

        String original = exif.getOrDefault(ExifReader.DATE_TIME_ORIGINAL, "");
        String modified = exif.getOrDefault(ExifReader.DATE_TIME, "");
        if (!original.isBlank() && !modified.isBlank() && !original.equals(modified)) {
            f.put("dateOriginal", original);
            f.put("dateModified", modified);
            out.add(Anomaly.at("timestamp_mismatch",
                    "촬영 시각(" + original + ")과 수정 시각(" + modified + ")이 다릅니다.",
                    Severity.HIGH, 80, 15));
        }
        return f;
    }

    /** 깨진 EXIF 는 "쓸 수 있는 EXIF 없음"으로 본다. 나머지 분석은 계속한다. */
    private static Map<String, String> readExif(byte[] payload) {
        try {
            return ExifReader.read(payload);
        } catch (RuntimeException e) {
            log.warn("[VerifyAI] unreadable EXIF ignored: {}", e.toString());
            return Map.of();
        }
    }

    private Map<String, Object> checkErrorLevel(DecodedImage img, List<Anomaly> out) {
        try {
            ErrorLevelAnalyzer.Report report = ela.analyze(img.image());
            out.addAll(report.anomalies());
            return report.findings();
        } catch (IOException | RuntimeException e) {
            log.warn("[VerifyAI] ELA skipped: {}", e.getMessage());
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("elaError", String.valueOf(e.getMessage()));
            return f;
        }
    }

    private Map<String, Object> checkCompression(byte[] bytes, DecodedImage img, JpegSegments segments, List<Anomaly> out) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("format", img.format());
        f.put("fileSizeBytes", bytes.length);
        f.put("mode", img.mode());

        if (img.isJpeg() && !segments.quantizationTables().isEmpty()) {
            f.put("quantizationTables", segments.quantizationTables().size());
            double qStd = populationStd(segments.quantizationTables().get(0));
            f.put("qTableStd", Numbers.round(qStd, 2));
            if (qStd > QTABLE_STD_LIMIT) {
                out.add(Anomaly.at("double_compression",
                        "JPEG 이중 압축 흔적이 있습니다. 편집 후 다시 저장되었을 수 있습니다.",
                        Severity.MEDIUM, 50, 85));
            }
        }

        if (img.pixels() > 0) {
            double bpp = img.bytesPerPixel(bytes.length);
            f.put("bytesPerPixel", Numbers.round(bpp, 4));
            if (img.isJpeg() && bpp < MIN_JPEG_BYTES_PER_PIXEL) {
                out.add(Anomaly.at("compression",
                        String.format(Locale.ROOT,
                                "압축률이 비정상적으로 높습니다(%.3f bytes/pixel). 여러 번 다시 저장되었을 수 있습니다.", bpp),
                        Severity.LOW, 15, 90));
            }
        }
        return f;
    }

    private Map<String, Object> checkDimensions(DecodedImage img, List<Anomaly> out) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("width", img.width());
        f.put("height", img.height());
        f.put("megapixels", Numbers.round(img.pixels() / 1e6, 2));

        if (GENERATIVE_DIMENSIONS.contains(img.width() + "x" + img.height())) {
            out.add(Anomaly.at("dimensions",
                    "이미지 크기(%dx%d)가 생성형 AI 모델(DALL-E, Midjourney, Stable Diffusion 등)의 전형적 출력과 일치합니다."
                            .formatted(img.width(), img.height()),
                    Severity.MEDIUM, 10, 10));
        }
        return f;
    }

    // ===================== 점수 =====================

    /** 0.92 에서 심각도별 감점, 하한 0.15 */
    static double score(List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) return BASE_CONFIDENCE;
        double penalty = anomalies.stream().mapToDouble(a -> a.severity().penalty()).sum();
        return Math.max(CONFIDENCE_FLOOR, Numbers.round(BASE_CONFIDENCE - penalty, 2));
    }

    static double populationStd(int[] values) {
        if (values.length == 0) return 0.0;
        double mean = 0;
        for (int v : values) mean += v;
        mean /= values.length;
        double acc = 0;
        for (int v : values) acc += (v - mean) * (v - mean);
        return Math.sqrt(acc / values.length);
    }

    private OpinionRecord degraded(String reason) {
        return new OpinionRecord(sourceKind(), DEGRADED_CONFIDENCE, Map.of(),
                List.of(Anomaly.of("format", reason, Severity.MEDIUM)));
    }
}
