package com.goormthonuniv.verifyai.forensic;

import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.support.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorLevelAnalyzerTest {

    private final ErrorLevelAnalyzer ela = new ErrorLevelAnalyzer();

    @Test
    void identicalImagesHaveNoError() {
        BufferedImage img = TestImages.solid(64, 64, 100);

        ErrorLevelAnalyzer.Report r = ela.inspect(img, img);

        assertThat(r.anomalies()).isEmpty();
        assertThat(r.findings()).containsEntry("meanError", 0.0)
                .containsEntry("maxError", 0.0)
                .containsEntry("regionAnalysis", true);
    }

    @Test
    void singleHotRegionIsLocatedAtItsCentre() {
        BufferedImage original = TestImages.solid(64, 64, 100);
        BufferedImage resaved = TestImages.solid(64, 64, 100);
        Graphics2D g = resaved.createGraphics();
        g.setColor(new Color(200, 200, 200));
        g.fillRect(0, 0, 16, 16); // 좌상단 셀 전체
        g.dispose();

        ErrorLevelAnalyzer.Report r = ela.inspect(original, resaved);

        // 오차: 1/16 영역이 100, 나머지 0 -> 평균 6.25, 표준편차 약 24.2
        assertThat(r.anomalies()).extracting(Anomaly::type).containsExactly("ela", "ela_global");
        Anomaly region = r.anomalies().get(0);
        assertThat(region.severity()).isEqualTo(Severity.HIGH);
        assertThat(region.location()).isEqualTo(new Anomaly.Location(12, 12));
        assertThat(region.description()).contains("16.0");
        assertThat(r.findings()).containsEntry("meanError", 6.25).containsEntry("maxError", 100.0);
    }

    @Test
    void tinyImageSkipsRegionAnalysis() {
        BufferedImage img = TestImages.solid(3, 3, 10);

        ErrorLevelAnalyzer.Report r = ela.inspect(img, img);

        assertThat(r.findings()).containsEntry("regionAnalysis", false);
    }

    @Test
    void uniformJpegSurvivesResaveUnchanged() throws Exception {
        BufferedImage decoded = DecodedImage.decode(TestImages.jpeg(TestImages.solid(128, 128, 128)))
                .orElseThrow().image();

        ErrorLevelAnalyzer.Report r = ela.analyze(decoded);

        assertThat(r.anomalies()).isEmpty();
    }
}
