package com.goormthonuniv.verifyai.forensic;

import com.goormthonuniv.verifyai.dto.Anomaly;
import com.goormthonuniv.verifyai.dto.Severity;
import com.goormthonuniv.verifyai.util.Numbers;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Error Level Analysis.
 * 원본을 JPEG 95% 로 다시 저장한 뒤 채널별 절대 오차를 구하고,
 * 4x4 격자 중 오차가 튀는 영역(붙여넣기/국소 편집 의심)을 찾는다.
 */
public class ErrorLevelAnalyzer {

    static final float RESAVE_QUALITY = 0.95f;
    static final int GRID = 4;
    static final double REGION_RATIO = 2.5;
    static final double REGION_FLOOR = 15.0;
    static final double GLOBAL_STD_LIMIT = 20.0;

    public record Report(Map<String, Object> findings, List<Anomaly> anomalies) {}

    public Report analyze(BufferedImage source) throws IOException {
        BufferedImage rgb = toRgb(source);
        return inspect(rgb, resave(rgb));
    }

    /** 두 이미지의 오차 맵 통계 + 격자 분석. 크기가 다르면 겹치는 부분만 본다. */
    Report inspect(BufferedImage original, BufferedImage resaved) {
        int w = Math.min(original.getWidth(), resaved.getWidth());
        int h = Math.min(original.getHeight(), resaved.getHeight());
        int cellW = w / GRID;
        int cellH = h / GRID;

        double[][] regionSum = new double[GRID][GRID];
        double sum = 0;
        double sumSq = 0;
        int max = 0;
        long n = 0;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int a = original.getRGB(x, y);
                int b = resaved.getRGB(x, y);
                int rowIdx = cellH > 0 ? y / cellH : GRID;
                int colIdx = cellW > 0 ? x / cellW : GRID;
                for (int shift = 16; shift >= 0; shift -= 8) {
                    int d = Math.abs(((a >> shift) & 0xFF) - ((b >> shift) & 0xFF));
                    sum += d;
                    sumSq += (double) d * d;
                    if (d > max) max = d;
                    n++;
                    if (rowIdx < GRID && colIdx < GRID) regionSum[rowIdx][colIdx] += d;
                }
            }
        }

        double mean = n > 0 ? sum / n : 0.0;
        double std = n > 0 ? Math.sqrt(Math.max(0.0, sumSq / n - mean * mean)) : 0.0;

        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("meanError", Numbers.round(mean, 2));
        findings.put("maxError", (double) max);
        findings.put("stdError", Numbers.round(std, 2));

        List<Anomaly> anomalies = new ArrayList<>();

        // 격자가 성립할 때만 국소 분석 (4px 미만 이미지는 건너뜀)
        if (cellW > 0 && cellH > 0) {
            double cellValues = (double) cellW * cellH * 3;
            double[][] regionMean = new double[GRID][GRID];
            double gridMean = 0;
            for (int r = 0; r < GRID; r++) {
                for (int c = 0; c < GRID; c++) {
                    regionMean[r][c] = regionSum[r][c] / cellValues;
                    gridMean += regionMean[r][c];
                }
            }
            gridMean /= GRID * GRID;
            findings.put("regionAnalysis", true);

            for (int r = 0; r < GRID; r++) {
                for (int c = 0; c < GRID; c++) {
                    double m = regionMean[r][c];
                    if (m > gridMean * REGION_RATIO && m > REGION_FLOOR) {
                        double ratio = Numbers.round(m / gridMean, 1);
                        anomalies.add(Anomaly.at("ela",
                                String.format(Locale.ROOT,
                                        "영역 (%d,%d)의 ELA 오차가 평균의 %.1f배입니다. 해당 영역이 편집되었거나 다른 이미지에서 붙여넣어졌을 수 있습니다.",
                                        r + 1, c + 1, ratio),
                                Severity.HIGH,
                                c * 25 + 12, r * 25 + 12));
                    }
                }
            }
        } else {
            findings.put("regionAnalysis", false);
        }

        if (std > GLOBAL_STD_LIMIT) {
            anomalies.add(Anomaly.at("ela_global",
                    String.format(Locale.ROOT,
                            "ELA 오차의 표준편차가 높습니다(%.1f). 이미지 부분마다 압축 이력이 다를 수 있습니다.", std),
                    Severity.MEDIUM, 50, 50));
        }

        return new Report(findings, anomalies);
    }

    static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) return src;
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    static BufferedImage resave(BufferedImage rgb) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) throw new IOException("no JPEG writer available");
        ImageWriter writer = writers.next();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(RESAVE_QUALITY);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(rgb, null, null), param);
        } finally {
            writer.dispose();
        }

        BufferedImage back = ImageIO.read(new ByteArrayInputStream(out.toByteArray()));
        if (back == null) throw new IOException("re-encoded JPEG could not be read back");
        return back;
    }
}
