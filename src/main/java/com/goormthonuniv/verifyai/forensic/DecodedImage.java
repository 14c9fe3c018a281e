package com.goormthonuniv.verifyai.forensic;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;

/**
 * ImageIO 로 디코딩한 이미지 + 포맷/모드 정보.
 * mode 는 "RGB", "RGBA", "L", "LA", "P", "CMYK" 중 하나.
 */
@Slf4j
public record DecodedImage(BufferedImage image, String format, int width, int height, String mode) {

    public static Optional<DecodedImage> decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return Optional.empty();
        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (iis == null) return Optional.empty();
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) return Optional.empty();

            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                BufferedImage img = reader.read(0);
                String format = normalizeFormat(reader.getFormatName());
                return Optional.of(new DecodedImage(img, format, img.getWidth(), img.getHeight(), modeOf(img)));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("[VerifyAI] image decode failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isJpeg() {
        return "JPEG".equals(format);
    }

    public boolean isGrayscale() {
        return "L".equals(mode) || "LA".equals(mode);
    }

    public long pixels() {
        return (long) width * height;
    }

    /** 파일 크기 / 픽셀 수. 픽셀이 없으면 0 */
    public double bytesPerPixel(int fileSize) {
        long px = pixels();
        return px > 0 ? (double) fileSize / px : 0.0;
    }

    private static String normalizeFormat(String name) {
        if (name == null) return "UNKNOWN";
        String f = name.toUpperCase(Locale.ROOT);
        return switch (f) {
            case "JPG", "JFIF" -> "JPEG";
            case "TIF" -> "TIFF";
            default -> f;
        };
    }

    private static String modeOf(BufferedImage img) {
        ColorModel cm = img.getColorModel();
        boolean alpha = cm.hasAlpha();
        if (cm instanceof IndexColorModel) return "P";
        int type = cm.getColorSpace().getType();
        if (type == ColorSpace.TYPE_GRAY) return alpha ? "LA" : "L";
        if (type == ColorSpace.TYPE_CMYK) return "CMYK";
        return alpha ? "RGBA" : "RGB";
    }
}
