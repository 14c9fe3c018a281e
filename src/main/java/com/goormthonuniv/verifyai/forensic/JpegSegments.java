package com.goormthonuniv.verifyai.forensic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * JPEG 마커 세그먼트 중 포렌식에 필요한 것만 뽑아낸다.
 * - DQT(0xFFDB): 양자화 테이블 (세그먼트 하나에 여러 테이블 가능)
 * - APP1(0xFFE1) "Exif\0\0": TIFF 구조의 EXIF 페이로드
 * SOS 이후(엔트로피 코딩 데이터)는 보지 않는다.
 */
public record JpegSegments(List<int[]> quantizationTables, byte[] exifPayload) {

    private static final JpegSegments NONE = new JpegSegments(List.of(), null);
    private static final byte[] EXIF_HEADER = {'E', 'x', 'i', 'f', 0, 0};

    private static final int SOI = 0xD8;
    private static final int EOI = 0xD9;
    private static final int SOS = 0xDA;
    private static final int DQT = 0xDB;
    private static final int APP1 = 0xE1;

    public boolean hasExif() {
        return exifPayload != null && exifPayload.length > 0;
    }

    public static JpegSegments read(byte[] b) {
        if (b == null || b.length < 4 || (b[0] & 0xFF) != 0xFF || (b[1] & 0xFF) != SOI) return NONE;

        List<int[]> tables = new ArrayList<>();
        byte[] exif = null;
        int pos = 2;

        while (pos + 4 <= b.length) {
            if ((b[pos] & 0xFF) != 0xFF) break;
            int marker = b[pos + 1] & 0xFF;
            if (marker == 0xFF) { // fill byte
                pos++;
                continue;
            }
            pos += 2;
            if (marker == SOI || marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7)) continue;
            if (marker == EOI || marker == SOS) break;

            int len = ((b[pos] & 0xFF) << 8) | (b[pos + 1] & 0xFF);
            if (len < 2 || pos + len > b.length) break;
            int start = pos + 2;
            int end = pos + len;

            if (marker == DQT) {
                readDqt(b, start, end, tables);
            } else if (marker == APP1 && exif == null && startsWith(b, start, end, EXIF_HEADER)) {
                exif = Arrays.copyOfRange(b, start + EXIF_HEADER.length, end);
            }
            pos = end;
        }
        return new JpegSegments(List.copyOf(tables), exif);
    }

    private static void readDqt(byte[] b, int p, int end, List<int[]> out) {
        while (p < end) {
            int precision = (b[p] >> 4) & 0x0F; // 0 = 8bit, 1 = 16bit
            p++;
            int width = precision == 0 ? 1 : 2;
            if (p + 64 * width > end) return;
            int[] values = new int[64];
            for (int i = 0; i < 64; i++) {
                values[i] = width == 1
                        ? b[p + i] & 0xFF
                        : ((b[p + 2 * i] & 0xFF) << 8) | (b[p + 2 * i + 1] & 0xFF);
            }
            out.add(values);
            p += 64 * width;
        }
    }

    private static boolean startsWith(byte[] b, int start, int end, byte[] prefix) {
        if (end - start < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (b[start + i] != prefix[i]) return false;
        }
        return true;
    }
}
