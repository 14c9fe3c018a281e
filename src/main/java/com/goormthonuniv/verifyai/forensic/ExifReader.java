package com.goormthonuniv.verifyai.forensic;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * APP1 Exif 페이로드(TIFF 헤더부터)를 읽어 태그명 -> 문자열 값 맵으로 만든다.
 * IFD0 와 Exif 서브 IFD(0x8769)만 본다. 썸네일 IFD, MakerNote 는 무시.
 */
public final class ExifReader {

    public static final String SOFTWARE = "Software";
    public static final String DATE_TIME = "DateTime";
    public static final String DATE_TIME_ORIGINAL = "DateTimeOriginal";

    private static final int TAG_EXIF_IFD = 0x8769;
    private static final int TYPE_ASCII = 2;
    private static final int TYPE_SHORT = 3;
    private static final int TYPE_LONG = 4;
    private static final int MAX_ENTRIES = 512;
    private static final int MAX_VALUE_LEN = 200;

    private static final Map<Integer, String> TAG_NAMES = Map.ofEntries(
            Map.entry(0x010E, "ImageDescription"),
            Map.entry(0x010F, "Make"),
            Map.entry(0x0110, "Model"),
            Map.entry(0x0112, "Orientation"),
            Map.entry(0x0131, SOFTWARE),
            Map.entry(0x0132, DATE_TIME),
            Map.entry(0x013B, "Artist"),
            Map.entry(0x8298, "Copyright"),
            Map.entry(TAG_EXIF_IFD, "ExifOffset"),
            Map.entry(0x9003, DATE_TIME_ORIGINAL),
            Map.entry(0x9004, "DateTimeDigitized"),
            Map.entry(0xA002, "ExifImageWidth"),
            Map.entry(0xA003, "ExifImageHeight")
    );

    private ExifReader() {}

    public static Map<String, String> read(byte[] tiff) {
        if (tiff == null || tiff.length < 8) return Map.of();

        ByteOrder order;
        if (tiff[0] == 'I' && tiff[1] == 'I') order = ByteOrder.LITTLE_ENDIAN;
        else if (tiff[0] == 'M' && tiff[1] == 'M') order = ByteOrder.BIG_ENDIAN;
        else return Map.of();

        ByteBuffer buf = ByteBuffer.wrap(tiff).order(order);
        if ((buf.getShort(2) & 0xFFFF) != 42) return Map.of();

        Map<String, String> out = new LinkedHashMap<>();
        int exifIfd = readIfd(buf, buf.getInt(4), out);
        if (exifIfd > 0) {
            readIfd(buf, exifIfd, out);
        }
        return Collections.unmodifiableMap(out);
    }

    /** @return Exif 서브 IFD 오프셋 (없으면 -1) */
    private static int readIfd(ByteBuffer buf, int offset, Map<String, String> out) {
        int limit = buf.limit();
        if (offset < 8 || (long) offset + 2 > limit) return -1;

        int count = Math.min(buf.getShort(offset) & 0xFFFF, MAX_ENTRIES);
        int exifPointer = -1;
        for (int i = 0; i < count; i++) {
            int e = offset + 2 + i * 12;
            if (e + 12 > limit) break;

            int tag = buf.getShort(e) & 0xFFFF;
            int type = buf.getShort(e + 2) & 0xFFFF;
            int n = buf.getInt(e + 4);
            String name = TAG_NAMES.getOrDefault(tag, "0x%04X".formatted(tag));

            if (tag == TAG_EXIF_IFD) {
                exifPointer = buf.getInt(e + 8);
            }

            String value = switch (type) {
                case TYPE_ASCII -> ascii(buf, e, n);
                case TYPE_SHORT -> n == 1 ? String.valueOf(buf.getShort(e + 8) & 0xFFFF) : "[" + n + " values]";
                case TYPE_LONG -> n == 1 ? String.valueOf(buf.getInt(e + 8) & 0xFFFFFFFFL) : "[" + n + " values]";
                default -> "[type " + type + " x" + n + "]";
            };
            if (value != null) out.put(name, value);
        }
        return exifPointer;
    }

    private static String ascii(ByteBuffer buf, int entry, int n) {
        if (n <= 0) return "";
        int start = n <= 4 ? entry + 8 : buf.getInt(entry + 8);
        if (start < 0 || (long) start + n > buf.limit()) return null;

        byte[] raw = new byte[n];
        buf.get(start, raw);
        int len = n;
        while (len > 0 && raw[len - 1] == 0) len--;
        String s = new String(raw, 0, len, StandardCharsets.US_ASCII).strip();
        return s.length() > MAX_VALUE_LEN ? s.substring(0, MAX_VALUE_LEN) : s;
    }
}
