package com.goormthonuniv.verifyai.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

public enum MediaKind {
    IMAGE(Set.of("jpg", "jpeg", "png", "bmp", "tiff", "webp")),
    VIDEO(Set.of("mp4", "avi", "mov", "mkv", "webm")),
    AUDIO(Set.of("mp3", "wav", "ogg", "flac", "m4a")),
    DOCUMENT(Set.of("pdf", "doc", "docx", "txt", "tif")),
    UNKNOWN(Set.of());

    private final Set<String> extensions;

    MediaKind(Set<String> extensions) {
        this.extensions = extensions;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** "image" 같은 태그를 해석. 모르는 값은 UNKNOWN */
    public static MediaKind fromTag(String tag) {
        if (tag == null || tag.isBlank()) return UNKNOWN;
        for (MediaKind k : values()) {
            if (k.tag().equals(tag.strip().toLowerCase(Locale.ROOT))) return k;
        }
        return UNKNOWN;
    }

    /** 확장자로 미디어 종류 추정 (tiff 는 이미지가 우선) */
    public static MediaKind fromFilename(String filename) {
        if (filename == null) return UNKNOWN;
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return UNKNOWN;
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (MediaKind k : values()) {
            if (k.extensions.contains(ext)) return k;
        }
        return UNKNOWN;
    }
}
