package com.goormthonuniv.verifyai.opinion;

import java.util.Optional;

public interface VisionClient {
    String name(); // "anthropic" | "openai"

    /**
     * 이미지 + 프롬프트로 비전 모델에 질의.
     * @return 모델의 텍스트 응답. 키 미설정/네트워크 오류/빈 응답이면 empty (예외를 던지지 않음)
     */
    Optional<String> describe(byte[] image, String mediaType, String systemPrompt, String userPrompt);
}
