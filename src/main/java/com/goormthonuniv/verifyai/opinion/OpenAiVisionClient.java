package com.goormthonuniv.verifyai.opinion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class OpenAiVisionClient implements VisionClient {

    private static final String ENDPOINT = "https://api.openai.com/v1/chat/completions";

    private final RestClient rest;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public OpenAiVisionClient(@Qualifier("visionRestClient") RestClient rest,
                              @Value("${verifyai.vision.openai.api-key:}") String apiKey,
                              @Value("${verifyai.vision.openai.model:gpt-4o}") String model,
                              @Value("${verifyai.vision.openai.max-tokens:1500}") int maxTokens) {
        this.rest = rest;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override public String name() { return "openai"; }

    @Override
    public Optional<String> describe(byte[] image, String mediaType, String systemPrompt, String userPrompt) {
        if (apiKey == null || apiKey.isBlank()) return Optional.empty();

        String dataUrl = "data:" + mediaType + ";base64," + Base64.getEncoder().encodeToString(image);
        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "temperature", 0,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", List.of(
                                Map.of("type", "text", "text", userPrompt),
                                Map.of("type", "image_url", "image_url", Map.of("url", dataUrl, "detail", "high"))
                        ))
                )
        );

        try {
            Map<String, Object> res = rest.post()
                    .uri(ENDPOINT)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});

            if (res == null || !(res.get("choices") instanceof List<?> choices) || choices.isEmpty()) {
                return Optional.empty();
            }
            if (choices.get(0) instanceof Map<?, ?> choice
                    && choice.get("message") instanceof Map<?, ?> message
                    && message.get("content") instanceof String content
                    && !content.isBlank()) {
                return Optional.of(content);
            }
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("[VerifyAI] vision client={} error={}", name(), e.getMessage());
            return Optional.empty();
        }
    }
}
