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
public class AnthropicVisionClient implements VisionClient {

    private static final String ENDPOINT = "https://api.anthropic.com/v1/messages";
    private static final String API_VERSION = "2023-06-01";

    private final RestClient rest;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public AnthropicVisionClient(@Qualifier("visionRestClient") RestClient rest,
                                 @Value("${verifyai.vision.anthropic.api-key:}") String apiKey,
                                 @Value("${verifyai.vision.anthropic.model:claude-sonnet-4-20250514}") String model,
                                 @Value("${verifyai.vision.anthropic.max-tokens:2000}") int maxTokens) {
        this.rest = rest;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override public String name() { return "anthropic"; }

    @Override
    public Optional<String> describe(byte[] image, String mediaType, String systemPrompt, String userPrompt) {
        if (apiKey == null || apiKey.isBlank()) return Optional.empty();

        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "system", systemPrompt,
                "messages", List.of(Map.of(
                        "role", "user",
                        "content", List.of(
                                Map.of("type", "image", "source", Map.of(
                                        "type", "base64",
                                        "media_type", mediaType,
                                        "data", Base64.getEncoder().encodeToString(image))),
                                Map.of("type", "text", "text", userPrompt)
                        )
                ))
        );

        try {
            Map<String, Object> res = rest.post()
                    .uri(ENDPOINT)
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});

            if (res == null || !(res.get("content") instanceof List<?> blocks) || blocks.isEmpty()) {
                return Optional.empty();
            }
            if (blocks.get(0) instanceof Map<?, ?> first && first.get("text") instanceof String text && !text.isBlank()) {
                return Optional.of(text);
            }
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("[VerifyAI] vision client={} error={}", name(), e.getMessage());
            return Optional.empty();
        }
    }
}
