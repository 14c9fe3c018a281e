package com.goormthonuniv.verifyai.opinion;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.verifyai.util.Digests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 설정으로 고른 비전 클라이언트들을 순서대로 시도한다.
 * verifyai.vision.provider:
 *   auto      -> anthropic, 실패 시 openai (기본)
 *   anthropic -> anthropic 만
 *   openai    -> openai 만
 *   none      -> 호출하지 않음 (모든 provider 가 대체 의견 사용)
 * 같은 파일+프롬프트의 성공 응답은 캐시한다.
 */
@Slf4j
@Component
public class VisionGateway {

    private static final List<String> AUTO_ORDER = List.of("anthropic", "openai");

    private final List<VisionClient> chain;
    private final Cache<String, VisionAnswer> answers;

    public VisionGateway(List<VisionClient> clients,
                         @Value("${verifyai.vision.provider:auto}") String provider,
                         @Value("${verifyai.vision.cache.ttl-minutes:30}") long ttlMinutes,
                         @Value("${verifyai.vision.cache.max-size:500}") long maxSize) {
        this.chain = resolveChain(clients, provider);
        this.answers = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(ttlMinutes))
                .maximumSize(maxSize)
                .build();
        log.info("[VerifyAI] vision provider={} chain={}", provider,
                chain.stream().map(VisionClient::name).toList());
    }

    public boolean isEnabled() {
        return !chain.isEmpty();
    }

    public Optional<VisionAnswer> ask(byte[] image, VisionPrompt prompt) {
        if (chain.isEmpty() || image == null || image.length == 0) return Optional.empty();
        String key = Digests.sha256(image) + ":" + prompt.key();
        return Optional.ofNullable(answers.get(key, k -> callChain(image, prompt)));
    }

    private VisionAnswer callChain(byte[] image, VisionPrompt prompt) {
        String mediaType = mediaTypeOf(image);
        for (VisionClient client : chain) {
            Optional<String> text = client.describe(image, mediaType, prompt.system(), prompt.user());
            if (text.isPresent()) return new VisionAnswer(client.name(), text.get());
            log.debug("[VerifyAI] vision client={} gave no answer for prompt={}", client.name(), prompt.key());
        }
        return null;
    }

    static List<VisionClient> resolveChain(List<VisionClient> clients, String provider) {
        Map<String, VisionClient> byName = clients.stream()
                .collect(Collectors.toMap(VisionClient::name, Function.identity(), (a, b) -> a));
        String mode = provider == null ? "auto" : provider.strip().toLowerCase(Locale.ROOT);

        List<String> order = switch (mode) {
            case "none", "off" -> List.of();
            case "auto" -> AUTO_ORDER;
            default -> List.of(mode);
        };
        List<VisionClient> out = new ArrayList<>();
        for (String name : order) {
            VisionClient c = byName.get(name);
            if (c != null) out.add(c);
            else log.warn("[VerifyAI] vision provider '{}' is not available", name);
        }
        return List.copyOf(out);
    }

    /** 매직 바이트로 이미지 MIME 추정 (기본 jpeg) */
    static String mediaTypeOf(byte[] b) {
        if (b.length >= 8 && (b[0] & 0xFF) == 0x89 && b[1] == 'P' && b[2] == 'N' && b[3] == 'G') return "image/png";
        if (b.length >= 12 && b[0] == 'R' && b[1] == 'I' && b[2] == 'F' && b[3] == 'F'
                && b[8] == 'W' && b[9] == 'E' && b[10] == 'B' && b[11] == 'P') return "image/webp";
        if (b.length >= 6 && b[0] == 'G' && b[1] == 'I' && b[2] == 'F') return "image/gif";
        return "image/jpeg";
    }
}
