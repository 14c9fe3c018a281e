package com.goormthonuniv.verifyai.opinion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VisionGatewayTest {

    private static final VisionPrompt PROMPT = new VisionPrompt("physical", "system", "user");
    private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, 1, 2, 3};

    @Mock
    private VisionClient anthropic;

    @Mock
    private VisionClient openai;

    @Test
    void autoFallsBackToSecondClient() {
        names();
        when(anthropic.describe(any(), anyString(), anyString(), anyString())).thenReturn(Optional.empty());
        when(openai.describe(any(), anyString(), anyString(), anyString())).thenReturn(Optional.of("{\"ok\":true}"));
        VisionGateway gateway = new VisionGateway(List.of(openai, anthropic), "auto", 10, 10);

        Optional<VisionAnswer> answer = gateway.ask(IMAGE, PROMPT);

        assertThat(answer).hasValueSatisfying(a -> {
            assertThat(a.client()).isEqualTo("openai");
            assertThat(a.text()).isEqualTo("{\"ok\":true}");
        });
    }

    @Test
    void successfulAnswersAreCached() {
        names();
        when(anthropic.describe(any(), anyString(), anyString(), anyString())).thenReturn(Optional.of("{}"));
        VisionGateway gateway = new VisionGateway(List.of(anthropic, openai), "auto", 10, 10);

        gateway.ask(IMAGE, PROMPT);
        gateway.ask(IMAGE, PROMPT);

        verify(anthropic, times(1)).describe(any(), anyString(), anyString(), anyString());
        verify(openai, never()).describe(any(), anyString(), anyString(), anyString());
    }

    @Test
    void failuresAreNotCached() {
        names();
        when(anthropic.describe(any(), anyString(), anyString(), anyString())).thenReturn(Optional.empty());
        VisionGateway gateway = new VisionGateway(List.of(anthropic), "anthropic", 10, 10);

        assertThat(gateway.ask(IMAGE, PROMPT)).isEmpty();
        assertThat(gateway.ask(IMAGE, PROMPT)).isEmpty();

        verify(anthropic, times(2)).describe(any(), anyString(), anyString(), anyString());
    }

    @Test
    void noneDisablesEveryClient() {
        names();
        VisionGateway gateway = new VisionGateway(List.of(anthropic, openai), "none", 10, 10);

        assertThat(gateway.isEnabled()).isFalse();
        assertThat(gateway.ask(IMAGE, PROMPT)).isEmpty();
    }

    @Test
    void namedProviderUsesOnlyThatClient() {
        names();
        assertThat(VisionGateway.resolveChain(List.of(anthropic, openai), "OpenAI"))
                .extracting(VisionClient::name).containsExactly("openai");
        assertThat(VisionGateway.resolveChain(List.of(anthropic, openai), "gemini")).isEmpty();
    }

    @Test
    void mediaTypeFromMagicBytes() {
        assertThat(VisionGateway.mediaTypeOf(new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}))
                .isEqualTo("image/png");
        assertThat(VisionGateway.mediaTypeOf("GIF89a".getBytes())).isEqualTo("image/gif");
        assertThat(VisionGateway.mediaTypeOf("RIFF0000WEBPVP8 ".getBytes())).isEqualTo("image/webp");
        assertThat(VisionGateway.mediaTypeOf(IMAGE)).isEqualTo("image/jpeg");
    }

    private void names() {
        lenient().when(anthropic.name()).thenReturn("anthropic");
        lenient().when(openai.name()).thenReturn("openai");
    }
}
