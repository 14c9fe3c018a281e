package com.goormthonuniv.verifyai.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Duration;

@Configuration
public class WebConfig {

    /** 비전 API 호출용. 타임아웃은 provider 경계의 책임 */
    @Bean
    public RestClient visionRestClient(@Value("${verifyai.vision.connect-timeout-seconds:10}") long connectTimeout,
                                       @Value("${verifyai.vision.timeout-seconds:90}") long readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(connectTimeout));
        factory.setReadTimeout(Duration.ofSeconds(readTimeout));
        return RestClient.builder().requestFactory(factory).build();
    }

    @Bean
    public WebMvcConfigurer corsConfigurer(@Value("${verifyai.cors.allowed-origins:*}") String[] origins) {
        return new WebMvcConfigurer() {
            @Override public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins(origins)
                        .allowedMethods("GET", "POST", "OPTIONS");
            }
        };
    }
}
