package com.goormthonuniv.verifyai.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("VerifyAI Media Authenticity API")
                        .description("이미지/영상/음성/문서의 진위 판정: 포렌식 신호, 교차 검토, 레드팀 비평, HITL 권고")
                        .version("v0.1.0")
                        .contact(new Contact().name("VerifyAI").email("team@verifyai.dev")))
                .externalDocs(new ExternalDocumentation().description("Swagger UI").url("/swagger-ui.html"));
    }
}
