package com.goormthonuniv.verifyai.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/** 비전 API 키 등 비밀값은 배포 환경의 properties/env.properties 로 주입(선택) */
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}
