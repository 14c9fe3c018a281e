package com.goormthonuniv.verifyai.opinion;

/** key 는 캐시 키 구분용(예: "physical") */
public record VisionPrompt(String key, String system, String user) {}
