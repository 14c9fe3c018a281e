package com.goormthonuniv.verifyai.opinion;

/** 응답한 클라이언트 이름 + 원문 텍스트 */
public record VisionAnswer(String client, String text) {}
