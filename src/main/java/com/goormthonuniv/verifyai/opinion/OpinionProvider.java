package com.goormthonuniv.verifyai.opinion;

import com.goormthonuniv.verifyai.dto.OpinionRecord;

public interface OpinionProvider {
    String sourceKind(); // "forensic_technical", "physical", "contextual", "ai_generation"

    /**
     * 파일 하나에 대한 독립 의견.
     * 디코딩 실패/네트워크 오류/키 미설정 같은 복구 가능한 상황에서는 던지지 말고
     * 낮은 신뢰도의 레코드나 대체 의견을 돌려준다.
     */
    OpinionRecord analyze(byte[] fileBytes, String filename);
}
