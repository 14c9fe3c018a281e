package com.goormthonuniv.verifyai.controller;

import com.goormthonuniv.verifyai.dto.AnalysisResponse;
import com.goormthonuniv.verifyai.dto.MediaKind;
import com.goormthonuniv.verifyai.service.AnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisOrchestrator orchestrator;

    @Operation(summary = "미디어 진위 분석", description = "파일을 업로드하면 에이전트 의견, 교차 검토, 레드팀 비평, 최종 판정과 HITL 필요 여부를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "분석 완료"),
            @ApiResponse(responseCode = "400", description = "빈 파일 또는 지원하지 않는 형식"),
            @ApiResponse(responseCode = "413", description = "파일 크기 초과"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AnalysisResponse> analyze(@RequestPart("file") MultipartFile file,
                                                    @RequestParam(value = "mediaKind", required = false)
                                                    @Pattern(regexp = "(?i)image|video|audio|document",
                                                            message = "image, video, audio, document 중 하나여야 합니다.")
                                                    String mediaKind)
            throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("파일이 비어 있습니다.");
        }
        // mediaKind 를 안 주면 확장자로 추정
        MediaKind kind = (mediaKind == null || mediaKind.isBlank())
                ? MediaKind.fromFilename(file.getOriginalFilename())
                : MediaKind.fromTag(mediaKind);
        if (kind == MediaKind.UNKNOWN) {
            throw new IllegalArgumentException("지원하지 않는 파일 형식입니다: " + file.getOriginalFilename());
        }

        AnalysisResponse res = orchestrator.analyze(file.getBytes(), file.getOriginalFilename(), kind);
        return ResponseEntity.ok(res);
    }
}
