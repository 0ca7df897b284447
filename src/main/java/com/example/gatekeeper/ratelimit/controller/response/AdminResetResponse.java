package com.example.gatekeeper.ratelimit.controller.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 관리자 리셋 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminResetResponse {
    private String message; // 응답 메시지
    private String rule; // 리셋한 규칙
    private int resetLimits; // 리셋된 limit 수
    private LocalDateTime timestamp; // 응답 생성 시간 (UTC)
}
