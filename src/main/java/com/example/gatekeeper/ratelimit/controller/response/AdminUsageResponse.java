package com.example.gatekeeper.ratelimit.controller.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 관리자 사용량 조회 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminUsageResponse {
    private String rule; // 조회한 규칙 (URL 패턴 또는 default)
    private List<Map<String, Object>> usage; // 규칙에 포함된 limit 별 사용량
    private LocalDateTime timestamp; // 응답 생성 시간 (UTC)
}
