package com.example.gatekeeper.ratelimit.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding Window Log 에서 사용되는 요청 기록 상태 클래스
 * 타임스탬프(epoch 초)는 오래된 순으로 정렬되어 저장된다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlidingWindowLogState {
    private List<Long> timestamps = new ArrayList<>(); // 윈도우 내 허용된 요청 시각 목록
}
