package com.example.gatekeeper.ratelimit.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token Bucket 에서 사용되는 버킷 상태 클래스
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenBucketState {
    private double tokens; // 현재 토큰 수 (소수 허용)
    private long lastRefill; // 마지막 보충 시각 (epoch 초)

    public static TokenBucketState createTokenBucket(double initialTokens, long now) {
        return new TokenBucketState(initialTokens, now);
    }
}
