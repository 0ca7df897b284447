package com.example.gatekeeper.ratelimit.aspect;

import com.example.gatekeeper.ratelimit.support.MutableClock;
import com.example.gatekeeper.ratelimit.support.TestClockConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * {@code @RateLimit} 어노테이션 통합 테스트
 * 거부 시 RateLimitExceededException 이 429 응답으로 변환되는지 검증합니다.
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@DisplayName("@RateLimit Aspect 통합 테스트")
class RateLimitAspectIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableClock clock;

    @Test
    @DisplayName("사용자 기준 제한 - 한도 초과 사용자만 429, 다른 사용자는 허용")
    void testUserLimit() throws Exception {
        log.info("=== 사용자 기준 @RateLimit 테스트 시작 ===");

        for (int i = 0; i < 10; i++) {
            mockMvc.perform(asUser(get("/api/demo/user"), "alice"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-RateLimit-Limit", "10"));
        }

        mockMvc.perform(asUser(get("/api/demo/user"), "alice"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.status").value(429))
                .andExpect(jsonPath("$.message").isNotEmpty())
                .andExpect(jsonPath("$.rateLimit.identifier").value("user"))
                .andExpect(jsonPath("$.rateLimit.windowSeconds").value(60));

        mockMvc.perform(asUser(get("/api/demo/user"), "bob"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-RateLimit-Remaining", "9"));
    }

    @Test
    @DisplayName("여러 limit 규칙 - 분당 한도를 넘으면 거부")
    void testMultiLimitRule() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(fromIp(get("/api/demo/multi"), "198.51.100.90")).andExpect(status().isOk());
        }

        mockMvc.perform(fromIp(get("/api/demo/multi"), "198.51.100.90"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.rateLimit.limit").value(5))
                .andExpect(jsonPath("$.rateLimit.identifier").value("ip"));
    }

    @Test
    @DisplayName("Token Bucket - 빈 버킷으로 시작하고 토큰이 쌓이면 허용")
    void testTokenBucketColdStart() throws Exception {
        mockMvc.perform(get("/api/demo/key").header("X-API-Key", "demo-key-1"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "2"));

        clock.advanceSeconds(2);

        mockMvc.perform(get("/api/demo/key").header("X-API-Key", "demo-key-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("token_bucket"));
    }

    private static MockHttpServletRequestBuilder asUser(MockHttpServletRequestBuilder builder, String user) {
        return builder.principal(() -> user);
    }

    private static MockHttpServletRequestBuilder fromIp(MockHttpServletRequestBuilder builder, String remoteAddr) {
        return builder.with(request -> {
            request.setRemoteAddr(remoteAddr);
            return request;
        });
    }
}
