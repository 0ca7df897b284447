package com.example.gatekeeper.ratelimit.controller;

import com.example.gatekeeper.ratelimit.support.TestClockConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "rate-limiter.url-patterns[/api/public/**]=2,1",
        "rate-limiter.admin.enabled=true"
})
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@DisplayName("Rate Limit 관리 API 테스트")
class RateLimitAdminControllerTest {

    private static final String RULE = "/api/public/**";

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("등록된 규칙 목록 조회")
    void testRules() throws Exception {
        mockMvc.perform(get("/api/admin/rate-limit/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value(RULE));
    }

    @Test
    @DisplayName("사용량 조회 - 호출자 키 기준 현재 사용량")
    void testUsage() throws Exception {
        mockMvc.perform(from(get("/api/public/ping"), "198.51.100.60")).andExpect(status().isOk());

        mockMvc.perform(from(get("/api/admin/rate-limit/usage").param("rule", RULE), "198.51.100.60"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rule").value(RULE))
                .andExpect(jsonPath("$.usage[0].key").value("ip:198.51.100.60"))
                .andExpect(jsonPath("$.usage[0].currentRequests").value(1))
                .andExpect(jsonPath("$.usage[0].algorithm").value("fixed"));
    }

    @Test
    @DisplayName("리셋 - 한도 초과 후 리셋하면 다시 허용되어야 함")
    void testReset() throws Exception {
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(from(get("/api/public/ping"), "198.51.100.61")).andExpect(status().isOk());
        }
        mockMvc.perform(from(get("/api/public/ping"), "198.51.100.61")).andExpect(status().isTooManyRequests());

        mockMvc.perform(from(delete("/api/admin/rate-limit").param("rule", RULE), "198.51.100.61"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rule").value(RULE))
                .andExpect(jsonPath("$.resetLimits").value(1));

        mockMvc.perform(from(get("/api/public/ping"), "198.51.100.61")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("알 수 없는 규칙은 404")
    void testUnknownRule() throws Exception {
        mockMvc.perform(get("/api/admin/rate-limit/usage").param("rule", "/nope/**"))
                .andExpect(status().isNotFound());
    }

    private static MockHttpServletRequestBuilder from(MockHttpServletRequestBuilder builder, String remoteAddr) {
        return builder.with(request -> {
            request.setRemoteAddr(remoteAddr);
            return request;
        });
    }
}
