package com.example.gatekeeper.ratelimit.controller;

import com.example.gatekeeper.ratelimit.controller.response.AdminResetResponse;
import com.example.gatekeeper.ratelimit.controller.response.AdminUsageResponse;
import com.example.gatekeeper.ratelimit.core.PolicyEngine;
import com.example.gatekeeper.ratelimit.core.RateLimitRegistry;
import com.example.gatekeeper.ratelimit.resolver.AuthenticatedUserLookup;
import com.example.gatekeeper.ratelimit.resolver.ServletRateLimitRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Rate Limit 관리용 API
 * 호출자 자신의 키 기준으로 사용량을 조회하거나 리셋한다.
 *
 * GET    /api/admin/rate-limit/rules
 * GET    /api/admin/rate-limit/usage?rule={pattern}
 * DELETE /api/admin/rate-limit?rule={pattern}
 *
 * rate-limiter.admin.enabled=true 일 때만 등록된다.
 */
@Slf4j
@Validated
@RestController
@ConditionalOnProperty(prefix = "rate-limiter.admin", name = "enabled", havingValue = "true")
@RequestMapping("/api/admin/rate-limit")
@RequiredArgsConstructor
public class RateLimitAdminController {

    private final RateLimitRegistry registry;
    private final AuthenticatedUserLookup userLookup;
    private final Clock clock;

    @GetMapping("/rules")
    public List<String> rules() {
        return registry.getPatterns();
    }

    @GetMapping("/usage")
    public AdminUsageResponse usage(@RequestParam @NotBlank String rule, HttpServletRequest request) {
        PolicyEngine policyEngine = findRule(rule);
        return AdminUsageResponse.builder()
                .rule(rule)
                .usage(policyEngine.usage(new ServletRateLimitRequest(request, userLookup)))
                .timestamp(LocalDateTime.now(clock))
                .build();
    }

    @DeleteMapping
    public AdminResetResponse reset(@RequestParam @NotBlank String rule, HttpServletRequest request) {
        PolicyEngine policyEngine = findRule(rule);
        policyEngine.reset(new ServletRateLimitRequest(request, userLookup));
        log.info("Rate limit reset by admin API - rule: {}", rule);

        return AdminResetResponse.builder()
                .message("Rate limit reset")
                .rule(rule)
                .resetLimits(policyEngine.getEngines().size())
                .timestamp(LocalDateTime.now(clock))
                .build();
    }

    private PolicyEngine findRule(String rule) {
        return registry.forPattern(rule)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown rate limit rule: " + rule));
    }
}
