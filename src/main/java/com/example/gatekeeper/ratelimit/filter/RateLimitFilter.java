package com.example.gatekeeper.ratelimit.filter;

import com.example.gatekeeper.ratelimit.config.RateLimiterProperties;
import com.example.gatekeeper.ratelimit.core.PolicyEngine;
import com.example.gatekeeper.ratelimit.core.RateLimitHeaders;
import com.example.gatekeeper.ratelimit.core.RateLimitRegistry;
import com.example.gatekeeper.ratelimit.core.RateLimitResult;
import com.example.gatekeeper.ratelimit.resolver.AuthenticatedUserLookup;
import com.example.gatekeeper.ratelimit.resolver.ServletRateLimitRequest;
import com.example.gatekeeper.ratelimit.util.ResponseUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * Rate Limiting을 적용하는 서블릿 필터
 * OncePerRequestFilter를 상속받아 요청당 한 번만 실행되도록 보장
 *
 * 요청 경로에 매칭되는 규칙(rate-limiter.url-patterns, default-rule)이 없으면 그대로 통과시킨다.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    // 컨텍스트 경로를 뺀 애플리케이션 내부 경로로 매칭
    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private final RateLimitRegistry registry;
    private final RateLimiterProperties properties;
    private final RateLimitHeaders rateLimitHeaders;
    private final AuthenticatedUserLookup userLookup;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String path = PATH_HELPER.getPathWithinApplication(request);
        Optional<PolicyEngine> policyEngine = registry.find(path);
        if (policyEngine.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        // 1. Rate Limiting 검사 (저장소 장애는 엔진에서 fail-open 처리)
        PolicyEngine.Decision decision = policyEngine.get()
                .evaluate(new ServletRateLimitRequest(request, userLookup));
        RateLimitResult result = decision.getResult();

        // 2. 응답 헤더 설정
        rateLimitHeaders.apply(response, result);

        // 3. 결과에 따른 처리
        if (result.isAllowed()) {
            ResponseUtil.logAllowedRequest(result, path);
            filterChain.doFilter(request, response);
            return;
        }

        // 요청 거부 - 429 응답
        ResponseUtil.logRejectedRequest(result, path);
        ResponseUtil.sendTooManyRequestsResponse(response, objectMapper,
                ResponseUtil.createErrorResponse(result, ResponseUtil.DEFAULT_MESSAGE,
                        decision.getEngine().getConfig().getWindowSeconds(),
                        decision.getEngine().getConfig().getIdentifier().getConfigName(), clock));
    }

    //비활성화 상태이거나 제외 경로는 Rate Limiting 하지 않음
    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !properties.isEnabled() || registry.isExcluded(PATH_HELPER.getPathWithinApplication(request));
    }
}
