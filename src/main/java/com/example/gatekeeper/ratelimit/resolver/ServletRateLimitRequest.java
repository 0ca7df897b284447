package com.example.gatekeeper.ratelimit.resolver;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

import java.util.Optional;

/**
 * HttpServletRequest 어댑터
 */
public class ServletRateLimitRequest implements RateLimitRequest {

    private final HttpServletRequest request;
    private final AuthenticatedUserLookup userLookup;

    public ServletRateLimitRequest(HttpServletRequest request, AuthenticatedUserLookup userLookup) {
        this.request = request;
        this.userLookup = userLookup;
    }

    @Override
    public String getRemoteAddress() {
        return request.getRemoteAddr();
    }

    @Override
    public String getHeader(String name) {
        return request.getHeader(name);
    }

    @Override
    public Optional<String> getAuthenticatedUserId() {
        return userLookup.lookup(request);
    }

    @Override
    public Optional<String> getSessionId() {
        // 기존 세션만 사용, 새 세션은 만들지 않는다
        HttpSession session = request.getSession(false);
        return session == null ? Optional.empty() : Optional.of(session.getId());
    }
}
