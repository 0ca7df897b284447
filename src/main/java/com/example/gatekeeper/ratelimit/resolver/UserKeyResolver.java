package com.example.gatekeeper.ratelimit.resolver;

import com.example.gatekeeper.ratelimit.config.IdentifierType;

import java.util.Optional;

/**
 * 사용자 기반 키 생성
 * 인증된 사용자 -> 기존 세션 -> IP 순으로 사용한다.
 */
public class UserKeyResolver implements KeyResolver {

    private final IpKeyResolver ipKeyResolver;

    public UserKeyResolver(IpKeyResolver ipKeyResolver) {
        this.ipKeyResolver = ipKeyResolver;
    }

    @Override
    public String resolve(RateLimitRequest request) {
        Optional<String> userId = request.getAuthenticatedUserId();
        if (userId.isPresent()) {
            return "user:" + userId.get();
        }

        Optional<String> sessionId = request.getSessionId();
        if (sessionId.isPresent()) {
            return "session:" + sessionId.get();
        }

        return ipKeyResolver.resolve(request);
    }

    @Override
    public IdentifierType getType() {
        return IdentifierType.USER;
    }
}
