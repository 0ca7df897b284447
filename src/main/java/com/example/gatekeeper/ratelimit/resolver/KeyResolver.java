package com.example.gatekeeper.ratelimit.resolver;

import com.example.gatekeeper.ratelimit.config.IdentifierType;

/**
 * 요청으로부터 호출자 식별 키를 만드는 인터페이스
 *
 * 구현체는 항상 값을 반환해야 하며 (예외 없음), 같은 호출자에게는 같은 키를,
 * 다른 호출자에게는 다른 키를 돌려줘야 한다.
 */
public interface KeyResolver {

    String resolve(RateLimitRequest request);

    IdentifierType getType();
}
