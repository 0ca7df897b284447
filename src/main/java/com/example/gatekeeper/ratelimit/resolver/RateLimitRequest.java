package com.example.gatekeeper.ratelimit.resolver;

import java.util.Optional;

/**
 * 키 생성에 필요한 요청 정보만 노출하는 추상화
 * 서블릿 요청 외의 환경(테스트 등)에서도 resolver 를 사용할 수 있게 한다.
 */
public interface RateLimitRequest {

    //전송 계층의 상대방 주소 (프록시 뒤라면 프록시 주소)
    String getRemoteAddress();

    //헤더 값, 없으면 null
    String getHeader(String name);

    Optional<String> getAuthenticatedUserId();

    //이미 존재하는 세션의 ID (세션을 새로 만들지 않는다)
    Optional<String> getSessionId();
}
