package com.example.gatekeeper.ratelimit.resolver;

import jakarta.servlet.http.HttpServletRequest;

import java.security.Principal;
import java.util.Optional;

/**
 * 인증된 사용자 ID 조회 함수
 * 인증 방식(세션, JWT 등)은 애플리케이션이 빈으로 교체해서 제공한다.
 */
@FunctionalInterface
public interface AuthenticatedUserLookup {

    Optional<String> lookup(HttpServletRequest request);

    //서블릿 컨테이너의 Principal 이름 사용
    static AuthenticatedUserLookup principal() {
        return request -> Optional.ofNullable(request.getUserPrincipal())
                .map(Principal::getName)
                .filter(name -> !name.isBlank());
    }
}
