package com.example.gatekeeper.ratelimit.annotation;

import com.example.gatekeeper.ratelimit.config.IdentifierType;
import com.example.gatekeeper.ratelimit.config.StrategyType;
import com.example.gatekeeper.ratelimit.resolver.HeaderKeyResolver;
import com.example.gatekeeper.ratelimit.util.ResponseUtil;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Rate Limit 어노테이션
 * 컨트롤러 메서드에 적용하여 해당 메서드의 호출을 제한할 수 있습니다.
 *
 * <pre>
 * &#64;RateLimit(requests = 10, windowMinutes = 1, identifier = IdentifierType.USER)
 * &#64;RateLimit(rule = "100,1|1000,60,sliding,ip+user")
 * </pre>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimit {

    /**
     * 윈도우당 최대 허용 요청 수
     */
    int requests() default 60;

    /**
     * 시간 윈도우 (분)
     */
    int windowMinutes() default 1;

    StrategyType strategy() default StrategyType.FIXED;

    IdentifierType identifier() default IdentifierType.IP;

    /**
     * HEADER 식별 시 토큰을 읽을 헤더
     */
    String header() default HeaderKeyResolver.DEFAULT_HEADER;

    /**
     * 설정 문자열 (예: "100,1|1000,60,sliding,user")
     * 지정하면 위의 개별 속성은 무시됩니다.
     */
    String rule() default "";

    /**
     * Rate Limit 초과 시 반환할 메시지
     */
    String message() default ResponseUtil.DEFAULT_MESSAGE;
}
