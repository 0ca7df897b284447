package com.example.gatekeeper.ratelimit.aspect;

import com.example.gatekeeper.ratelimit.annotation.RateLimit;
import com.example.gatekeeper.ratelimit.config.RateLimitConfig;
import com.example.gatekeeper.ratelimit.config.RateLimitConfigParser;
import com.example.gatekeeper.ratelimit.config.RateLimitPolicy;
import com.example.gatekeeper.ratelimit.config.RateLimiterProperties;
import com.example.gatekeeper.ratelimit.core.PolicyEngine;
import com.example.gatekeeper.ratelimit.core.RateLimitEngineFactory;
import com.example.gatekeeper.ratelimit.core.RateLimitHeaders;
import com.example.gatekeeper.ratelimit.core.RateLimitResult;
import com.example.gatekeeper.ratelimit.exception.InvalidRateLimitConfigException;
import com.example.gatekeeper.ratelimit.exception.RateLimitExceededException;
import com.example.gatekeeper.ratelimit.resolver.AuthenticatedUserLookup;
import com.example.gatekeeper.ratelimit.resolver.ServletRateLimitRequest;
import com.example.gatekeeper.ratelimit.util.ResponseUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate Limit AOP Aspect
 * {@code @RateLimit} 어노테이션이 적용된 메서드의 호출을 가로채서 Rate Limiting을 적용합니다.
 *
 * 메서드별 PolicyEngine 은 처음 호출될 때 한 번 만들어 재사용합니다.
 * 설정 검증은 기동 시점에 {@link RateLimitAnnotationValidator} 가 수행합니다.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class RateLimitAspect {

    private final RateLimitEngineFactory engineFactory;
    private final RateLimitHeaders rateLimitHeaders;
    private final AuthenticatedUserLookup userLookup;
    private final RateLimiterProperties properties;

    private final Map<Method, PolicyEngine> engines = new ConcurrentHashMap<>();

    @Around("@annotation(rateLimit)")
    public Object around(ProceedingJoinPoint joinPoint, RateLimit rateLimit) throws Throwable {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!properties.isEnabled() || !(attributes instanceof ServletRequestAttributes)) {
            return joinPoint.proceed();
        }
        ServletRequestAttributes servletAttributes = (ServletRequestAttributes) attributes;
        HttpServletRequest request = servletAttributes.getRequest();
        HttpServletResponse response = servletAttributes.getResponse();

        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        PolicyEngine policyEngine = engines.computeIfAbsent(method, m -> createPolicyEngine(m, rateLimit));

        PolicyEngine.Decision decision = policyEngine.evaluate(new ServletRateLimitRequest(request, userLookup));
        RateLimitResult result = decision.getResult();

        if (response != null) {
            rateLimitHeaders.apply(response, result);
        }

        if (!result.isAllowed()) {
            ResponseUtil.logRejectedRequest(result, request.getRequestURI());
            RateLimitConfig config = decision.getEngine().getConfig();
            throw new RateLimitExceededException(rateLimit.message(), config.getWindowSeconds(),
                    config.getIdentifier(), result);
        }

        ResponseUtil.logAllowedRequest(result, request.getRequestURI());
        return joinPoint.proceed();
    }

    private PolicyEngine createPolicyEngine(Method method, RateLimit rateLimit) {
        RateLimitPolicy policy = toPolicy(rateLimit);
        log.info("Rate limit applied to {}.{} - {}",
                method.getDeclaringClass().getSimpleName(), method.getName(), policy.getLimits());
        return engineFactory.createPolicyEngine(policy);
    }

    static RateLimitPolicy toPolicy(RateLimit rateLimit) {
        if (!rateLimit.rule().isBlank()) {
            return RateLimitConfigParser.parse(rateLimit.rule());
        }
        if (rateLimit.windowMinutes() <= 0 || rateLimit.windowMinutes() > Integer.MAX_VALUE / 60) {
            throw new InvalidRateLimitConfigException("windowMinutes must be positive: " + rateLimit.windowMinutes());
        }
        return RateLimitPolicy.of(RateLimitConfig.builder()
                .limit(rateLimit.requests())
                .windowSeconds(rateLimit.windowMinutes() * 60)
                .strategy(rateLimit.strategy())
                .identifier(rateLimit.identifier())
                .headerName(rateLimit.header())
                .build());
    }
}
