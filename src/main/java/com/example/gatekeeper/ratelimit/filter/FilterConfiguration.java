package com.example.gatekeeper.ratelimit.filter;

import com.example.gatekeeper.ratelimit.config.RateLimiterProperties;
import com.example.gatekeeper.ratelimit.core.RateLimitHeaders;
import com.example.gatekeeper.ratelimit.core.RateLimitRegistry;
import com.example.gatekeeper.ratelimit.resolver.AuthenticatedUserLookup;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;

/**
 * Rate Limit Filter 등록 및 설정
 */
@Slf4j
@Configuration
public class FilterConfiguration {

    //RateLimitFilter를 Spring Boot에 등록 (경로 선택은 RateLimitRegistry 가 담당)
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitRegistry registry,
                                                                               RateLimiterProperties properties,
                                                                               RateLimitHeaders rateLimitHeaders,
                                                                               AuthenticatedUserLookup userLookup,
                                                                               ObjectMapper objectMapper,
                                                                               Clock clock) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>();
        registration.setFilter(new RateLimitFilter(registry, properties, rateLimitHeaders, userLookup,
                objectMapper, clock));
        registration.addUrlPatterns("/*");
        registration.setName("rateLimitFilter");
        // 가능한 한 빨리 실행되도록
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);

        log.info("RateLimitFilter registered - rule patterns: {}", registry.getPatterns());
        return registration;
    }
}
