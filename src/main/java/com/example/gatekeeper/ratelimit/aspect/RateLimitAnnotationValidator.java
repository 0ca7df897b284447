package com.example.gatekeeper.ratelimit.aspect;

import com.example.gatekeeper.ratelimit.annotation.RateLimit;
import com.example.gatekeeper.ratelimit.config.RateLimitPolicy;
import com.example.gatekeeper.ratelimit.exception.InvalidRateLimitConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanInitializationException;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.util.Map;

/**
 * {@code @RateLimit} 설정 검증기
 *
 * 빈이 초기화될 때 {@code @RateLimit} 이 붙은 메서드를 찾아 규칙을 미리 파싱한다.
 * 잘못된 설정은 요청 처리 중이 아니라 애플리케이션 기동 시점에 실패한다.
 */
@Slf4j
@Component
public class RateLimitAnnotationValidator implements BeanPostProcessor {

    @Override
    public Object postProcessBeforeInitialization(Object bean, String beanName) throws BeansException {
        Class<?> targetClass = ClassUtils.getUserClass(bean);
        Map<Method, RateLimit> annotated = MethodIntrospector.selectMethods(targetClass,
                (MethodIntrospector.MetadataLookup<RateLimit>) method ->
                        AnnotatedElementUtils.findMergedAnnotation(method, RateLimit.class));

        annotated.forEach((method, rateLimit) -> {
            try {
                RateLimitPolicy policy = RateLimitAspect.toPolicy(rateLimit);
                log.debug("Validated rate limit on {}.{} - {}",
                        targetClass.getSimpleName(), method.getName(), policy.getLimits());
            } catch (InvalidRateLimitConfigException e) {
                throw new BeanInitializationException("Invalid @RateLimit on "
                        + targetClass.getSimpleName() + "." + method.getName() + ": " + e.getMessage(), e);
            }
        });
        return bean;
    }
}
