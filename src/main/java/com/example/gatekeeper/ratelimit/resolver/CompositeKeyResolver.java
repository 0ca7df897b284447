package com.example.gatekeeper.ratelimit.resolver;

import com.example.gatekeeper.ratelimit.config.IdentifierType;

import java.util.List;
import java.util.StringJoiner;

/**
 * 여러 resolver 의 키를 조합한 키 생성
 * 형식: composite:{key1}|{key2}|...
 * 각 키의 '\' 와 '|' 는 이스케이프해서 서로 다른 조합이 같은 키가 되지 않게 한다.
 */
public class CompositeKeyResolver implements KeyResolver {

    private final List<KeyResolver> resolvers;

    public CompositeKeyResolver(List<KeyResolver> resolvers) {
        if (resolvers == null || resolvers.size() < 2) {
            throw new IllegalArgumentException("Composite resolver requires at least two resolvers");
        }
        this.resolvers = List.copyOf(resolvers);
    }

    @Override
    public String resolve(RateLimitRequest request) {
        StringJoiner joiner = new StringJoiner("|", "composite:", "");
        for (KeyResolver resolver : resolvers) {
            joiner.add(escape(resolver.resolve(request)));
        }
        return joiner.toString();
    }

    @Override
    public IdentifierType getType() {
        return IdentifierType.COMPOSITE;
    }

    static String escape(String key) {
        return key.replace("\\", "\\\\").replace("|", "\\|");
    }
}
