package com.example.gatekeeper.ratelimit.resolver;

import com.example.gatekeeper.ratelimit.config.IdentifierType;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 헤더(API 키, 토큰) 기반 키 생성
 *
 * 설정된 헤더 -> Authorization -> X-Auth-Token -> X-Client-ID 순으로 토큰을 찾는다.
 * "Bearer " 접두사는 제거하고, 원문 대신 SHA-256 해시만 키에 사용한다.
 * 토큰이 없으면 IP 키를 사용한다.
 */
public class HeaderKeyResolver implements KeyResolver {

    public static final String DEFAULT_HEADER = "X-API-Key";
    public static final List<String> FALLBACK_HEADERS = List.of("Authorization", "X-Auth-Token", "X-Client-ID");

    private static final Pattern BEARER_PREFIX = Pattern.compile("^bearer(\\s+|$)", Pattern.CASE_INSENSITIVE);

    private final List<String> headerNames;
    private final IpKeyResolver ipKeyResolver;

    public HeaderKeyResolver(IpKeyResolver ipKeyResolver) {
        this(DEFAULT_HEADER, ipKeyResolver);
    }

    public HeaderKeyResolver(String headerName, IpKeyResolver ipKeyResolver) {
        if (headerName == null || headerName.isBlank()) {
            throw new IllegalArgumentException("Header name must not be blank");
        }
        List<String> names = new ArrayList<>();
        names.add(headerName);
        for (String fallback : FALLBACK_HEADERS) {
            if (!fallback.equalsIgnoreCase(headerName)) {
                names.add(fallback);
            }
        }
        this.headerNames = List.copyOf(names);
        this.ipKeyResolver = ipKeyResolver;
    }

    @Override
    public String resolve(RateLimitRequest request) {
        for (String headerName : headerNames) {
            String token = extractToken(request.getHeader(headerName));
            if (token != null) {
                return "header:" + Hashing.sha256().hashString(token, StandardCharsets.UTF_8);
            }
        }
        return ipKeyResolver.resolve(request);
    }

    @Override
    public IdentifierType getType() {
        return IdentifierType.HEADER;
    }

    public List<String> getHeaderNames() {
        return headerNames;
    }

    private static String extractToken(String value) {
        if (value == null) {
            return null;
        }
        String token = BEARER_PREFIX.matcher(value.trim()).replaceFirst("").trim();
        return token.isEmpty() ? null : token;
    }
}
