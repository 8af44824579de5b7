package com.aitimeline.api.util;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Set;

/**
 * 사용자 입력 URL 검증 (source_url, input_url)
 * - http/https 만 허용
 * - 에러 문자열이 URL 로 저장되는 것 방지 ("ERROR:" 등)
 * - 내부망 호스트 차단 (provider 가 대신 요청하는 URL 이므로 SSRF 방지)
 */
@Slf4j
public class UrlValidator {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("https", "http");

    private static final String[] INVALID_PREFIXES = {
            "ERROR:",
            "error:",
            "FAILED:",
            "failed:",
            "Exception:",
            "null"
    };

    private static final String[] FORBIDDEN_HOST_PATTERNS = {
            "localhost",
            "127.0.0.1",
            "0.0.0.0",
            "169.254.",
            "[::1]"
    };

    private static final String[] FORBIDDEN_HOST_IP_PREFIXES = {
            "10.",
            "192.168.",
            "172.16.", "172.17.", "172.18.", "172.19.",
            "172.20.", "172.21.", "172.22.", "172.23.",
            "172.24.", "172.25.", "172.26.", "172.27.",
            "172.28.", "172.29.", "172.30.", "172.31."
    };

    public static boolean isValid(String url) {
        if (url == null || url.trim().isEmpty()) {
            return false;
        }

        String trimmedUrl = url.trim();
        for (String invalidPrefix : INVALID_PREFIXES) {
            if (trimmedUrl.startsWith(invalidPrefix)) {
                log.warn("[UrlValidator] Invalid URL detected (starts with '{}'): {}",
                        invalidPrefix, truncate(trimmedUrl, 100));
                return false;
            }
        }

        try {
            URI uri = new URI(trimmedUrl);
            String scheme = uri.getScheme();
            String host = uri.getHost();

            if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase())) {
                log.warn("[UrlValidator] Disallowed URL scheme: {}", truncate(trimmedUrl, 100));
                return false;
            }
            return isHostSafe(host);
        } catch (URISyntaxException e) {
            log.warn("[UrlValidator] Failed to parse URL: {}", truncate(trimmedUrl, 100));
            return false;
        }
    }

    private static boolean isHostSafe(String host) {
        if (host == null || host.trim().isEmpty()) {
            return false;
        }

        String lowerHost = host.toLowerCase();
        for (String pattern : FORBIDDEN_HOST_PATTERNS) {
            if (lowerHost.contains(pattern)) {
                log.warn("[UrlValidator] Forbidden host pattern '{}' detected: {}", pattern, host);
                return false;
            }
        }
        for (String prefix : FORBIDDEN_HOST_IP_PREFIXES) {
            if (lowerHost.startsWith(prefix)) {
                log.warn("[UrlValidator] Forbidden internal IP detected: {}", host);
                return false;
            }
        }
        return true;
    }

    private static String truncate(String str, int maxLength) {
        if (str == null) return "null";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength) + "...";
    }
}
