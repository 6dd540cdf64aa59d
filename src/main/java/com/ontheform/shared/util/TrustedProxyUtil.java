package com.ontheform.shared.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Resolves the submitter address used for per-IP uniqueness and rate limiting.
 * {@code X-Forwarded-For} is honoured only when the direct peer is a configured proxy, and is read
 * from the right: the first hop that is not a trusted proxy is the client.
 */
@Component
public class TrustedProxyUtil {

    @Value("${app.security.trusted-proxies:}")
    private String trustedProxiesConfig;

    @Value("${app.security.enable-forwarded-headers:false}")
    private boolean enableForwardedHeaders;

    private volatile List<String> trustedProxies;

    public String getClientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!enableForwardedHeaders) {
            return remoteAddr;
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor == null || forwardedFor.isBlank() || !isTrustedProxy(remoteAddr)) {
            return remoteAddr;
        }

        // entries left of the last untrusted hop are client supplied
        String[] hops = forwardedFor.split(",");
        String clientIp = remoteAddr;
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (!isValidIpAddress(hop)) {
                return clientIp;
            }
            clientIp = hop;
            if (!isTrustedProxy(hop)) {
                break;
            }
        }
        return clientIp;
    }

    private boolean isTrustedProxy(String ip) {
        if (ip == null) {
            return false;
        }
        List<String> proxies = trustedProxies;
        if (proxies == null) {
            proxies = parseTrustedProxies();
            trustedProxies = proxies;
        }
        return proxies.stream().anyMatch(proxy -> ip.equals(proxy) || ip.startsWith(proxy));
    }

    private List<String> parseTrustedProxies() {
        if (trustedProxiesConfig == null || trustedProxiesConfig.isBlank()) {
            return List.of("127.0.0.1", "::1", "0:0:0:0:0:0:0:1");
        }
        return Arrays.stream(trustedProxiesConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    static boolean isValidIpAddress(String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }

        String[] parts = ip.split("\\.");
        if (parts.length == 4) {
            try {
                for (String part : parts) {
                    int num = Integer.parseInt(part);
                    if (num < 0 || num > 255) {
                        return false;
                    }
                }
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }

        return ip.contains(":") && ip.matches("^[0-9a-fA-F:]+$");
    }
}
