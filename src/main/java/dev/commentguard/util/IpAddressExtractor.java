package dev.commentguard.util;

import org.springframework.http.server.reactive.ServerHttpRequest;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the submitter IP of a comment request.
 * <p>
 * Forwarded headers are honoured only when the direct peer is a trusted proxy;
 * the rightmost untrusted entry of {@code X-Forwarded-For} wins.
 * </p>
 */
public final class IpAddressExtractor {

    public static final String UNKNOWN = "unknown";

    private static final Pattern IP_PATTERN = Pattern.compile("^[0-9a-fA-F.:]+$");

    private static volatile Set<String> trustedProxies = Set.of(
            "127.0.0.1", "::1", "0:0:0:0:0:0:0:1"
    );

    private IpAddressExtractor() {
        // Utility class
    }

    public static void setTrustedProxies(Set<String> proxies) {
        trustedProxies = Set.copyOf(proxies);
    }

    private static boolean isTrustedProxy(String ip) {
        return ip != null && !ip.isBlank() && trustedProxies.contains(ip);
    }

    /**
     * @return the client IP address, or {@value #UNKNOWN} if it cannot be determined
     */
    public static String extractClientIp(ServerHttpRequest request) {
        String remoteIp = Optional.ofNullable(request.getRemoteAddress())
                .map(InetSocketAddress::getAddress)
                .map(InetAddress::getHostAddress)
                .orElse(UNKNOWN);

        if (!isTrustedProxy(remoteIp)) {
            return remoteIp;
        }

        String xForwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            String[] ips = xForwardedFor.split(",");
            for (int i = ips.length - 1; i >= 0; i--) {
                String ip = ips[i].trim();
                if (isValidIp(ip) && !isTrustedProxy(ip)) {
                    return ip;
                }
            }
        }

        String xRealIp = request.getHeaders().getFirst("X-Real-IP");
        if (xRealIp != null && isValidIp(xRealIp.trim())) {
            return xRealIp.trim();
        }
        return remoteIp;
    }

    /**
     * Accepts IPv4 and IPv6 characters only, guarding against header injection.
     */
    public static boolean isValidIp(String ip) {
        return ip != null
                && !ip.isBlank()
                && ip.length() <= 45
                && IP_PATTERN.matcher(ip).matches();
    }
}
