package dev.commentguard.config;

import dev.commentguard.util.IpAddressExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pushes {@code app.trusted-proxies} into {@link IpAddressExtractor} at startup,
 * so forwarded-for headers are honoured only behind known proxies.
 */
@Configuration
@Slf4j
public class TrustedProxyConfig {

    @Value("${app.trusted-proxies:127.0.0.1,::1,0:0:0:0:0:0:0:1}")
    private String trustedProxies;

    @PostConstruct
    public void configureTrustedProxies() {
        Set<String> proxies = Arrays.stream(trustedProxies.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        IpAddressExtractor.setTrustedProxies(proxies);
        log.info("Trusted proxies configured: {}", proxies.size());
    }
}
