package dev.commentguard.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Builder for the outbound Akismet and reCAPTCHA clients. The Reactor
 * {@code timeout()} in each service is the effective bound; the Netty
 * response timeout only catches sockets left hanging after cancellation.
 */
@Configuration(proxyBeanMethods = false)
public class WebClientConfig {

    @Bean
    @Scope("prototype")
    public WebClient.Builder webClientBuilder(ResilienceConfig resilience) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3_000)
                .responseTimeout(resilience.getClassifierTimeout().plus(Duration.ofSeconds(1)));
        return WebClient.builder().clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
