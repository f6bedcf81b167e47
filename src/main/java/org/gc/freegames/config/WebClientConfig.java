package org.gc.freegames.config;

import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.properties.FreeGamesProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import java.util.Locale;
import java.util.Optional;

@Slf4j
@Configuration
public class WebClientConfig {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private static final String BROWSER_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/98.0.4758.80 Safari/537.36";

    @Bean
    public WebClient epicStoreWebClient(WebClient.Builder webClientBuilder, FreeGamesProperties properties) {
        FreeGamesProperties.Provider provider = properties.getProvider();
        HttpClient httpClient = withProxy(HttpClient.create().responseTimeout(provider.getTimeout()),
                properties.getProxy());

        return webClientBuilder.clone()
                .baseUrl(provider.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.REFERER, "https://www.epicgames.com/store/" + provider.getLocale() + "/")
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }

    @Bean
    public WebClient oneBotWebClient(WebClient.Builder webClientBuilder, FreeGamesProperties properties) {
        FreeGamesProperties.Transport transport = properties.getTransport();
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(transport.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create().responseTimeout(transport.getTimeout())))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

        if (transport.getAccessToken() != null && !transport.getAccessToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + transport.getAccessToken());
        }
        return builder.build();
    }

    static HttpClient withProxy(HttpClient httpClient, FreeGamesProperties.Proxy proxy) {
        Optional<ProxyProvider.Proxy> proxyType = proxyType(proxy.getType());
        if (proxyType.isEmpty()) {
            return httpClient;
        }
        log.info("Using {} proxy {}:{} for store requests", proxy.getType(), proxy.getHost(), proxy.getPort());
        boolean authenticated = proxy.getUsername() != null && !proxy.getUsername().isBlank()
                && proxy.getPassword() != null && !proxy.getPassword().isBlank();

        return httpClient.proxy(spec -> {
            ProxyProvider.Builder builder = spec.type(proxyType.get())
                    .host(proxy.getHost())
                    .port(proxy.getPort());
            if (authenticated) {
                builder.username(proxy.getUsername())
                        .password(username -> proxy.getPassword());
            }
        });
    }

    /**
     * Maps the configured proxy type; blank means no proxy, unsupported values are ignored.
     */
    static Optional<ProxyProvider.Proxy> proxyType(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "http":
                return Optional.of(ProxyProvider.Proxy.HTTP);
            case "socks5":
                return Optional.of(ProxyProvider.Proxy.SOCKS5);
            default:
                log.warn("Unsupported proxy type '{}', connecting directly", type);
                return Optional.empty();
        }
    }
}
