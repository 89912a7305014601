package com.regimetrader.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Connection settings for the exchange simulator and the HTTP/WebSocket clients that use them.
 *
 * <p>Binds to the {@code regimetrader.exchange.*} prefix. Provides:
 * <ul>
 *   <li>A {@link RestClient} for the registration handshake, rooted at {@link #httpBaseUrl()}.</li>
 *   <li>A {@link WebSocketClient} shared by the market-data and order-entry streams.</li>
 * </ul>
 *
 * <p>{@code secure=true} switches both protocols (https/wss).
 */
@Configuration
@ConfigurationProperties(prefix = "regimetrader.exchange")
@Getter
@Setter
public class ExchangeConfig {

    private static final Logger log = LoggerFactory.getLogger(ExchangeConfig.class);

    /** host[:port] of the exchange simulator. */
    private String host = "localhost:8080";

    private boolean secure = false;

    /** Replay scenario to start, e.g. normal_market or flash_crash. */
    private String scenario = "normal_market";

    /** Team identifier, sent as the bearer token and used in order ids. */
    private String teamName = "team_alpha";

    private String password = "";

    /** HTTP connect timeout in milliseconds. */
    private int connectTimeout = 5000;

    /** HTTP read timeout in milliseconds. */
    private int readTimeout = 10000;

    /** How long to wait for each WebSocket handshake, in milliseconds. */
    private long websocketConnectTimeout = 10000;

    /** Upper bound on one run; the runner gives up waiting after this many seconds. */
    private long maxRunSeconds = 3600;

    @Bean
    public RestClient exchangeRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        log.info("Creating exchange RestClient for {}", httpBaseUrl());
        return RestClient.builder()
                .baseUrl(httpBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public WebSocketClient exchangeWebSocketClient() {
        return new StandardWebSocketClient();
    }

    public String httpBaseUrl() {
        return (secure ? "https" : "http") + "://" + host;
    }

    public String wsBaseUrl() {
        return (secure ? "wss" : "ws") + "://" + host;
    }
}
