package com.regimetrader.transport;

import com.regimetrader.config.ExchangeConfig;
import com.regimetrader.exception.RegistrationException;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

/**
 * Registers a trading session with the exchange simulator.
 *
 * <p>{@code GET /api/replays/{scenario}/start} with the team name as bearer token and the team
 * password in {@code X-Team-Password}. The response must carry both a token and a run id.
 *
 * <p>Connection failures and 5xx responses are retried by the {@code exchangeRegistration}
 * resilience4j instance; a 4xx or an incomplete body fails immediately with a
 * {@link RegistrationException}.
 */
@Service
public class ExchangeSessionClient {

    private static final Logger log = LoggerFactory.getLogger(ExchangeSessionClient.class);

    static final String PASSWORD_HEADER = "X-Team-Password";

    private final RestClient restClient;
    private final ExchangeConfig exchangeConfig;

    public ExchangeSessionClient(
            @Qualifier("exchangeRestClient") RestClient restClient, ExchangeConfig exchangeConfig) {
        this.restClient = restClient;
        this.exchangeConfig = exchangeConfig;
    }

    @Retry(name = "exchangeRegistration")
    public SessionCredentials register(String scenario) {
        log.info("Registering team {} for scenario {}", exchangeConfig.getTeamName(), scenario);

        RegistrationResponse response;
        try {
            response = restClient
                    .get()
                    .uri("/api/replays/{scenario}/start", scenario)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + exchangeConfig.getTeamName())
                    .headers(headers -> {
                        String password = exchangeConfig.getPassword();
                        if (password != null && !password.isEmpty()) {
                            headers.set(PASSWORD_HEADER, password);
                        }
                    })
                    .retrieve()
                    .body(RegistrationResponse.class);
        } catch (HttpClientErrorException e) {
            throw new RegistrationException(
                    "Registration rejected: " + e.getStatusCode() + " " + e.getResponseBodyAsString(), e);
        }

        if (response == null || isBlank(response.token()) || isBlank(response.runId())) {
            throw new RegistrationException(
                    "Registration response missing token or run_id",
                    Map.of("scenario", scenario, "response", String.valueOf(response)));
        }

        log.info("Registered, run id {}", response.runId());
        return new SessionCredentials(response.token(), response.runId());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
