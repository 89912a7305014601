package com.regimetrader.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of the replay start endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistrationResponse(
        @JsonProperty("token") String token,
        @JsonProperty("run_id") String runId) {}
