package com.regimetrader.transport;

/** Token and run id issued by the registration handshake; both are required to open the streams. */
public record SessionCredentials(String token, String runId) {}
