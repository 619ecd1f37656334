package com.flamingo.ai.raggateway.transport;

/**
 * Successful (2xx) response of an outbound call.
 *
 * @param statusCode HTTP status code
 * @param body response body decoded as a string, empty when the response had none
 */
public record RawBody(int statusCode, String body) {}
