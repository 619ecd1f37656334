package com.flamingo.ai.raggateway.transport;

import java.net.URI;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;

/**
 * A single outbound call handled by {@link SecureHttpTransport}.
 *
 * @param method HTTP method
 * @param uri absolute target URI
 * @param headers extra request headers (authorization, accept, ...)
 * @param body request payload, {@code null} for body-less requests
 * @param contentType content type of {@code body}
 * @param timeout upper bound for the whole exchange, including reading the body
 */
public record TransportRequest(
    HttpMethod method,
    URI uri,
    HttpHeaders headers,
    Object body,
    MediaType contentType,
    Duration timeout) {

  public static TransportRequest get(URI uri, HttpHeaders headers, Duration timeout) {
    return new TransportRequest(HttpMethod.GET, uri, headers, null, null, timeout);
  }

  public static TransportRequest postJson(
      URI uri, HttpHeaders headers, Object payload, Duration timeout) {
    return new TransportRequest(
        HttpMethod.POST, uri, headers, payload, MediaType.APPLICATION_JSON, timeout);
  }

  public static TransportRequest postMultipart(
      URI uri, HttpHeaders headers, MultiValueMap<String, ?> parts, Duration timeout) {
    return new TransportRequest(
        HttpMethod.POST, uri, headers, parts, MediaType.MULTIPART_FORM_DATA, timeout);
  }
}
