package com.fareradar.client.http;

import com.fareradar.client.error.SearchTransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends requests to the search backend with the client identity headers attached.
 *
 * <p>Returns every HTTP answer as-is; interpreting status codes is left to the caller.
 */
@Component
public class BackendGateway {
  private static final Logger log = LoggerFactory.getLogger(BackendGateway.class);
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ClientIdentity identity;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter clientErrorCounter;
  private final Counter serverErrorCounter;
  private final Counter exceptionCounter;

  public BackendGateway(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      ClientIdentity identity,
      MeterRegistry meterRegistry) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.identity = identity;

    this.requestTimer = Timer.builder("fareradar.backend.http.duration")
        .description("Search backend HTTP request duration (seconds)")
        .register(meterRegistry);

    // Keep cardinality low: a handful of outcomes, no URL labels.
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.clientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.serverErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");
  }

  public BackendResponse get(String url, Map<String, String> params, Map<String, String> headers) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(toUri(withQuery(url, params)))
        .GET();
    return send(builder, headers);
  }

  public BackendResponse postJson(String url, JsonNode body, Map<String, String> headers) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new SearchTransportException("Unable to serialize request body for " + url, ex);
    }
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(toUri(url))
        .header("Content-Type", "application/json; charset=UTF-8")
        .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
    return send(builder, headers);
  }

  private BackendResponse send(HttpRequest.Builder builder, Map<String, String> headers) {
    builder.timeout(REQUEST_TIMEOUT);
    identity.headers().forEach(builder::setHeader);
    headers.forEach(builder::setHeader);
    HttpRequest request = builder.build();

    long httpStartNs = System.nanoTime();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      countOutcome(response.statusCode());
      log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
      return new BackendResponse(response.statusCode(), response.body() == null ? "" : response.body());
    } catch (InterruptedException ex) {
      requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      exceptionCounter.increment();
      Thread.currentThread().interrupt();
      throw new SearchTransportException("Request interrupted: " + request.method() + " " + request.uri(), ex);
    } catch (IOException ex) {
      requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      exceptionCounter.increment();
      log.warn("Backend request failed: {} {}", request.method(), request.uri(), ex);
      throw new SearchTransportException("Request failed: " + request.method() + " " + request.uri(), ex);
    }
  }

  private void countOutcome(int statusCode) {
    if (statusCode >= 500) {
      serverErrorCounter.increment();
    } else if (statusCode >= 400) {
      clientErrorCounter.increment();
    } else {
      successCounter.increment();
    }
  }

  private Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("fareradar.backend.http.requests.total")
        .description("Search backend HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private URI toUri(String url) {
    try {
      return URI.create(url);
    } catch (IllegalArgumentException ex) {
      exceptionCounter.increment();
      throw new SearchTransportException("Invalid backend URL: " + url, ex);
    }
  }

  static String withQuery(String url, Map<String, String> params) {
    if (params == null || params.isEmpty()) {
      return url;
    }
    String query = params.entrySet().stream()
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
    return url + (url.contains("?") ? "&" : "?") + query;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
  }
}
