package com.fareradar.client.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fareradar")
public record FareRadarProperties(
    String locale,
    String currency,
    String market,
    long retryDelayMs,
    int maxRetries,
    String proxy,
    boolean verify,
    Authorization authorization,
    Endpoints endpoints) {

  public Duration retryDelay() {
    return Duration.ofMillis(Math.max(0L, retryDelayMs));
  }

  /** Pre-supplied authorization token, either inline or as an SSM parameter name. */
  public record Authorization(String token, String tokenSsm) {}

  public record Endpoints(
      String baseUrl,
      String captchaBaseUrl,
      String unifiedSearchPath,
      String itineraryDetailsPath,
      String airportSuggestPath,
      String locationSuggestPath,
      String carRentalPath) {}
}
