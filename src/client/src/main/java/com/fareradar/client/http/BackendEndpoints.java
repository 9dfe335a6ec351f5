package com.fareradar.client.http;

import com.fareradar.client.config.FareRadarProperties;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Resolves backend URLs from configuration. Missing entries fail on first use. */
@Component
public class BackendEndpoints {
  private static final Logger log = LoggerFactory.getLogger(BackendEndpoints.class);

  private final FareRadarProperties properties;
  private ResolvedEndpoints endpoints;

  public BackendEndpoints(FareRadarProperties properties) {
    this.properties = properties;
  }

  public synchronized String captchaBaseUrl() {
    return resolve().captchaBaseUrl();
  }

  public synchronized String unifiedSearchUrl() {
    return resolve().unifiedSearchUrl();
  }

  /** The unified-search URL suffixed with the session id to poll. */
  public String unifiedSearchPollUrl(String sessionId) {
    return unifiedSearchUrl() + encodeSegment(sessionId);
  }

  public synchronized String itineraryDetailsUrl() {
    return resolve().itineraryDetailsUrl();
  }

  public synchronized String airportSuggestUrl() {
    return resolve().airportSuggestUrl();
  }

  public String locationSuggestUrl(String query) {
    String template;
    synchronized (this) {
      template = resolve().locationSuggestTemplate();
    }
    return template
        .replace("{market}", properties.market())
        .replace("{locale}", properties.locale())
        + encodeSegment(query);
  }

  public String carRentalUrl(
      String driverAge, String origin, String destination, String pickUpTime, String dropOffTime) {
    String template;
    synchronized (this) {
      template = resolve().carRentalTemplate();
    }
    return template
        .replace("{market}", properties.market())
        .replace("{locale}", properties.locale())
        .replace("{currency}", properties.currency())
        .replace("{driverAge}", driverAge)
        .replace("{origin}", origin)
        .replace("{destination}", destination)
        .replace("{pickUp}", pickUpTime)
        .replace("{dropOff}", dropOffTime);
  }

  private static String encodeSegment(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private ResolvedEndpoints resolve() {
    if (endpoints != null) {
      return endpoints;
    }

    FareRadarProperties.Endpoints config = properties.endpoints();
    if (config == null) {
      throw new IllegalStateException("FareRadar configuration missing: fareradar.endpoints");
    }
    String baseUrl = stripTrailingSlash(required("fareradar.endpoints.base-url", config.baseUrl()));
    String captchaBaseUrl = isPresent(config.captchaBaseUrl())
        ? stripTrailingSlash(config.captchaBaseUrl().trim())
        : baseUrl;
    endpoints = new ResolvedEndpoints(
        captchaBaseUrl,
        baseUrl + required("fareradar.endpoints.unified-search-path", config.unifiedSearchPath()),
        baseUrl + required("fareradar.endpoints.itinerary-details-path", config.itineraryDetailsPath()),
        baseUrl + required("fareradar.endpoints.airport-suggest-path", config.airportSuggestPath()),
        baseUrl + required("fareradar.endpoints.location-suggest-path", config.locationSuggestPath()),
        baseUrl + required("fareradar.endpoints.car-rental-path", config.carRentalPath()));
    log.info("Backend endpoints resolved against {}", baseUrl);
    return endpoints;
  }

  private String required(String field, String value) {
    if (!isPresent(value)) {
      throw new IllegalStateException("FareRadar configuration missing: " + field);
    }
    return value.trim();
  }

  private boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }

  private String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  private record ResolvedEndpoints(
      String captchaBaseUrl,
      String unifiedSearchUrl,
      String itineraryDetailsUrl,
      String airportSuggestUrl,
      String locationSuggestTemplate,
      String carRentalTemplate) {}
}
