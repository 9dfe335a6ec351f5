package com.fareradar.client.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Completed flight-price search.
 *
 * <p>{@code searchPayload} is a private deep copy of the request that produced the result; it is
 * replayed when itinerary details are requested. {@code sessionId} is read from
 * {@code itineraries.context.sessionId} and is {@code null} when the payload has no itineraries.
 */
public record SearchResult(
    JsonNode json,
    String sessionId,
    JsonNode searchPayload,
    AirportRef origin,
    FlightPlace destination) {

  public SearchResult {
    Objects.requireNonNull(json, "json");
    Objects.requireNonNull(searchPayload, "searchPayload");
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(destination, "destination");
    searchPayload = searchPayload.deepCopy();
  }

  public static SearchResult fromCompleted(
      JsonNode json, JsonNode searchPayload, AirportRef origin, FlightPlace destination) {
    return new SearchResult(json, extractSessionId(json), searchPayload, origin, destination);
  }

  public Optional<String> session() {
    return Optional.ofNullable(sessionId);
  }

  @Override
  public JsonNode searchPayload() {
    return searchPayload.deepCopy();
  }

  static String extractSessionId(JsonNode json) {
    JsonNode sessionId = json.path("itineraries").path("context").path("sessionId");
    if (sessionId.isMissingNode() || sessionId.isNull()) {
      return null;
    }
    return sessionId.asText();
  }
}
