package com.fareradar.client.suggest;

import com.fareradar.client.error.PlaceNotFoundException;
import com.fareradar.client.error.SearchValidationException;
import com.fareradar.client.http.BackendEndpoints;
import com.fareradar.client.http.BackendGateway;
import com.fareradar.client.model.AirportRef;
import com.fareradar.client.model.LocationRef;
import com.fareradar.client.search.ResponseClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Airport and car-hire location autosuggest. */
@Service
public class PlaceSuggestService {
  private static final Logger log = LoggerFactory.getLogger(PlaceSuggestService.class);

  private final BackendGateway gateway;
  private final BackendEndpoints endpoints;
  private final ResponseClassifier classifier;

  public PlaceSuggestService(
      BackendGateway gateway, BackendEndpoints endpoints, ResponseClassifier classifier) {
    this.gateway = gateway;
    this.endpoints = endpoints;
    this.classifier = classifier;
  }

  public List<AirportRef> searchAirports(String query) {
    return searchAirports(query, null, null);
  }

  /** Travel dates are optional hints that let the backend rank suggestions. */
  public List<AirportRef> searchAirports(String query, LocalDate departDate, LocalDate returnDate) {
    requireQuery(query);
    Map<String, String> params = new LinkedHashMap<>();
    params.put("query", query);
    params.put("outboundDate", formatDate(departDate));
    params.put("inboundDate", formatDate(returnDate));

    JsonNode data = classifier.classify(
        gateway.get(endpoints.airportSuggestUrl(), params, Map.of())).orThrow();

    List<AirportRef> airports = new ArrayList<>();
    for (JsonNode suggestion : data.path("inputSuggest")) {
      JsonNode navigation = suggestion.path("navigation");
      JsonNode entityId = navigation.path("entityId");
      JsonNode skyId = navigation.path("relevantFlightParams").path("skyId");
      if (!entityId.isValueNode() || !skyId.isValueNode()) {
        continue;
      }
      airports.add(new AirportRef(
          suggestion.path("presentation").path("title").asText(""),
          entityId.asText(),
          skyId.asText()));
    }
    log.debug("Airport suggestions for '{}': {}", query, airports.size());
    return airports;
  }

  public AirportRef airportByCode(String airportCode) {
    requireQuery(airportCode);
    return searchAirports(airportCode).stream()
        .filter(airport -> airport.skyCode().equalsIgnoreCase(airportCode.trim()))
        .findFirst()
        .orElseThrow(() -> new PlaceNotFoundException("IATA code not found: " + airportCode));
  }

  public List<LocationRef> searchLocations(String query) {
    requireQuery(query);
    JsonNode data = classifier.classify(
        gateway.get(endpoints.locationSuggestUrl(query), Map.of("autosuggestExp", "neighborhood_b"), Map.of()))
        .orThrow();

    List<LocationRef> locations = new ArrayList<>();
    for (JsonNode location : data) {
      JsonNode entityId = location.path("entity_id");
      if (!entityId.isValueNode()) {
        continue;
      }
      locations.add(new LocationRef(
          location.path("entity_name").asText(""),
          entityId.asText(),
          location.path("location").asText("")));
    }
    log.debug("Location suggestions for '{}': {}", query, locations.size());
    return locations;
  }

  private void requireQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new SearchValidationException("Search query is required");
    }
  }

  private String formatDate(LocalDate date) {
    return date == null ? "" : date.format(DateTimeFormatter.ISO_LOCAL_DATE);
  }
}
