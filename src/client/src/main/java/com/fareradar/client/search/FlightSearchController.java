package com.fareradar.client.search;

import com.fareradar.client.config.FareRadarProperties;
import com.fareradar.client.error.IncompleteSearchException;
import com.fareradar.client.error.SearchException;
import com.fareradar.client.error.SearchTransportException;
import com.fareradar.client.error.SearchValidationException;
import com.fareradar.client.http.BackendEndpoints;
import com.fareradar.client.http.BackendGateway;
import com.fareradar.client.http.BackendResponse;
import com.fareradar.client.model.AirportRef;
import com.fareradar.client.model.CabinClass;
import com.fareradar.client.model.CalendarDate;
import com.fareradar.client.model.FlightPlace;
import com.fareradar.client.model.SearchResult;
import com.fareradar.client.model.TravelDate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives a flight-price search: one initiate request, then polls until the backend reports
 * {@code complete} or the retry budget runs out.
 *
 * <p>The backend may hand a search over to another session between polls, so every poll targets
 * the session id returned by the previous answer, never the first one. All per-search state lives
 * on the calling thread; one instance serves concurrent searches.
 */
@Component
public class FlightSearchController {
  private static final Logger log = LoggerFactory.getLogger(FlightSearchController.class);
  static final String STATUS_COMPLETE = "complete";
  static final String STATUS_INCOMPLETE = "incomplete";

  private final BackendGateway gateway;
  private final BackendEndpoints endpoints;
  private final ResponseClassifier classifier;
  private final SearchRequestFactory requestFactory;
  private final Clock clock;
  private final Duration retryDelay;
  private final int maxRetries;
  private final Counter pollCounter;
  private final Counter completedCounter;
  private final Counter exhaustedCounter;
  private final Counter failedCounter;

  public FlightSearchController(
      BackendGateway gateway,
      BackendEndpoints endpoints,
      ResponseClassifier classifier,
      SearchRequestFactory requestFactory,
      FareRadarProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.gateway = gateway;
    this.endpoints = endpoints;
    this.classifier = classifier;
    this.requestFactory = requestFactory;
    this.clock = clock;
    this.retryDelay = properties.retryDelay();
    this.maxRetries = properties.maxRetries();
    this.pollCounter = meterRegistry.counter("fareradar.flights.polls.total");
    this.completedCounter = meterRegistry.counter("fareradar.flights.searches.total", "outcome", "complete");
    this.exhaustedCounter = meterRegistry.counter("fareradar.flights.searches.total", "outcome", "exhausted");
    this.failedCounter = meterRegistry.counter("fareradar.flights.searches.total", "outcome", "failed");
  }

  public SearchResult search(AirportRef origin, FlightPlace destination, TravelDate departDate) {
    return search(origin, destination, departDate, null, CabinClass.ECONOMY, 1, List.of());
  }

  /**
   * Runs a flight-price search.
   *
   * @param departDate concrete date or marker; {@code null} means now
   * @param returnDate concrete date or marker; {@code null} for a one-way search
   * @throws SearchValidationException when the input is rejected, before any request is sent
   * @throws IncompleteSearchException when {@code maxRetries} polls did not complete the search
   */
  public SearchResult search(
      AirportRef origin,
      FlightPlace destination,
      TravelDate departDate,
      TravelDate returnDate,
      CabinClass cabinClass,
      int adults,
      List<Integer> childAges) {
    if (origin == null || destination == null) {
      throw new SearchValidationException("Origin and destination are required");
    }
    CabinClass cabin = Objects.requireNonNullElse(cabinClass, CabinClass.ECONOMY);
    List<Integer> children = childAges == null ? List.of() : List.copyOf(childAges);
    LocalDateTime now = LocalDateTime.now(clock);
    TravelDate depart = departDate == null ? CalendarDate.of(now) : departDate;

    SearchPreconditions.checkPassengers(adults, children);
    SearchPreconditions.checkFlightDates(depart, returnDate, now);
    SearchPreconditions.checkCabin(cabin, depart, returnDate, destination);

    ObjectNode payload = requestFactory.buildSearchPayload(
        origin, destination, depart, returnDate, cabin, adults, children);
    Map<String, String> headers = Map.of(
        "X-Skyscanner-Viewid", UUID.randomUUID().toString(),
        "Content-Type", "application/json; charset=UTF-8");

    log.info("Starting flight search {} -> {} ({} legs)", origin.skyCode(), describe(destination),
        payload.path("legs").size());
    try {
      BackendResponse initial = gateway.postJson(endpoints.unifiedSearchUrl(), payload, headers);
      JsonNode data = classifier.classify(initial).orThrow();
      if (isComplete(data)) {
        completedCounter.increment();
        log.info("Flight search completed on the initial request");
        return SearchResult.fromCompleted(data, payload, origin, destination);
      }

      String sessionId = requireSessionId(data, null, initial);
      for (int poll = 1; poll <= maxRetries; poll++) {
        pause(poll - 1);
        pollCounter.increment();
        BackendResponse response = gateway.get(endpoints.unifiedSearchPollUrl(sessionId), Map.of(), headers);
        data = classifier.classify(response).orThrow();
        if (isComplete(data)) {
          completedCounter.increment();
          log.info("Flight search completed after {} polls", poll);
          return SearchResult.fromCompleted(data, payload, origin, destination);
        }
        sessionId = requireSessionId(data, sessionId, response);
        log.debug("Flight search still incomplete after poll {}/{}, session {}", poll, maxRetries, sessionId);
      }
    } catch (IncompleteSearchException ex) {
      exhaustedCounter.increment();
      throw ex;
    } catch (SearchException ex) {
      failedCounter.increment();
      throw ex;
    }

    exhaustedCounter.increment();
    log.warn("Flight search still incomplete after {} polls", maxRetries);
    throw new IncompleteSearchException(maxRetries);
  }

  private boolean isComplete(JsonNode data) {
    return STATUS_COMPLETE.equals(data.path("context").path("status").asText(null));
  }

  /** Latest session id of an incomplete answer; keeps {@code previous} when the answer has none. */
  private String requireSessionId(JsonNode data, String previous, BackendResponse response) {
    String status = data.path("context").path("status").asText(null);
    if (!STATUS_INCOMPLETE.equals(status)) {
      throw new SearchTransportException(response.statusCode(), response.body());
    }
    JsonNode sessionId = data.path("context").path("sessionId");
    if (sessionId.isTextual() && !sessionId.asText().isBlank()) {
      return sessionId.asText();
    }
    if (previous == null) {
      throw new SearchTransportException(response.statusCode(), response.body());
    }
    return previous;
  }

  private void pause(int pollsDone) {
    if (retryDelay.isZero()) {
      return;
    }
    try {
      Thread.sleep(retryDelay.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IncompleteSearchException(pollsDone, ex);
    }
  }

  private String describe(FlightPlace place) {
    return place instanceof AirportRef airport ? airport.skyCode() : place.toString();
  }
}
