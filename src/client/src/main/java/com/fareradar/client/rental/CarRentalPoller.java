package com.fareradar.client.rental;

import com.fareradar.client.config.FareRadarProperties;
import com.fareradar.client.error.IncompleteSearchException;
import com.fareradar.client.http.BackendEndpoints;
import com.fareradar.client.http.BackendGateway;
import com.fareradar.client.http.BackendResponse;
import com.fareradar.client.model.CarRentalListing;
import com.fareradar.client.search.ResponseClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Polls the car-rental listing until its group count is stable.
 *
 * <p>The listing endpoint has no completion flag: vendors are added while the backend aggregates.
 * The listing counts as complete once two consecutive answers report the same positive
 * {@code groups_count}. A zero count never serves as a baseline, so an empty listing runs until the
 * retry budget is spent.
 */
@Component
public class CarRentalPoller {
  private static final Logger log = LoggerFactory.getLogger(CarRentalPoller.class);

  private final BackendGateway gateway;
  private final BackendEndpoints endpoints;
  private final ResponseClassifier classifier;
  private final Duration retryDelay;
  private final int maxRetries;
  private final Counter requestCounter;
  private final Counter convergedCounter;
  private final Counter exhaustedCounter;

  public CarRentalPoller(
      BackendGateway gateway,
      BackendEndpoints endpoints,
      ResponseClassifier classifier,
      FareRadarProperties properties,
      MeterRegistry meterRegistry) {
    this.gateway = gateway;
    this.endpoints = endpoints;
    this.classifier = classifier;
    this.retryDelay = properties.retryDelay();
    this.maxRetries = properties.maxRetries();
    this.requestCounter = meterRegistry.counter("fareradar.rentals.requests.total");
    this.convergedCounter = meterRegistry.counter("fareradar.rentals.searches.total", "outcome", "converged");
    this.exhaustedCounter = meterRegistry.counter("fareradar.rentals.searches.total", "outcome", "exhausted");
  }

  public CarRentalListing poll(CarRentalQuery query) {
    CarRentalQuery current = query;
    Integer lastCount = null;
    for (int request = 1; request <= maxRetries; request++) {
      if (request > 1) {
        pause(request - 1);
      }
      requestCounter.increment();
      BackendResponse response = gateway.get(url(current), params(current), Map.of());
      JsonNode data = classifier.classify(response).orThrow();
      int count = data.path("groups_count").asInt(0);

      if (lastCount != null && count == lastCount) {
        convergedCounter.increment();
        log.info("Car-rental listing stable at {} groups after {} requests", count, request);
        return new CarRentalListing(data, count, request);
      }
      log.debug("Car-rental listing at {} groups (previous {}), request {}/{}", count, lastCount, request, maxRetries);
      lastCount = count > 0 ? count : null;
      current = current.nextRequest();
    }

    exhaustedCounter.increment();
    log.warn("Car-rental listing did not stabilise after {} requests", maxRetries);
    throw new IncompleteSearchException(maxRetries);
  }

  private String url(CarRentalQuery query) {
    return endpoints.carRentalUrl(
        query.driverAge(),
        query.originKey(),
        query.destinationKey(),
        query.pickUpTime(),
        query.dropOffTime());
  }

  private Map<String, String> params(CarRentalQuery query) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("group", "true");
    params.put("sipp_map", "true");
    params.put("channel", "android");
    params.put("vndr_img_rounded", "true");
    params.put("ranking_enable", "false");
    params.put("reqn", String.valueOf(query.requestSequence()));
    params.put("version", "6.9");
    params.put("include_location", "true");
    params.put("city_search_enable", "true");
    return params;
  }

  private void pause(int requestsDone) {
    if (retryDelay.isZero()) {
      return;
    }
    try {
      Thread.sleep(retryDelay.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IncompleteSearchException(requestsDone, ex);
    }
  }
}
