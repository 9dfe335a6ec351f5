package com.fareradar.client.search;

import com.fareradar.client.http.BackendEndpoints;
import com.fareradar.client.http.BackendGateway;
import com.fareradar.client.http.BackendResponse;
import com.fareradar.client.http.ClientIdentity;
import com.fareradar.client.model.SearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Fetches the detail view of one itinerary out of a completed search. */
@Component
public class ItineraryDetailsService {
  private static final Logger log = LoggerFactory.getLogger(ItineraryDetailsService.class);

  private final BackendGateway gateway;
  private final BackendEndpoints endpoints;
  private final ResponseClassifier classifier;
  private final SearchRequestFactory requestFactory;
  private final ClientIdentity identity;

  public ItineraryDetailsService(
      BackendGateway gateway,
      BackendEndpoints endpoints,
      ResponseClassifier classifier,
      SearchRequestFactory requestFactory,
      ClientIdentity identity) {
    this.gateway = gateway;
    this.endpoints = endpoints;
    this.classifier = classifier;
    this.requestFactory = requestFactory;
    this.identity = identity;
  }

  /** {@code itineraryId} must come from the itineraries of {@code result}. */
  public JsonNode details(String itineraryId, SearchResult result) {
    ObjectNode request = requestFactory.buildItineraryDetailRequest(
        itineraryId, result, identity.locale(), identity.market(), identity.currency());
    log.debug("Requesting itinerary {} of session {}", itineraryId, result.sessionId());
    BackendResponse response = gateway.postJson(endpoints.itineraryDetailsUrl(), request, detailHeaders());
    return classifier.classify(response).orThrow();
  }

  private Map<String, String> detailHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("grpc-metadata-x-skyscanner-devicedetection-istablet", "false");
    headers.put("grpc-metadata-x-skyscanner-devicedetection-ismobile", "true");
    headers.put("grpc-metadata-x-skyscanner-channelid", "goandroid");
    headers.put("grpc-metadata-x-skyscanner-viewid", UUID.randomUUID().toString());
    headers.put("grpc-metadata-x-skyscanner-clientid", "skyscanner_app");
    headers.put("grpc-metadata-x-skyscanner-client-type", "net.skyscanner.android.main");
    headers.put("grpc-metadata-skyscanner-flights-config-session-id", UUID.randomUUID().toString());
    headers.put("grpc-metadata-x-skyscanner-consent-information", "true");
    headers.put("grpc-metadata-x-skyscanner-consent-adverts", "true");
    headers.put("content-type", "application/json; charset=utf-8");
    return headers;
  }
}
