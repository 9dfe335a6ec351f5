package com.fareradar.client.search;

import static com.fareradar.client.FareRadarFixtures.ISTANBUL;
import static com.fareradar.client.FareRadarFixtures.TOKYO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fareradar.client.FareRadarFixtures;
import com.fareradar.client.error.CaptchaBanException;
import com.fareradar.client.error.IncompleteSearchException;
import com.fareradar.client.error.SearchTransportException;
import com.fareradar.client.error.SearchValidationException;
import com.fareradar.client.http.BackendEndpoints;
import com.fareradar.client.http.BackendGateway;
import com.fareradar.client.http.BackendResponse;
import com.fareradar.client.model.CabinClass;
import com.fareradar.client.model.CalendarDate;
import com.fareradar.client.model.SearchResult;
import com.fareradar.client.model.SpecialMarker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class FlightSearchControllerTest {
  private static final String SEARCH_URL = "https://backend.example/search/";

  private BackendGateway gateway;
  private SimpleMeterRegistry meterRegistry;
  private FlightSearchController controller;

  @BeforeEach
  void setUp() {
    gateway = mock(BackendGateway.class);
    meterRegistry = new SimpleMeterRegistry();
    controller = controller(3);
  }

  @Test
  void returnsImmediatelyWhenInitialRequestIsComplete() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap()))
        .thenReturn(complete("final-session"));

    SearchResult result = controller.search(
        ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1), CalendarDate.of(2026, 6, 11),
        CabinClass.FIRST, 5, List.of(9, 13));

    assertThat(result.sessionId()).isEqualTo("final-session");
    assertThat(result.origin()).isEqualTo(ISTANBUL);
    assertThat(result.destination()).isEqualTo(TOKYO);
    assertThat(result.searchPayload().path("legs")).hasSize(2);
    assertThat(result.searchPayload().path("adults").asInt()).isEqualTo(5);
    verify(gateway, never()).get(anyString(), anyMap(), anyMap());
    assertThat(meterRegistry.counter("fareradar.flights.searches.total", "outcome", "complete").count())
        .isEqualTo(1.0);
  }

  @Test
  void pollsAlwaysTargetTheLatestSessionId() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap())).thenReturn(incomplete("s0"));
    when(gateway.get(anyString(), anyMap(), anyMap()))
        .thenReturn(incomplete("s1"), incomplete("s2"), complete("done"));

    SearchResult result = controller.search(ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1));

    ArgumentCaptor<String> urls = ArgumentCaptor.forClass(String.class);
    verify(gateway, times(3)).get(urls.capture(), anyMap(), anyMap());
    assertThat(urls.getAllValues()).containsExactly(SEARCH_URL + "s0", SEARCH_URL + "s1", SEARCH_URL + "s2");
    assertThat(result.sessionId()).isEqualTo("done");
  }

  @Test
  void pollWithoutSessionIdKeepsThePreviousOne() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap())).thenReturn(incomplete("s0"));
    when(gateway.get(anyString(), anyMap(), anyMap()))
        .thenReturn(
            new BackendResponse(200, "{\"context\":{\"status\":\"incomplete\"}}"),
            complete("done"));

    controller.search(ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1));

    ArgumentCaptor<String> urls = ArgumentCaptor.forClass(String.class);
    verify(gateway, times(2)).get(urls.capture(), anyMap(), anyMap());
    assertThat(urls.getAllValues()).containsExactly(SEARCH_URL + "s0", SEARCH_URL + "s0");
  }

  @Test
  void failsAfterExactlyMaxRetriesPolls() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap())).thenReturn(incomplete("s0"));
    when(gateway.get(anyString(), anyMap(), anyMap())).thenReturn(incomplete("s1"));

    assertThatThrownBy(() -> controller.search(ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1)))
        .isInstanceOf(IncompleteSearchException.class)
        .satisfies(ex -> assertThat(((IncompleteSearchException) ex).attempts()).isEqualTo(3));

    verify(gateway, times(1)).postJson(anyString(), any(JsonNode.class), anyMap());
    verify(gateway, times(3)).get(anyString(), anyMap(), anyMap());
    assertThat(meterRegistry.counter("fareradar.flights.polls.total").count()).isEqualTo(3.0);
    assertThat(meterRegistry.counter("fareradar.flights.searches.total", "outcome", "exhausted").count())
        .isEqualTo(1.0);
  }

  @Test
  void captchaDuringPollingIsSurfacedAsBan() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap())).thenReturn(incomplete("s0"));
    when(gateway.get(anyString(), anyMap(), anyMap()))
        .thenReturn(new BackendResponse(403, "{\"redirect_to\":\"/sttc/px/captcha\"}"));

    assertThatThrownBy(() -> controller.search(ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1)))
        .isInstanceOf(CaptchaBanException.class)
        .satisfies(ex -> assertThat(((CaptchaBanException) ex).banUrl())
            .isEqualTo("https://captcha.example/sttc/px/captcha"));
    verify(gateway, times(1)).get(anyString(), anyMap(), anyMap());
  }

  @Test
  void captchaOnInitialRequestIsSurfacedAsBan() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap()))
        .thenReturn(new BackendResponse(403, "blocked"));

    assertThatThrownBy(() -> controller.search(ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1)))
        .isInstanceOf(CaptchaBanException.class);
    verify(gateway, never()).get(anyString(), anyMap(), anyMap());
  }

  @Test
  void unexpectedStatusDuringPollingIsTransportError() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap())).thenReturn(incomplete("s0"));
    when(gateway.get(anyString(), anyMap(), anyMap())).thenReturn(new BackendResponse(500, "oops"));

    assertThatThrownBy(() -> controller.search(ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1)))
        .isInstanceOf(SearchTransportException.class)
        .satisfies(ex -> assertThat(((SearchTransportException) ex).statusCode()).isEqualTo(500));
  }

  @Test
  void unknownStatusFieldIsTransportError() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap()))
        .thenReturn(new BackendResponse(200, "{\"context\":{\"status\":\"weird\",\"sessionId\":\"s0\"}}"));

    assertThatThrownBy(() -> controller.search(ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1)))
        .isInstanceOf(SearchTransportException.class);
  }

  @Test
  void validationHappensBeforeAnyRequest() {
    assertThatThrownBy(() -> controller.search(
        ISTANBUL, SpecialMarker.EVERYWHERE, CalendarDate.of(2026, 6, 1), null, CabinClass.BUSINESS, 1, List.of()))
        .isInstanceOf(SearchValidationException.class);
    assertThatThrownBy(() -> controller.search(
        ISTANBUL, TOKYO, CalendarDate.of(2026, 2, 1), null, CabinClass.ECONOMY, 1, List.of()))
        .isInstanceOf(SearchValidationException.class);
    assertThatThrownBy(() -> controller.search(
        ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 11), CalendarDate.of(2026, 6, 1), CabinClass.ECONOMY, 1, List.of()))
        .isInstanceOf(SearchValidationException.class);
    assertThatThrownBy(() -> controller.search(
        ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1), null, CabinClass.ECONOMY, 9, List.of()))
        .isInstanceOf(SearchValidationException.class);

    verifyNoInteractions(gateway);
  }

  @Test
  void missingDepartDateDefaultsToNow() {
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap())).thenReturn(complete("s"));

    SearchResult result = controller.search(ISTANBUL, TOKYO, null);

    JsonNode dates = result.searchPayload().path("legs").get(0).path("dates");
    assertThat(dates.path("year").asInt()).isEqualTo(2026);
    assertThat(dates.path("month").asInt()).isEqualTo(3);
    assertThat(dates.path("day").asInt()).isEqualTo(1);
  }

  @Test
  void zeroRetriesFailsWithoutPolling() {
    FlightSearchController noRetries = controller(0);
    when(gateway.postJson(eq(SEARCH_URL), any(JsonNode.class), anyMap())).thenReturn(incomplete("s0"));

    assertThatThrownBy(() -> noRetries.search(ISTANBUL, TOKYO, CalendarDate.of(2026, 6, 1)))
        .isInstanceOf(IncompleteSearchException.class);
    verify(gateway, never()).get(anyString(), anyMap(), anyMap());
  }

  private FlightSearchController controller(int maxRetries) {
    BackendEndpoints endpoints = new BackendEndpoints(FareRadarFixtures.properties(maxRetries));
    return new FlightSearchController(
        gateway,
        endpoints,
        new ResponseClassifier(new ObjectMapper(), endpoints),
        new SearchRequestFactory(),
        FareRadarFixtures.properties(maxRetries),
        FareRadarFixtures.CLOCK,
        meterRegistry);
  }

  private BackendResponse incomplete(String sessionId) {
    return new BackendResponse(200,
        "{\"context\":{\"status\":\"incomplete\",\"sessionId\":\"" + sessionId + "\"}}");
  }

  private BackendResponse complete(String sessionId) {
    return new BackendResponse(200, """
        {
          "context": {"status": "complete", "sessionId": "ignored"},
          "itineraries": {"context": {"sessionId": "%s"}, "buckets": []}
        }
        """.formatted(sessionId));
  }
}
