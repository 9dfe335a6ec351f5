package com.fareradar.client.search;

import com.fareradar.client.error.SearchValidationException;
import com.fareradar.client.model.AirportRef;
import com.fareradar.client.model.CabinClass;
import com.fareradar.client.model.CalendarDate;
import com.fareradar.client.model.Coordinates;
import com.fareradar.client.model.FlightPlace;
import com.fareradar.client.model.LocationRef;
import com.fareradar.client.model.RentalPlace;
import com.fareradar.client.model.SearchResult;
import com.fareradar.client.model.SpecialMarker;
import com.fareradar.client.model.TravelDate;
import com.fareradar.client.rental.CarRentalQuery;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the wire payloads of the three endpoint families: unified search, itinerary details and
 * car-rental listing. Holds no state.
 */
@Component
public class SearchRequestFactory {
  static final DateTimeFormatter RENTAL_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");
  static final String DRIVER_AGE_OVER_25 = "30";
  static final String DRIVER_AGE_UNDER_25 = "21";

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  /**
   * One directional leg. {@code placeOfStay} anchors a flexible leg to its known side: the
   * destination when it is an airport, else the origin.
   */
  public ObjectNode buildLeg(TravelDate date, FlightPlace origin, FlightPlace destination) {
    ObjectNode leg = NODES.objectNode();
    leg.set("dates", encodeDate(date));
    leg.set("legOrigin", encodePlace(origin));
    leg.set("legDestination", encodePlace(destination));
    if (destination instanceof AirportRef airport) {
      leg.put("placeOfStay", airport.entityId());
    } else if (origin instanceof AirportRef airport) {
      leg.put("placeOfStay", airport.entityId());
    }
    return leg;
  }

  /** Outbound leg first; the return leg, when present, swaps origin and destination. */
  public ObjectNode buildSearchPayload(
      AirportRef origin,
      FlightPlace destination,
      TravelDate departDate,
      TravelDate returnDate,
      CabinClass cabinClass,
      int adults,
      List<Integer> childAges) {
    ObjectNode payload = NODES.objectNode();
    payload.put("adults", adults);
    ArrayNode children = payload.putArray("childAges");
    childAges.forEach(children::add);
    payload.put("cabinClass", cabinClass.wireValue());
    ArrayNode legs = payload.putArray("legs");
    legs.add(buildLeg(departDate, origin, destination));
    if (returnDate != null) {
      legs.add(buildLeg(returnDate, destination, origin));
    }
    payload.putNull("options");
    return payload;
  }

  public ObjectNode buildItineraryDetailRequest(
      String itineraryId, SearchResult result, String locale, String market, String currency) {
    if (itineraryId == null || itineraryId.isBlank()) {
      throw new SearchValidationException("Itinerary id is required");
    }
    String sessionId = result.session()
        .orElseThrow(() -> new SearchValidationException(
            "Search result carries no session id, itinerary details cannot be requested"));
    if (!(result.destination() instanceof AirportRef destination)) {
      throw new SearchValidationException(
          "Itinerary details need a concrete destination, got " + result.destination());
    }
    AirportRef origin = result.origin();
    JsonNode searchPayload = result.searchPayload();

    ObjectNode request = NODES.objectNode();
    request.put("itineraryId", itineraryId);
    request.put("searchSessionId", sessionId);
    request.putArray("featuresEnabled").add("FEATURES_ENABLED_ITINERARY_LEGACY_INFO");

    ObjectNode preferences = request.putObject("userPreferences");
    preferences.put("market", market);
    preferences.put("currencyCode", currency);
    preferences.put("locale", locale);

    ObjectNode details = request.putObject("searchRequestDetails");
    details.set("adults", searchPayload.path("adults"));
    details.set("cabinClass", searchPayload.path("cabinClass"));
    JsonNode childAges = searchPayload.path("childAges");
    if (childAges.isArray() && !childAges.isEmpty()) {
      details.set("childAges", childAges);
    }
    ArrayNode legs = details.putArray("legs");
    for (JsonNode leg : searchPayload.path("legs")) {
      legs.add(buildDetailLeg(leg, origin, destination));
    }

    ArrayNode filters = request.putObject("options")
        .putObject("totalCostOptions")
        .putArray("fareAttributeFilters");
    filters.add("ATTRIBUTE_CABIN_BAGGAGE");
    filters.add("ATTRIBUTE_CHECKED_BAGGAGE");
    return request;
  }

  public CarRentalQuery buildCarRentalQuery(
      RentalPlace origin,
      RentalPlace destination,
      LocalDateTime departTime,
      LocalDateTime returnTime,
      boolean driverOver25) {
    return new CarRentalQuery(
        rentalKey(origin),
        rentalKey(destination),
        driverOver25 ? DRIVER_AGE_OVER_25 : DRIVER_AGE_UNDER_25,
        departTime.format(RENTAL_TIME_FORMAT),
        returnTime.format(RENTAL_TIME_FORMAT),
        0);
  }

  // Outbound and return legs swap sides, so each leg endpoint is matched on its own.
  private ObjectNode buildDetailLeg(JsonNode leg, AirportRef origin, AirportRef destination) {
    String originCode = codeFor(entityId(leg, "legOrigin"), origin, destination);
    String destinationCode = codeFor(entityId(leg, "legDestination"), origin, destination);
    JsonNode dates = leg.path("dates");
    if (!dates.has("year")) {
      throw new SearchValidationException("Itinerary details need concrete leg dates, got " + dates);
    }

    ObjectNode detail = NODES.objectNode();
    detail.put("originIata", originCode);
    detail.put("destinationIata", destinationCode);
    ObjectNode date = detail.putObject("date");
    date.put("year", dates.path("year").asInt());
    date.put("month", dates.path("month").asInt());
    date.put("day", dates.path("day").asInt());
    detail.put("addAlternativeOrigins", false);
    detail.put("addAlternativeDestinations", false);
    detail.put("originSkyscannerCode", originCode);
    detail.put("destinationSkyscannerCode", destinationCode);
    detail.put("originEntityId", "");
    detail.put("destinationEntityId", "");
    return detail;
  }

  private String codeFor(String entityId, AirportRef origin, AirportRef destination) {
    if (origin.entityId().equals(entityId)) {
      return origin.skyCode();
    }
    if (destination.entityId().equals(entityId)) {
      return destination.skyCode();
    }
    throw new SearchValidationException(
        "Leg entity " + entityId + " matches neither " + origin.skyCode() + " nor " + destination.skyCode());
  }

  private String entityId(JsonNode leg, String field) {
    JsonNode entityId = leg.path(field).path("entityId");
    if (!entityId.isTextual()) {
      throw new SearchValidationException("Leg has no concrete " + field + ": " + leg.path(field));
    }
    return entityId.asText();
  }

  private ObjectNode encodeDate(TravelDate date) {
    ObjectNode node = NODES.objectNode();
    if (date instanceof CalendarDate calendarDate) {
      node.put("@type", "date");
      node.put("year", calendarDate.year());
      node.put("month", calendarDate.month());
      node.put("day", calendarDate.day());
      return node;
    }
    node.put("@type", ((SpecialMarker) date).wireValue());
    return node;
  }

  private ObjectNode encodePlace(FlightPlace place) {
    ObjectNode node = NODES.objectNode();
    if (place instanceof AirportRef airport) {
      node.put("@type", "entity");
      node.put("entityId", airport.entityId());
      return node;
    }
    node.put("@type", ((SpecialMarker) place).wireValue());
    return node;
  }

  private String rentalKey(RentalPlace place) {
    if (place instanceof Coordinates coordinates) {
      return coordinates.asQueryValue();
    }
    if (place instanceof LocationRef location) {
      return location.entityId();
    }
    return ((AirportRef) place).entityId();
  }
}
