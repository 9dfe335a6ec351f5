package com.fareradar.client.model;

import java.util.Objects;

/**
 * A concrete airport as returned by the autosuggest endpoint.
 *
 * @param title display name
 * @param entityId backend key used in search payloads
 * @param skyCode human-facing airport code used in itinerary-detail requests
 */
public record AirportRef(String title, String entityId, String skyCode)
    implements FlightPlace, RentalPlace {
  public AirportRef {
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(skyCode, "skyCode");
  }
}
