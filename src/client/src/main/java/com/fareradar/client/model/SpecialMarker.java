package com.fareradar.client.model;

/** Stands in for a date or a destination in a flexible search. */
public enum SpecialMarker implements FlightPlace, TravelDate {
  ANYTIME("anytime"),
  EVERYWHERE("everywhere");

  private final String wireValue;

  SpecialMarker(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /** Flexible markers restrict the search to the default cabin. */
  public boolean isFlexible() {
    return this == ANYTIME || this == EVERYWHERE;
  }
}
