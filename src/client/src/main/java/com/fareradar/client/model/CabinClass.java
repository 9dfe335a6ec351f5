package com.fareradar.client.model;

public enum CabinClass {
  ECONOMY("economy"),
  PREMIUM_ECONOMY("premium_economy"),
  BUSINESS("business"),
  FIRST("first");

  private final String wireValue;

  CabinClass(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
