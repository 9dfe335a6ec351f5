package com.fareradar.client.model;

import java.math.BigDecimal;

public record Coordinates(double latitude, double longitude) implements RentalPlace {
  public Coordinates {
    if (latitude < -90.0 || latitude > 90.0) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
    if (longitude < -180.0 || longitude > 180.0) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
  }

  /** Backend form: {@code "lat,lon"}, plain decimals without exponent. */
  public String asQueryValue() {
    return plain(latitude) + "," + plain(longitude);
  }

  private static String plain(double value) {
    BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
    return (decimal.scale() < 1 ? decimal.setScale(1) : decimal).toPlainString();
  }
}
