package com.fareradar.client.model;

import java.util.Objects;

public record LocationRef(String name, String entityId, String location) implements RentalPlace {
  public LocationRef {
    Objects.requireNonNull(entityId, "entityId");
  }

  public static LocationRef ofEntityId(String entityId) {
    return new LocationRef("", entityId, "");
  }
}
