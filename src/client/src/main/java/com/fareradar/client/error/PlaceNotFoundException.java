package com.fareradar.client.error;

public class PlaceNotFoundException extends SearchException {
  public PlaceNotFoundException(String message) {
    super(message);
  }
}
