package com.fareradar.client.error;

/** Caller input rejected before any request was sent. */
public class SearchValidationException extends SearchException {
  public SearchValidationException(String message) {
    super(message);
  }

  public SearchValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
