package com.fareradar.client.error;

/** Base type of every failure surfaced by the client. */
public abstract class SearchException extends RuntimeException {
  protected SearchException(String message) {
    super(message);
  }

  protected SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
