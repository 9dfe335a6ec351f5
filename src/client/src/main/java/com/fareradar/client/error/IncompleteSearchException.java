package com.fareradar.client.error;

/** Polling stopped before the backend reported a terminal result. */
public class IncompleteSearchException extends SearchException {
  private final int attempts;

  public IncompleteSearchException(int attempts) {
    super("Search still incomplete after " + attempts + " attempts");
    this.attempts = attempts;
  }

  public IncompleteSearchException(int attempts, Throwable cause) {
    super("Search abandoned after " + attempts + " attempts", cause);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
