package com.fareradar.client.error;

/**
 * Unexpected backend answer. {@code statusCode} is 0 when no HTTP response was received.
 */
public class SearchTransportException extends SearchException {
  private final int statusCode;
  private final String body;

  public SearchTransportException(int statusCode, String body) {
    super("Unexpected backend response, status_code: " + statusCode + " response: " + body);
    this.statusCode = statusCode;
    this.body = body;
  }

  public SearchTransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
    this.body = "";
  }

  public int statusCode() {
    return statusCode;
  }

  public String body() {
    return body;
  }
}
