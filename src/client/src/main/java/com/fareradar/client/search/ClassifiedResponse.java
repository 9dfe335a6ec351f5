package com.fareradar.client.search;

import com.fareradar.client.error.CaptchaBanException;
import com.fareradar.client.error.SearchTransportException;
import com.fasterxml.jackson.databind.JsonNode;

/** Outcome of a backend answer: usable JSON, an anti-bot ban, or an unexpected status. */
public sealed interface ClassifiedResponse {

  record Success(JsonNode json) implements ClassifiedResponse {}

  record CaptchaBan(String url) implements ClassifiedResponse {}

  record TransportError(int statusCode, String body) implements ClassifiedResponse {}

  /** Returns the JSON of a {@link Success}, or throws the exception matching the failure. */
  default JsonNode orThrow() {
    if (this instanceof Success success) {
      return success.json();
    }
    if (this instanceof CaptchaBan ban) {
      throw new CaptchaBanException(ban.url());
    }
    TransportError error = (TransportError) this;
    throw new SearchTransportException(error.statusCode(), error.body());
  }
}
