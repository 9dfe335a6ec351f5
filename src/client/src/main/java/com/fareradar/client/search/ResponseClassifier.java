package com.fareradar.client.search;

import com.fareradar.client.http.BackendEndpoints;
import com.fareradar.client.http.BackendResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ResponseClassifier {
  private static final Logger log = LoggerFactory.getLogger(ResponseClassifier.class);
  private static final int STATUS_OK = 200;
  private static final int STATUS_CAPTCHA = 403;

  private final ObjectMapper objectMapper;
  private final BackendEndpoints endpoints;

  public ResponseClassifier(ObjectMapper objectMapper, BackendEndpoints endpoints) {
    this.objectMapper = objectMapper;
    this.endpoints = endpoints;
  }

  public ClassifiedResponse classify(BackendResponse response) {
    return classify(response.statusCode(), response.body());
  }

  public ClassifiedResponse classify(int statusCode, String body) {
    if (statusCode == STATUS_CAPTCHA) {
      String url = captchaUrl(body);
      log.warn("Backend answered with a captcha ban, redirect: {}", url);
      return new ClassifiedResponse.CaptchaBan(url);
    }
    if (statusCode != STATUS_OK) {
      return new ClassifiedResponse.TransportError(statusCode, body);
    }
    return parse(body)
        .<ClassifiedResponse>map(ClassifiedResponse.Success::new)
        .orElseGet(() -> new ClassifiedResponse.TransportError(statusCode, body));
  }

  /** Base domain plus {@code redirect_to} when the body carries one, else the bare base domain. */
  String captchaUrl(String body) {
    String base = endpoints.captchaBaseUrl();
    return parse(body)
        .map(json -> json.path("redirect_to"))
        .filter(JsonNode::isTextual)
        .map(JsonNode::asText)
        .filter(path -> !path.isBlank())
        .map(path -> base + path)
        .orElse(base);
  }

  private Optional<JsonNode> parse(String body) {
    if (body == null || body.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readTree(body));
    } catch (JsonProcessingException ex) {
      log.debug("Backend body is not JSON: {}", ex.getOriginalMessage());
      return Optional.empty();
    }
  }
}
