package com.fareradar.client.http;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity headers sent with every backend request. Built once at startup and shared read-only by
 * all searches.
 */
public record ClientIdentity(
    String locale,
    String currency,
    String market,
    String authorizationToken,
    String clientInstanceId) {

  public ClientIdentity {
    Objects.requireNonNull(locale, "locale");
    Objects.requireNonNull(currency, "currency");
    Objects.requireNonNull(market, "market");
    Objects.requireNonNull(authorizationToken, "authorizationToken");
    Objects.requireNonNull(clientInstanceId, "clientInstanceId");
  }

  public Map<String, String> headers() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("X-Skyscanner-ChannelId", "goandroid");
    headers.put("X-Skyscanner-Currency", currency);
    headers.put("X-Skyscanner-Locale", locale);
    headers.put("X-Skyscanner-Market", market);
    headers.put("X-Skyscanner-Device", "Android-phone");
    headers.put("X-Skyscanner-Device-Class", "phone");
    headers.put("X-Skyscanner-Client-Type", "net.skyscanner.android.main");
    headers.put("X-Skyscanner-Client-Network-Type", "WIFI");
    headers.put("X-Px-Authorization", authorizationToken);
    headers.put("X-PX-Os", "Android");
    headers.put("X-Px-Uuid", clientInstanceId);
    headers.put("X-Px-Mobile-Sdk-Version", "3.4.4");
    return Map.copyOf(headers);
  }

  @Override
  public String toString() {
    // Keep the token out of logs.
    return "ClientIdentity[locale=" + locale + ", currency=" + currency + ", market=" + market
        + ", clientInstanceId=" + clientInstanceId + "]";
  }
}
