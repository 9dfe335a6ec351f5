package com.fareradar.client.http;

/** Anti-bot authorization token and the client instance id it was issued for. */
public record AuthorizationToken(String token, String clientInstanceId) {}
