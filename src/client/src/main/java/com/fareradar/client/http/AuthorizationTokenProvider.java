package com.fareradar.client.http;

/**
 * Generates an anti-bot authorization token when none is configured.
 *
 * <p>Called at most once, while the client identity is resolved at startup. Register an
 * implementation as a bean to enable it.
 */
public interface AuthorizationTokenProvider {
  AuthorizationToken generate(String proxy, boolean verify);
}
