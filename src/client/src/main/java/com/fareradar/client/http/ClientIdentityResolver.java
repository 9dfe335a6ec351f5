package com.fareradar.client.http;

import com.fareradar.client.config.FareRadarProperties;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;

@Component
public class ClientIdentityResolver {
  private static final Logger log = LoggerFactory.getLogger(ClientIdentityResolver.class);

  private final FareRadarProperties properties;
  private final SsmClient ssmClient;
  private final Optional<AuthorizationTokenProvider> tokenProvider;

  public ClientIdentityResolver(
      FareRadarProperties properties,
      SsmClient ssmClient,
      Optional<AuthorizationTokenProvider> tokenProvider) {
    this.properties = properties;
    this.ssmClient = ssmClient;
    this.tokenProvider = tokenProvider;
  }

  public ClientIdentity resolve() {
    AuthorizationToken token = resolveToken();
    ClientIdentity identity = new ClientIdentity(
        required("fareradar.locale", properties.locale()),
        required("fareradar.currency", properties.currency()),
        required("fareradar.market", properties.market()),
        token.token(),
        token.clientInstanceId());
    log.info("Client identity resolved: {}", identity);
    return identity;
  }

  private AuthorizationToken resolveToken() {
    // Prefer an explicit token; fall back to SSM, then to the generator if one is registered.
    FareRadarProperties.Authorization authorization = properties.authorization();
    if (authorization != null && isPresent(authorization.token())) {
      return new AuthorizationToken(authorization.token().trim(), UUID.randomUUID().toString());
    }

    if (authorization != null && isPresent(authorization.tokenSsm())) {
      String token = getParameter(authorization.tokenSsm().trim());
      log.info("Authorization token loaded from SSM parameter {}", authorization.tokenSsm());
      return new AuthorizationToken(token, UUID.randomUUID().toString());
    }

    if (tokenProvider.isPresent()) {
      AuthorizationToken generated = tokenProvider.get().generate(properties.proxy(), properties.verify());
      if (generated == null || !isPresent(generated.token())) {
        throw new IllegalStateException("Authorization token provider returned no token");
      }
      String instanceId = isPresent(generated.clientInstanceId())
          ? generated.clientInstanceId()
          : UUID.randomUUID().toString();
      return new AuthorizationToken(generated.token(), instanceId);
    }

    throw new IllegalStateException(
        "Authorization token is missing. Set FARERADAR_AUTHORIZATION_TOKEN, an SSM parameter name, or register an AuthorizationTokenProvider.");
  }

  private String required(String field, String value) {
    if (!isPresent(value)) {
      throw new IllegalStateException("FareRadar configuration missing: " + field);
    }
    return value.trim();
  }

  private boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }

  private String getParameter(String name) {
    return ssmClient.getParameter(
        GetParameterRequest.builder().name(name).withDecryption(true).build()).parameter().value();
  }
}
