package com.fareradar.client.config;

import com.fareradar.client.http.ClientIdentity;
import com.fareradar.client.http.ClientIdentityResolver;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;

@Configuration
public class AppConfig {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  @Bean
  public HttpClient httpClient(FareRadarProperties properties) {
    HttpClient.Builder builder = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NEVER);

    if (properties.proxy() != null && !properties.proxy().isBlank()) {
      URI proxy = URI.create(properties.proxy().trim());
      if (proxy.getHost() == null || proxy.getPort() < 0) {
        throw new IllegalStateException("fareradar.proxy must look like http://host:port, got: " + properties.proxy());
      }
      builder.proxy(ProxySelector.of(new InetSocketAddress(proxy.getHost(), proxy.getPort())));
      log.info("Routing backend traffic through proxy {}:{}", proxy.getHost(), proxy.getPort());
    }

    if (!properties.verify()) {
      log.warn("TLS certificate verification is disabled (fareradar.verify=false)");
      builder.sslContext(trustAllContext());
    }
    return builder.build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public SsmClient ssmClient(AwsProperties awsProperties) {
    return SsmClient.builder().region(Region.of(awsProperties.region())).build();
  }

  @Bean
  public ClientIdentity clientIdentity(ClientIdentityResolver resolver) {
    return resolver.resolve();
  }

  private SSLContext trustAllContext() {
    TrustManager[] trustAll = {
      new X509TrustManager() {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public X509Certificate[] getAcceptedIssuers() {
          return new X509Certificate[0];
        }
      }
    };
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, trustAll, new SecureRandom());
      return context;
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Unable to build TLS context without certificate verification", ex);
    }
  }
}
