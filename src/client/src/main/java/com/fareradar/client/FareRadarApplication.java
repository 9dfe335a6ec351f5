package com.fareradar.client;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FareRadarApplication {
  // Boots the client context; callers embed it and use FareRadarClient.
  public static void main(String[] args) {
    SpringApplication.run(FareRadarApplication.class, args);
  }
}
