package com.fareradar.client;

import static org.assertj.core.api.Assertions.assertThat;

import com.fareradar.client.http.ClientIdentity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class FareRadarApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @Test
  void contextLoads() {
    assertThat(applicationContext.getBean(FareRadarClient.class)).isNotNull();
    ClientIdentity identity = applicationContext.getBean(ClientIdentity.class);
    assertThat(identity.authorizationToken()).isEqualTo("test-token");
    assertThat(identity.market()).isEqualTo("UK");
  }
}
