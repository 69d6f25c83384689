package com.phonebook.directory;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationWritesJsonWithRequestFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"request_id\":\"%X{request_id:-}\"");
    assertThat(configText).contains("\"http_path\":\"%X{http_path:-}\"");
  }
}
