package io.b2mash.governance.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

class ApplicationYamlTest {

  private static Properties applicationYaml() {
    var factory = new YamlPropertiesFactoryBean();
    factory.setResources(new ClassPathResource("application.yml"));
    return factory.getObject();
  }

  @Test
  void applicationYaml_configuresNoHttpEndpointExposure() {
    var properties = applicationYaml();

    assertThat(properties.stringPropertyNames())
        .noneMatch(name -> name.startsWith("management.endpoints.web"))
        .noneMatch(name -> name.startsWith("server."));
  }

  @Test
  void applicationYaml_definesSupervisorSchedules() {
    var properties = applicationYaml();

    assertThat(properties.getProperty("governance.retention.cron")).isEqualTo("0 0 3 * * *");
    assertThat(properties.getProperty("governance.partitioning.cron")).isEqualTo("0 30 2 * * *");
    assertThat(properties.getProperty("spring.flyway.enabled")).isEqualTo("false");
  }
}
