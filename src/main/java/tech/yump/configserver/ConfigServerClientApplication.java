package tech.yump.configserver;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.configserver.config.ConfigServerProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(ConfigServerProperties.class)
public class ConfigServerClientApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConfigServerClientApplication.class, args);
    log.info(">>> Config Server Client Started <<<");
  }
}
