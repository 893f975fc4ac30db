package io.b2mash.b2b.backing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackingApplication {

  public static void main(String[] args) {
    SpringApplication.run(BackingApplication.class, args);
  }
}
