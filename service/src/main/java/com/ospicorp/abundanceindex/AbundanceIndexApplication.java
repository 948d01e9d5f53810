package com.ospicorp.abundanceindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AbundanceIndexApplication {

  public static void main(String[] args) {
    SpringApplication.run(AbundanceIndexApplication.class, args);
  }
}
