package com.delta.acquisition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AcquisitionEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(AcquisitionEngineApplication.class, args);
  }
}
