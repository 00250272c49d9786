package com.tallybook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TallybookApplication {
  public static void main(String[] args) {
    SpringApplication.run(TallybookApplication.class, args);
  }
}
