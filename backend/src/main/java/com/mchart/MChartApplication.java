package com.mchart;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MChartApplication {

  public static void main(String[] args) {
    SpringApplication.run(MChartApplication.class, args);
  }
}
