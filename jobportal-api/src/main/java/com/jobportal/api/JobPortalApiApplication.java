package com.jobportal.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.jobportal")
@ConfigurationPropertiesScan(basePackages = "com.jobportal")
public class JobPortalApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(JobPortalApiApplication.class, args);
  }
}
