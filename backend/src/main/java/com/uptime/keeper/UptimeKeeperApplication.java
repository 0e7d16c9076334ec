package com.uptime.keeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UptimeKeeperApplication {

  public static void main(String[] args) {
    SpringApplication.run(UptimeKeeperApplication.class, args);
  }
}
