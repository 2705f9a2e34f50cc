package com.fleethunt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FleetHuntApplication {
  public static void main(String[] args) {
    SpringApplication.run(FleetHuntApplication.class, args);
  }
}
