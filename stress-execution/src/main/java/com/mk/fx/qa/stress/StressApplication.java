package com.mk.fx.qa.stress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StressApplication {

  public static void main(String[] args) {
    SpringApplication.run(StressApplication.class, args);
  }
}
