package com.aiadvent.techdebt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TechDebtApplication {

  public static void main(String[] args) {
    SpringApplication.run(TechDebtApplication.class, args);
  }
}
