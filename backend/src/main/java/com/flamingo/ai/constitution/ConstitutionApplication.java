package com.flamingo.ai.constitution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the constitution reader backend. */
@SpringBootApplication
public class ConstitutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConstitutionApplication.class, args);
  }
}
