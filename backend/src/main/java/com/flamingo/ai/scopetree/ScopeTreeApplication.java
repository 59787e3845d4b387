package com.flamingo.ai.scopetree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the scope tree service. */
@SpringBootApplication
public class ScopeTreeApplication {

  public static void main(String[] args) {
    SpringApplication.run(ScopeTreeApplication.class, args);
  }
}
