package com.flamingo.ai.factcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Claim verification service: hybrid evidence retrieval and LLM-based verdicts. */
@SpringBootApplication
public class FactCheckApplication {

  public static void main(String[] args) {
    SpringApplication.run(FactCheckApplication.class, args);
  }
}
