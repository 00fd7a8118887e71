package com.flamingo.ai.policyanalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Legislative analysis service: chunked, cached, versioned LLM analysis of bills. */
@SpringBootApplication
public class PolicyAnalysisApplication {

  public static void main(String[] args) {
    SpringApplication.run(PolicyAnalysisApplication.class, args);
  }
}
