package com.flamingo.ai.retrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetrievalCoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(RetrievalCoreApplication.class, args);
  }
}
