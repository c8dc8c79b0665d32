package com.flamingo.ai.arabicsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the Arabic transcript search backend. */
@SpringBootApplication
public class ArabicSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArabicSearchApplication.class, args);
  }
}
