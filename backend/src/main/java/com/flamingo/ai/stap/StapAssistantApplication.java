package com.flamingo.ai.stap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the STAP assistant cache and context service. */
@SpringBootApplication
public class StapAssistantApplication {

  public static void main(String[] args) {
    SpringApplication.run(StapAssistantApplication.class, args);
  }
}
