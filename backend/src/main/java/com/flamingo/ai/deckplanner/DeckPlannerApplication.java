package com.flamingo.ai.deckplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeckPlannerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeckPlannerApplication.class, args);
  }
}
