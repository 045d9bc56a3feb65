package com.flamingo.ai.persona;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the persona engine service. */
@SpringBootApplication
public class PersonaEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(PersonaEngineApplication.class, args);
  }
}
