package com.flamingo.ai.mathgrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the math answer grading service. */
@SpringBootApplication
public class MathGraderApplication {

  public static void main(String[] args) {
    SpringApplication.run(MathGraderApplication.class, args);
  }
}
