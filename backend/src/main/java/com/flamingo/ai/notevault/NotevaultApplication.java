package com.flamingo.ai.notevault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the note vault backend. */
@SpringBootApplication
public class NotevaultApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotevaultApplication.class, args);
  }
}
