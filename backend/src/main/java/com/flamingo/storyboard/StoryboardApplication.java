package com.flamingo.storyboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the storyboard back end. */
@SpringBootApplication
public class StoryboardApplication {

  public static void main(String[] args) {
    SpringApplication.run(StoryboardApplication.class, args);
  }
}
