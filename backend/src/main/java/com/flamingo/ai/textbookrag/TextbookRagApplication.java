package com.flamingo.ai.textbookrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TextbookRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(TextbookRagApplication.class, args);
  }
}
