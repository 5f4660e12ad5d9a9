package com.flamingo.ai.ragworkbench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the RAG workbench backend. */
@SpringBootApplication
public class RagWorkbenchApplication {

  public static void main(String[] args) {
    SpringApplication.run(RagWorkbenchApplication.class, args);
  }
}
