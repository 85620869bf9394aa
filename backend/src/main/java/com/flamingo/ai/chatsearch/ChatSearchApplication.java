package com.flamingo.ai.chatsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the chat search service. */
@SpringBootApplication
public class ChatSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatSearchApplication.class, args);
  }
}
