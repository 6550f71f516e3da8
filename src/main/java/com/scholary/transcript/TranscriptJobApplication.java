package com.scholary.transcript;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TranscriptJobApplication {

  public static void main(String[] args) {
    SpringApplication.run(TranscriptJobApplication.class, args);
  }
}
