package com.scholary.codeindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the code indexing service.
 *
 * <p>Runs resumable background indexing jobs over source directories and exposes a REST control
 * plane to start, pause, resume, cancel and inspect them.
 */
@SpringBootApplication
@EnableScheduling
public class CodeIndexApplication {

  public static void main(String[] args) {
    SpringApplication.run(CodeIndexApplication.class, args);
  }
}
