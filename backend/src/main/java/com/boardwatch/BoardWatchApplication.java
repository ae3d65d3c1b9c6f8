package com.boardwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BoardWatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(BoardWatchApplication.class, args);
  }
}
