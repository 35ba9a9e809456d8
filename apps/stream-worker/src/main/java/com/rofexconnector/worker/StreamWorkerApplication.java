package com.rofexconnector.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreamWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(StreamWorkerApplication.class, args);
  }
}
