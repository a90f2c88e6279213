package com.scholary.flow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(FlowBackendApplication.class, args);
  }
}
