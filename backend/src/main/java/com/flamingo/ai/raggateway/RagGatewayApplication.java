package com.flamingo.ai.raggateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RagGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(RagGatewayApplication.class, args);
  }
}
