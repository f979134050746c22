package com.servicescaffold.product;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProductWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ProductWorkerApplication.class, args);
  }
}
