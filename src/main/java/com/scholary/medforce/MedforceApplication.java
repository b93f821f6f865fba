package com.scholary.medforce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedforceApplication {

  public static void main(String[] args) {
    SpringApplication.run(MedforceApplication.class, args);
  }
}
