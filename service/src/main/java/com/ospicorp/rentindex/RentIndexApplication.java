package com.ospicorp.rentindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RentIndexApplication {

  public static void main(String[] args) {
    SpringApplication.run(RentIndexApplication.class, args);
  }
}
