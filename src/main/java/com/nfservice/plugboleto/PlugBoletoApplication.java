package com.nfservice.plugboleto;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlugBoletoApplication {

  public static void main(String[] args) {
    SpringApplication.run(PlugBoletoApplication.class, args);
  }
}
