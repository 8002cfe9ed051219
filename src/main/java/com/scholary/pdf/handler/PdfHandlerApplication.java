package com.scholary.pdf.handler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfHandlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(PdfHandlerApplication.class, args);
  }
}
