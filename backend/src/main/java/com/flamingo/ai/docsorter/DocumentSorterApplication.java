package com.flamingo.ai.docsorter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocumentSorterApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocumentSorterApplication.class, args);
  }
}
