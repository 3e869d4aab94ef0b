package io.intellixity.sheetquery.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetQueryExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(SheetQueryExamplesApplication.class, args);
  }
}
