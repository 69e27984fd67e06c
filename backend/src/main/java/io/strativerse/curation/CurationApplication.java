package io.strativerse.curation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CurationApplication {

  public static void main(String[] args) {
    SpringApplication.run(CurationApplication.class, args);
  }
}
