package io.b2mash.b2b.isolation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IsolationApplication {

  public static void main(String[] args) {
    SpringApplication.run(IsolationApplication.class, args);
  }
}
