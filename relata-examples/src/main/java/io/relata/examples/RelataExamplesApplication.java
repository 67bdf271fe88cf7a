package io.relata.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class RelataExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(RelataExamplesApplication.class, args);
  }
}
