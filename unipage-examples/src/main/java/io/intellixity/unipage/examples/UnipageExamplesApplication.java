package io.intellixity.unipage.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class UnipageExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(UnipageExamplesApplication.class, args);
  }
}
