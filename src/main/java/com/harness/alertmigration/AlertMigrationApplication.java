package com.harness.alertmigration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlertMigrationApplication {
  public static void main(String[] args) {
    SpringApplication.run(AlertMigrationApplication.class, args);
  }
}
