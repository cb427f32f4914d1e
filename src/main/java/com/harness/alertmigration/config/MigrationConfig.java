package com.harness.alertmigration.config;

import com.harness.alertmigration.migration.lock.InMemoryLockManager;
import com.harness.alertmigration.migration.lock.LockManager;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MigrationConfig {

  @Bean
  public LockManager lockManager(
      @Value("${migration.detector-lock.initial-delay-ms:100}") long initialDelayMs) {
    // Single-node lock; swap for a shared-storage implementation when workers span JVMs.
    return new InMemoryLockManager(Duration.ofMillis(initialDelayMs));
  }
}
