package com.harness.alertmigration.exception;

import java.time.Duration;

public class UnableToAcquireLockException extends MigrationException {

  private final String lockKey;

  public UnableToAcquireLockException(String lockKey, Duration timeout) {
    super(null, "Unable to acquire lock " + lockKey + " within " + timeout.toMillis() + "ms");
    this.lockKey = lockKey;
  }

  public String getLockKey() {
    return lockKey;
  }

  @Override
  public String code() {
    return "unable_to_acquire_lock";
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
