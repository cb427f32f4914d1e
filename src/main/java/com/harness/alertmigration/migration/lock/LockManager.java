package com.harness.alertmigration.migration.lock;

import com.harness.alertmigration.exception.UnableToAcquireLockException;
import java.time.Duration;

/**
 * Named mutual exclusion with bounded waiting.
 */
public interface LockManager {

  /**
   * Blocks until the lock for {@code key} is held or {@code timeout} elapses.
   *
   * @throws UnableToAcquireLockException if the lock could not be acquired in time
   */
  MigrationLock tryAcquire(String key, Duration timeout);
}
