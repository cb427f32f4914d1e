package com.harness.alertmigration.migration.lock;

import com.harness.alertmigration.exception.UnableToAcquireLockException;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local lock manager. Waiters poll with exponential backoff, starting at the configured
 * initial delay and capped at one second, until the timeout elapses.
 *
 * <p>A key's entry lives only while some thread holds or waits for it, so the map does not grow
 * with the number of projects ever migrated.
 *
 * <p>Only suitable when every migration worker runs in the same JVM. A multi-node deployment
 * needs a lock backed by shared storage behind the same {@link LockManager} interface.
 */
public class InMemoryLockManager implements LockManager {

  private static final Logger log = LoggerFactory.getLogger(InMemoryLockManager.class);
  private static final long MAX_DELAY_MS = 1_000;

  private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
  private final Duration initialDelay;

  public InMemoryLockManager(Duration initialDelay) {
    this.initialDelay = initialDelay;
  }

  @Override
  public MigrationLock tryAcquire(String key, Duration timeout) {
    KeyLock keyLock = locks.compute(key, (k, existing) -> {
      KeyLock entry = existing != null ? existing : new KeyLock();
      entry.users++;
      return entry;
    });
    long deadline = System.nanoTime() + timeout.toNanos();
    long delayMs = Math.max(1, initialDelay.toMillis());
    try {
      while (!keyLock.lock.tryLock()) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs <= 0) {
          log.warn("Timed out after {}ms waiting for lock {}", timeout.toMillis(), key);
          throw new UnableToAcquireLockException(key, timeout);
        }
        Thread.sleep(Math.min(delayMs, remainingMs));
        delayMs = Math.min(delayMs * 2, MAX_DELAY_MS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      release(key);
      throw new UnableToAcquireLockException(key, timeout);
    } catch (UnableToAcquireLockException e) {
      release(key);
      throw e;
    }
    return new HeldLock(key, keyLock);
  }

  int trackedKeyCount() {
    return locks.size();
  }

  private void release(String key) {
    locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
  }

  // users is only read and written inside ConcurrentHashMap.compute for the key
  private static final class KeyLock {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }

  private final class HeldLock implements MigrationLock {

    private final String key;
    private final KeyLock keyLock;

    private HeldLock(String key, KeyLock keyLock) {
      this.key = key;
      this.keyLock = keyLock;
    }

    @Override
    public String key() {
      return key;
    }

    @Override
    public void close() {
      keyLock.lock.unlock();
      release(key);
    }
  }
}
