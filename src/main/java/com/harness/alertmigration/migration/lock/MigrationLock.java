package com.harness.alertmigration.migration.lock;

public interface MigrationLock extends AutoCloseable {

  String key();

  @Override
  void close();
}
