package com.harness.alertmigration.migration;

import com.harness.alertmigration.exception.UnableToAcquireLockException;
import com.harness.alertmigration.migration.lock.LockManager;
import com.harness.alertmigration.migration.lock.MigrationLock;
import com.harness.alertmigration.model.DetectorDto;
import com.harness.alertmigration.repository.DetectorEntity;
import com.harness.alertmigration.repository.DetectorRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the one default error detector per project.
 *
 * <p>There is no unique constraint on detectors, so creation is serialized per project with a
 * short-lived lock. The lock is only taken when the detector does not exist yet, and the lookup is
 * repeated once the lock is held. Creation commits in its own transaction before the lock is
 * released.
 */
@Service
public class DefaultDetectorService {

  private static final Logger log = LoggerFactory.getLogger(DefaultDetectorService.class);

  static final String LOCK_KEY_PREFIX = "workflow-engine-project-error-detector:";

  private final DetectorRepository detectorRepository;
  private final LockManager lockManager;
  private final TransactionTemplate transactionTemplate;
  private final Duration lockTimeout;

  public DefaultDetectorService(DetectorRepository detectorRepository,
                                LockManager lockManager,
                                PlatformTransactionManager transactionManager,
                                @Value("${migration.detector-lock.timeout-ms:3000}") long lockTimeoutMs) {
    this.detectorRepository = detectorRepository;
    this.lockManager = lockManager;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.lockTimeout = Duration.ofMillis(lockTimeoutMs);
  }

  /** Oldest error detector of the project, if any. */
  public Optional<DetectorDto> findDefaultErrorDetector(Long projectId) {
    return detectorRepository
        .findFirstByProjectIdAndTypeOrderByIdAsc(projectId, DetectorDto.ERROR_TYPE)
        .map(this::toDto);
  }

  /**
   * Returns the project's error detector, creating it if needed.
   *
   * @throws UnableToAcquireLockException if another caller holds the creation lock for longer
   *     than the configured timeout
   */
  public DetectorDto ensureDefaultErrorDetector(Long projectId) {
    Optional<DetectorDto> existing = findDefaultErrorDetector(projectId);
    if (existing.isPresent()) {
      return existing.get();
    }

    try (MigrationLock lock = lockManager.tryAcquire(LOCK_KEY_PREFIX + projectId, lockTimeout)) {
      return transactionTemplate.execute(status -> findDefaultErrorDetector(projectId)
          .orElseGet(() -> create(projectId)));
    }
  }

  private DetectorDto create(Long projectId) {
    DetectorEntity entity = new DetectorEntity();
    entity.setProjectId(projectId);
    entity.setType(DetectorDto.ERROR_TYPE);
    entity.setName(DetectorDto.ERROR_DETECTOR_NAME);
    entity.setConfigJson("{}");
    entity.setDateAdded(Instant.now());
    DetectorEntity saved = detectorRepository.save(entity);
    log.info("Created default error detector {} for project {}", saved.getId(), projectId);
    return toDto(saved);
  }

  private DetectorDto toDto(DetectorEntity entity) {
    return new DetectorDto(entity.getId(), entity.getProjectId(), entity.getType(),
        entity.getName());
  }
}
