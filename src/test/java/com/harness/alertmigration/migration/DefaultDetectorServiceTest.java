package com.harness.alertmigration.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.harness.alertmigration.exception.UnableToAcquireLockException;
import com.harness.alertmigration.migration.lock.LockManager;
import com.harness.alertmigration.migration.lock.MigrationLock;
import com.harness.alertmigration.model.DetectorDto;
import com.harness.alertmigration.repository.DetectorEntity;
import com.harness.alertmigration.repository.DetectorRepository;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.transaction.PlatformTransactionManager;

class DefaultDetectorServiceTest {

  private DetectorRepository detectorRepository;
  private LockManager lockManager;
  private DefaultDetectorService service;

  @BeforeEach
  void setUp() {
    detectorRepository = Mockito.mock(DetectorRepository.class);
    lockManager = Mockito.mock(LockManager.class);
    PlatformTransactionManager transactionManager = Mockito.mock(PlatformTransactionManager.class);
    service = new DefaultDetectorService(detectorRepository, lockManager, transactionManager, 250);
  }

  @Test
  void existingDetectorIsReturnedWithoutLocking() {
    given(detectorRepository.findFirstByProjectIdAndTypeOrderByIdAsc(7L, DetectorDto.ERROR_TYPE))
        .willReturn(Optional.of(detector(11L, 7L)));

    DetectorDto detector = service.ensureDefaultErrorDetector(7L);

    assertThat(detector.id()).isEqualTo(11L);
    verify(lockManager, never()).tryAcquire(anyString(), any());
    verify(detectorRepository, never()).save(any());
  }

  @Test
  void missingDetectorIsCreatedUnderProjectLock() {
    MigrationLock lock = Mockito.mock(MigrationLock.class);
    given(lockManager.tryAcquire(DefaultDetectorService.LOCK_KEY_PREFIX + 8, Duration.ofMillis(250)))
        .willReturn(lock);
    given(detectorRepository.findFirstByProjectIdAndTypeOrderByIdAsc(8L, DetectorDto.ERROR_TYPE))
        .willReturn(Optional.empty());
    given(detectorRepository.save(any(DetectorEntity.class))).willAnswer(invocation -> {
      DetectorEntity entity = invocation.getArgument(0);
      entity.setId(21L);
      return entity;
    });

    DetectorDto detector = service.ensureDefaultErrorDetector(8L);

    assertThat(detector.id()).isEqualTo(21L);
    assertThat(detector.type()).isEqualTo(DetectorDto.ERROR_TYPE);
    assertThat(detector.name()).isEqualTo(DetectorDto.ERROR_DETECTOR_NAME);
    verify(lock).close();
  }

  @Test
  void detectorCreatedByAnotherWorkerWhileWaitingIsReused() {
    MigrationLock lock = Mockito.mock(MigrationLock.class);
    given(lockManager.tryAcquire(eq(DefaultDetectorService.LOCK_KEY_PREFIX + 9), any()))
        .willReturn(lock);
    given(detectorRepository.findFirstByProjectIdAndTypeOrderByIdAsc(9L, DetectorDto.ERROR_TYPE))
        .willReturn(Optional.empty())
        .willReturn(Optional.of(detector(31L, 9L)));

    DetectorDto detector = service.ensureDefaultErrorDetector(9L);

    assertThat(detector.id()).isEqualTo(31L);
    verify(detectorRepository, never()).save(any());
    verify(lock).close();
  }

  @Test
  void lockTimeoutIsPropagated() {
    given(detectorRepository.findFirstByProjectIdAndTypeOrderByIdAsc(10L, DetectorDto.ERROR_TYPE))
        .willReturn(Optional.empty());
    given(lockManager.tryAcquire(eq(DefaultDetectorService.LOCK_KEY_PREFIX + 10), any()))
        .willThrow(new UnableToAcquireLockException(
            DefaultDetectorService.LOCK_KEY_PREFIX + 10, Duration.ofMillis(250)));

    assertThatThrownBy(() -> service.ensureDefaultErrorDetector(10L))
        .isInstanceOf(UnableToAcquireLockException.class);
    verify(detectorRepository, never()).save(any());
  }

  private DetectorEntity detector(Long id, Long projectId) {
    DetectorEntity entity = new DetectorEntity();
    entity.setId(id);
    entity.setProjectId(projectId);
    entity.setType(DetectorDto.ERROR_TYPE);
    entity.setName(DetectorDto.ERROR_DETECTOR_NAME);
    return entity;
  }
}
