package com.harness.alertmigration.repository;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DetectorRepository extends JpaRepository<DetectorEntity, Long> {

  Optional<DetectorEntity> findFirstByProjectIdAndTypeOrderByIdAsc(Long projectId, String type);
}
