package com.harness.alertmigration.service;

import com.harness.alertmigration.enums.MigrationMode;
import com.harness.alertmigration.enums.MigrationStatus;
import com.harness.alertmigration.exception.AlreadyMigratedException;
import com.harness.alertmigration.exception.MigrationException;
import com.harness.alertmigration.exception.RuleNotFoundException;
import com.harness.alertmigration.migration.RuleMigrationEngine;
import com.harness.alertmigration.model.LegacyRule;
import com.harness.alertmigration.model.MigrationOutcome;
import com.harness.alertmigration.model.MigrationReport;
import com.harness.alertmigration.model.WorkflowDto;
import com.harness.alertmigration.repository.AlertRuleWorkflowRepository;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs rule migrations and turns their failures into report entries. Lock contention is reported
 * as retryable, every other failure as permanent.
 */
@Service
public class MigrationService {

  private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

  private final RuleService ruleService;
  private final RuleMigrationEngine engine;
  private final AlertRuleWorkflowRepository alertRuleWorkflowRepository;
  private final ExecutorService workers;

  public MigrationService(RuleService ruleService,
                          RuleMigrationEngine engine,
                          AlertRuleWorkflowRepository alertRuleWorkflowRepository,
                          @Value("${migration.worker-count:4}") int workerCount) {
    this.ruleService = ruleService;
    this.engine = engine;
    this.alertRuleWorkflowRepository = alertRuleWorkflowRepository;
    AtomicInteger threadIndex = new AtomicInteger();
    this.workers = Executors.newFixedThreadPool(workerCount, runnable -> {
      Thread thread = new Thread(runnable, "migration-worker-" + threadIndex.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    });
  }

  public MigrationOutcome migrateRule(Long ruleId, MigrationMode mode, boolean createActions) {
    try {
      LegacyRule rule = ruleService.getRule(ruleId)
          .orElseThrow(() -> new RuleNotFoundException(ruleId));
      // committing twice would only fail on the marker's unique key, after all the work
      if (mode == MigrationMode.COMMIT && alertRuleWorkflowRepository.existsByRuleId(ruleId)) {
        throw new AlreadyMigratedException(ruleId);
      }
      WorkflowDto workflow = engine.migrate(rule, mode, createActions);
      MigrationStatus status =
          mode == MigrationMode.COMMIT ? MigrationStatus.MIGRATED : MigrationStatus.VALIDATED;
      return MigrationOutcome.succeeded(ruleId, status, workflow);
    } catch (MigrationException e) {
      if (e.isRetryable()) {
        log.warn("Migration of rule {} can be retried: {}", ruleId, e.getMessage());
        return MigrationOutcome.failed(ruleId, MigrationStatus.RETRYABLE_FAILURE, e.code(),
            e.getMessage());
      }
      log.warn("Migration of rule {} failed: [{}] {}", ruleId, e.code(), e.getMessage());
      return MigrationOutcome.failed(ruleId, MigrationStatus.PERMANENT_FAILURE, e.code(),
          e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error migrating rule {}", ruleId, e);
      return MigrationOutcome.failed(ruleId, MigrationStatus.PERMANENT_FAILURE, "unexpected_error",
          e.getMessage());
    }
  }

  /** Migrates the given rules concurrently on the worker pool. Outcomes keep the input order. */
  public MigrationReport migrateRules(List<Long> ruleIds, MigrationMode mode,
                                      boolean createActions) {
    List<Future<MigrationOutcome>> futures = new ArrayList<>(ruleIds.size());
    for (Long ruleId : ruleIds) {
      futures.add(workers.submit(() -> migrateRule(ruleId, mode, createActions)));
    }

    List<MigrationOutcome> outcomes = new ArrayList<>(ruleIds.size());
    for (int i = 0; i < futures.size(); i++) {
      Long ruleId = ruleIds.get(i);
      try {
        outcomes.add(futures.get(i).get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        outcomes.add(MigrationOutcome.failed(ruleId, MigrationStatus.RETRYABLE_FAILURE,
            "interrupted", "Interrupted while waiting for migration"));
      } catch (ExecutionException e) {
        log.error("Migration worker failed for rule {}", ruleId, e.getCause());
        outcomes.add(MigrationOutcome.failed(ruleId, MigrationStatus.PERMANENT_FAILURE,
            "unexpected_error", String.valueOf(e.getCause())));
      }
    }

    MigrationReport report = new MigrationReport(mode, outcomes);
    log.info("Migration run finished: mode={}, rules={}, migrated={}, validated={}, retryable={}, failed={}",
        mode,
        ruleIds.size(),
        report.count(MigrationStatus.MIGRATED),
        report.count(MigrationStatus.VALIDATED),
        report.count(MigrationStatus.RETRYABLE_FAILURE),
        report.count(MigrationStatus.PERMANENT_FAILURE));
    return report;
  }

  public MigrationReport migrateProject(Long projectId, MigrationMode mode, boolean createActions) {
    List<Long> ruleIds = ruleService.listRulesForProject(projectId).stream()
        .map(LegacyRule::id)
        .toList();
    return migrateRules(ruleIds, mode, createActions);
  }

  @PreDestroy
  public void shutdown() {
    workers.shutdownNow();
  }
}
