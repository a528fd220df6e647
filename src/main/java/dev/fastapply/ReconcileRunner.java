package dev.fastapply;

import dev.fastapply.config.SwipeQueueProperties;
import dev.fastapply.model.Automation;
import dev.fastapply.model.QueueStats;
import dev.fastapply.service.QueueManager;
import dev.fastapply.service.QueueManager.SyncResult;
import dev.fastapply.session.QueueSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Brings local queue state back in line with the worker after a restart:
 * prunes unknown profiles, resubmits unacknowledged URLs and reports queue stats.
 * Separated from the main Application class for testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconcileRunner {

  private static final String SEPARATOR = "========================================";

  private final QueueSession queueSession;
  private final SwipeQueueProperties properties;

  /**
   * Run one reconciliation pass.
   *
   * @return number of URLs resubmitted
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Swipe Queue Reconcile Starting");
    log.info(SEPARATOR);

    QueueManager queueManager = queueSession.getQueueManager();
    try {
      if (!properties.getKnownProfiles().isEmpty()) {
        int removed = queueManager.cleanupInvalidProfiles(properties.getKnownProfiles());
        log.info("Removed {} automations of unknown profiles", removed);
      }

      SyncResult sync = queueManager.syncPendingUrls().block();
      int submitted = sync != null ? sync.submitted() : 0;

      for (Automation automation : queueManager.getCachedAutomations()) {
        reportStats(queueManager, automation);
      }

      log.info(SEPARATOR);
      log.info("Swipe Queue Reconcile Completed");
      log.info("URLs resubmitted: {}, still pending: {}", submitted, queueManager.getPendingUrlsCount());
      log.info(SEPARATOR);

      return submitted;
    } catch (Exception e) {
      log.error("Swipe Queue reconcile failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Reconcile failed", e);
    }
  }

  private void reportStats(QueueManager queueManager, Automation automation) {
    try {
      QueueStats stats = queueManager.getQueueStats(automation.getId()).block();
      if (stats != null) {
        log.info("Automation {} ({}): {} pending, {} processing, {} completed, {} failed",
            automation.getName(), automation.getId(), stats.getPending(), stats.getProcessing(),
            stats.getCompleted(), stats.getFailed());
      }
    } catch (RuntimeException e) {
      log.warn("Could not read queue stats of automation {}: {}", automation.getId(), e.getMessage());
    }
  }
}
