package org.smileyface.crawlcore.maintenance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.checkpoint.CheckpointManager;
import org.smileyface.crawlcore.config.OrchestratorProperties;
import org.smileyface.crawlcore.model.BrowserInstance;
import org.smileyface.crawlcore.resource.ProcessManager;
import org.smileyface.crawlcore.resource.ResourceTracker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Low-frequency sweep bounding the worst-case staleness window: stale runs become resumable and
 * orphaned browser processes are closed and killed.
 */
@Component
@ConditionalOnProperty(prefix = "orchestrator.runs", name = "maintenance-enabled", havingValue = "true", matchIfMissing = true)
public class MaintenanceScheduler {

    private static final Logger log = LogManager.getLogger();

    private final CheckpointManager checkpoints;
    private final ResourceTracker resources;
    private final ProcessManager processManager;
    private final OrchestratorProperties properties;

    public MaintenanceScheduler(CheckpointManager checkpoints, ResourceTracker resources,
                                ProcessManager processManager, OrchestratorProperties properties) {
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.processManager = Objects.requireNonNull(processManager, "processManager");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Scheduled(fixedDelayString = "${orchestrator.runs.maintenance-interval:PT60S}",
            initialDelayString = "${orchestrator.runs.maintenance-interval:PT60S}")
    public void sweep() {
        try {
            recoverStaleRuns();
        } catch (RuntimeException e) {
            log.error("Stale run recovery failed: {}", e.getMessage(), e);
        }
        try {
            sweepOrphans();
        } catch (RuntimeException e) {
            log.error("Orphan sweep failed: {}", e.getMessage(), e);
        }
    }

    public List<String> recoverStaleRuns() {
        List<String> recovered = checkpoints.staleRunRecovery(fleet -> properties.resolve(fleet).staleRunMaxIdle());
        if (!recovered.isEmpty()) {
            log.warn("Recovered {} stale runs: {}", recovered.size(), recovered);
        }
        return recovered;
    }

    public List<BrowserInstance> sweepOrphans() {
        List<BrowserInstance> orphans = resources.sweepOrphans(properties.getResources().getOrphanMaxAge());
        for (BrowserInstance b : orphans) {
            boolean killed = processManager.kill(b.getProcessId());
            log.warn("Orphaned browser instance {} (run={}, step={}, pid={}) closed, process {}",
                    b.getInstanceId(), b.getRunId(), b.getStepNumber(), b.getProcessId(), killed ? "killed" : "already gone");
        }
        return orphans;
    }
}
