package org.smileyface.crawlcore.worker;

import org.smileyface.crawlcore.config.FleetSettings;
import org.smileyface.crawlcore.model.StepDefinition;
import org.smileyface.crawlcore.resource.ProcessManager;

import java.util.Objects;

/**
 * The step a group of workers is drained against.
 *
 * @param egress         endpoint filters, or null to fetch without an egress endpoint
 * @param processManager spawns the rendering process each worker drives, or null when the fleet needs none
 */
public record StepAssignment(String runId,
                             StepDefinition step,
                             FleetSettings settings,
                             Fetcher fetcher,
                             EgressRequirement egress,
                             ProcessManager processManager) {

    public StepAssignment {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(fetcher, "fetcher");
    }

    public int stepNumber() {
        return step.number();
    }
}
