package org.smileyface.crawlcore.pipeline;

import org.smileyface.crawlcore.model.StepDefinition;
import org.smileyface.crawlcore.resource.ProcessManager;
import org.smileyface.crawlcore.worker.EgressRequirement;
import org.smileyface.crawlcore.worker.Fetcher;

import java.util.List;
import java.util.Objects;

/**
 * Everything the runner needs to know about one fleet: its ordered steps and the plug-ins that
 * feed and fetch them. Register one as a Spring bean per fleet.
 *
 * @param egress         endpoint filters, or null when the fleet fetches without an egress pool
 * @param processManager browser process control, or null when the fleet needs no browser
 */
public record FleetPipeline(String fleetName,
                            List<StepDefinition> steps,
                            TargetResolver targetResolver,
                            Fetcher fetcher,
                            EgressRequirement egress,
                            ProcessManager processManager) {

    public FleetPipeline {
        if (fleetName == null || fleetName.isBlank()) {
            throw new IllegalArgumentException("fleetName must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("fleet " + fleetName + " needs at least one step");
        }
        steps = List.copyOf(steps);
        Objects.requireNonNull(targetResolver, "targetResolver");
        Objects.requireNonNull(fetcher, "fetcher");
    }

    public FleetPipeline(String fleetName, List<StepDefinition> steps, TargetResolver targetResolver, Fetcher fetcher) {
        this(fleetName, steps, targetResolver, fetcher, null, null);
    }

    public FleetPipeline withEgress(EgressRequirement egress) {
        return new FleetPipeline(fleetName, steps, targetResolver, fetcher, egress, processManager);
    }

    public FleetPipeline withProcessManager(ProcessManager processManager) {
        return new FleetPipeline(fleetName, steps, targetResolver, fetcher, egress, processManager);
    }
}
