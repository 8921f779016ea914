package org.smileyface.crawlcore.checkpoint;

import org.smileyface.crawlcore.model.StepDefinition;

import java.util.List;
import java.util.Objects;

/**
 * Explicit handle for one active run, passed down the call chain instead of process-wide state.
 */
public final class RunContext {

    private final String runId;
    private final String fleetName;
    private final List<StepDefinition> steps;
    private final boolean resumed;
    private final int startStep;

    public RunContext(String runId, String fleetName, List<StepDefinition> steps, boolean resumed, int startStep) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.fleetName = Objects.requireNonNull(fleetName, "fleetName");
        this.steps = List.copyOf(steps);
        this.resumed = resumed;
        this.startStep = startStep;
    }

    public String getRunId() { return runId; }
    public String getFleetName() { return fleetName; }
    public List<StepDefinition> getSteps() { return steps; }
    public boolean isResumed() { return resumed; }

    /** First step this driver has to execute; equals the step count when nothing is left. */
    public int getStartStep() { return startStep; }

    public StepDefinition step(int number) {
        if (number < 0 || number >= steps.size()) {
            throw new IllegalArgumentException("Run " + runId + " has no step " + number);
        }
        return steps.get(number);
    }

    @Override
    public String toString() {
        return "RunContext{" +
                "runId='" + runId + '\'' +
                ", fleetName='" + fleetName + '\'' +
                ", steps=" + steps.size() +
                ", resumed=" + resumed +
                ", startStep=" + startStep +
                '}';
    }
}
