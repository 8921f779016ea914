package org.smileyface.crawlcore.pipeline;

import org.smileyface.crawlcore.model.StepDefinition;

import java.util.List;

/**
 * Supplies the input of each step of a fleet's pipeline. Called every time a step starts,
 * including on resume; seeding is idempotent because the queue and the frontier dedup by key.
 */
@FunctionalInterface
public interface TargetResolver {

    List<Seed> seeds(String runId, StepDefinition step);
}
