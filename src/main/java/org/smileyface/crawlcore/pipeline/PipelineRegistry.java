package org.smileyface.crawlcore.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fleets known to this process, collected from the {@link FleetPipeline} beans.
 */
@Component
public class PipelineRegistry {

    private static final Logger log = LoggerFactory.getLogger(PipelineRegistry.class);

    private final Map<String, FleetPipeline> pipelines = new ConcurrentHashMap<>();

    public PipelineRegistry(ObjectProvider<FleetPipeline> beans) {
        beans.orderedStream().forEach(this::register);
    }

    public void register(FleetPipeline pipeline) {
        FleetPipeline previous = pipelines.put(pipeline.fleetName(), pipeline);
        if (previous != null) {
            log.warn("Fleet {} registered twice; the last definition wins", pipeline.fleetName());
        } else {
            log.info("Fleet {} registered with {} steps", pipeline.fleetName(), pipeline.steps().size());
        }
    }

    public Optional<FleetPipeline> find(String fleetName) {
        return fleetName == null ? Optional.empty() : Optional.ofNullable(pipelines.get(fleetName));
    }

    /**
     * @throws IllegalArgumentException for an unknown fleet
     */
    public FleetPipeline require(String fleetName) {
        return find(fleetName).orElseThrow(() -> new IllegalArgumentException("Unknown fleet: " + fleetName));
    }

    public List<String> fleetNames() {
        List<String> names = new ArrayList<>(pipelines.keySet());
        names.sort(null);
        return names;
    }
}
