package org.smileyface.crawlcore.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Kills processes through {@link ProcessHandle}. It cannot spawn anything: fleets that render
 * pages provide their own {@link ProcessManager}.
 */
public class OsProcessManager implements ProcessManager {

    private static final Logger log = LoggerFactory.getLogger(OsProcessManager.class);

    @Override
    public long spawn(String runId, int stepNumber) {
        throw new UnsupportedOperationException("No browser launcher configured for run " + runId);
    }

    @Override
    public boolean kill(long processId) {
        Optional<ProcessHandle> handle = ProcessHandle.of(processId);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            log.debug("Process {} already gone", processId);
            return false;
        }
        ProcessHandle ph = handle.get();
        ph.descendants().forEach(ProcessHandle::destroyForcibly);
        boolean signalled = ph.destroyForcibly();
        log.info("Killed process {} (signalled={})", processId, signalled);
        return signalled;
    }
}
