package org.smileyface.crawlcore.resource;

import java.io.IOException;

/**
 * Starts and kills browser/rendering processes on behalf of the core.
 */
public interface ProcessManager {

    /**
     * @return the OS process id of the new process
     */
    long spawn(String runId, int stepNumber) throws IOException;

    /**
     * @return true when a live process was found and signalled
     */
    boolean kill(long processId);

    /** Process id recorded as the parent of spawned processes. */
    default Long parentProcessId() {
        return ProcessHandle.current().pid();
    }
}
