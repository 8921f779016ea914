package org.smileyface.crawlcore.service;

import org.smileyface.crawlcore.model.FrontierProgress;
import org.smileyface.crawlcore.model.QueueDepth;
import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.Step;
import org.smileyface.crawlcore.worker.WorkerStatus;

import java.util.List;

/**
 * Everything known about one run: checkpoints, backlog and the workers this process runs for it.
 */
public record RunDetail(Run run,
                        List<Step> steps,
                        QueueDepth queue,
                        FrontierProgress frontier,
                        boolean driving,
                        List<WorkerStatus> workers) {
}
