package org.smileyface.crawlcore.controller;

import org.smileyface.crawlcore.checkpoint.RunContext;
import org.smileyface.crawlcore.model.FrontierEntry;
import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.WorkItem;
import org.smileyface.crawlcore.pipeline.PipelineRunner;
import org.smileyface.crawlcore.service.RunDetail;
import org.smileyface.crawlcore.service.StatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/runs")
class RunController {

    private final StatusService status;
    private final PipelineRunner runner;

    RunController(StatusService status, PipelineRunner runner) {
        this.status = status;
        this.runner = runner;
    }

    @GetMapping
    public List<Run> runs(@RequestParam(name = "fleet", required = false) String fleet,
                          @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return status.runs(fleet, limit);
    }

    @GetMapping("/{runId}")
    public RunDetail run(@PathVariable("runId") String runId) {
        return status.run(runId);
    }

    @GetMapping("/{runId}/dead-items")
    public List<WorkItem> deadItems(@PathVariable("runId") String runId,
                                    @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return status.deadItems(runId, limit);
    }

    @GetMapping("/{runId}/failed-entries")
    public List<FrontierEntry> failedEntries(@PathVariable("runId") String runId,
                                             @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return status.failedEntries(runId, limit);
    }

    /**
     * Starts a fresh run, or resumes the fleet's best resumable run, and drives it in the background.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> start(@RequestParam("fleet") String fleet,
                                                     @RequestParam(name = "fresh", defaultValue = "false") boolean fresh) {
        RunContext ctx = runner.start(fleet, fresh);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", ctx.getRunId());
        body.put("fleet", ctx.getFleetName());
        body.put("resumed", ctx.isResumed());
        body.put("startStep", ctx.getStartStep());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @PostMapping("/{runId}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable("runId") String runId) {
        // 404 for unknown runs
        status.run(runId);
        boolean requested = runner.stop(runId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        body.put("stopRequested", requested);
        return ResponseEntity.status(requested ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT).body(body);
    }

    @PostMapping("/{runId}/dead-items/requeue")
    public Map<String, Object> requeueDead(@PathVariable("runId") String runId) {
        return Map.of("runId", runId, "requeued", status.requeueDead(runId));
    }

    @PostMapping("/{runId}/failed-entries/requeue")
    public Map<String, Object> requeueFailedEntries(@PathVariable("runId") String runId) {
        return Map.of("runId", runId, "requeued", status.requeueFailedEntries(runId));
    }
}
