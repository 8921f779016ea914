package org.smileyface.crawlcore.controller;

import org.smileyface.crawlcore.model.BrowserInstance;
import org.smileyface.crawlcore.model.ProxyPoolHealth;
import org.smileyface.crawlcore.service.StatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
class PoolController {

    private final StatusService status;

    PoolController(StatusService status) {
        this.status = status;
    }

    @GetMapping("/proxies/health")
    public ProxyPoolHealth proxyHealth() {
        return status.proxyHealth();
    }

    @GetMapping("/resources/active")
    public List<BrowserInstance> activeResources(@RequestParam(name = "run", required = false) String runId) {
        return status.activeResources(runId);
    }
}
