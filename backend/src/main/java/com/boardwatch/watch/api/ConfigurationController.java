package com.boardwatch.watch.api;

import com.boardwatch.watch.model.ConfigurationView;
import com.boardwatch.watch.model.ExecutionRecord;
import com.boardwatch.watch.service.WatchStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ConfigurationController {
    private final WatchStatusService statusService;

    public ConfigurationController(WatchStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/configurations")
    public List<ConfigurationView> configurations() {
        return statusService.listConfigurations();
    }

    @GetMapping("/configurations/{id}")
    public ConfigurationView configuration(@PathVariable("id") String id) {
        return statusService.getConfiguration(id);
    }

    @GetMapping("/executions/{configId}")
    public List<ExecutionRecord> executions(
        @PathVariable("configId") String configId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return statusService.getExecutionHistory(configId, limit);
    }
}
