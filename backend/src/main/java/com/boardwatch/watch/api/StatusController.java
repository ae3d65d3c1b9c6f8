package com.boardwatch.watch.api;

import com.boardwatch.watch.model.StatusResponse;
import com.boardwatch.watch.service.WatchStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class StatusController {
    private final WatchStatusService statusService;

    public StatusController(WatchStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }
}
