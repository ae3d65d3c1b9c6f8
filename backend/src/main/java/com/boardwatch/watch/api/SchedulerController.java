package com.boardwatch.watch.api;

import com.boardwatch.watch.model.SchedulerRunResponse;
import com.boardwatch.watch.service.WatchJobRunner;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final WatchJobRunner jobRunner;

    public SchedulerController(WatchJobRunner jobRunner) {
        this.jobRunner = jobRunner;
    }

    // Always 200; failure is reported through the success flag.
    @RequestMapping(path = "/run", method = {RequestMethod.GET, RequestMethod.POST})
    public SchedulerRunResponse run() {
        return jobRunner.run();
    }
}
