package com.programmersdiary.moltby.web;

import com.programmersdiary.moltby.cron.CronJob;
import com.programmersdiary.moltby.cron.CronJobScheduler;
import com.programmersdiary.moltby.cron.JobNotFoundException;
import com.programmersdiary.moltby.cron.JobValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/cron/jobs")
public class CronJobController {

    private final CronJobScheduler scheduler;

    public CronJobController(CronJobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<CronJob> list() {
        return scheduler.listJobs();
    }

    @GetMapping("/{id}")
    public CronJob get(@PathVariable String id) {
        try {
            return scheduler.getJob(id);
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CronJob create(@RequestBody CreateCronJobRequest request) {
        try {
            return scheduler.createJob(request.toDefinition());
        } catch (JobValidationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        try {
            scheduler.deleteJob(id);
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/{id}/toggle")
    public CronJob toggle(@PathVariable String id) {
        try {
            return scheduler.toggleJob(id);
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}
