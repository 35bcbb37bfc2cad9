package catalogwatch.controllers;

import catalogwatch.config.ReportSettings;
import catalogwatch.dto.change.ReportFormat;
import catalogwatch.dto.response.TriggerResponse;
import catalogwatch.services.ChangeDetectionService;
import catalogwatch.services.ChangeReportService;
import catalogwatch.services.CrawlService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CrawlController {
    private final CrawlService crawlService;
    private final ChangeDetectionService changeDetectionService;
    private final ChangeReportService changeReportService;
    private final ReportSettings reportSettings;
    private final AtomicBoolean runActive = new AtomicBoolean(false);
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @PostMapping("/crawl")
    public ResponseEntity<TriggerResponse> crawl(@RequestParam(defaultValue = "true") boolean resume) {
        return trigger("Crawl", () -> crawlService.runCrawl(resume));
    }

    @PostMapping("/changes/detect")
    public ResponseEntity<TriggerResponse> detect() {
        return trigger("Change detection", changeDetectionService::runChangeDetectionCycle);
    }

    @GetMapping("/changes/report")
    public ResponseEntity<String> report(@RequestParam(defaultValue = "json") String format,
                                         @RequestParam(required = false) Integer limit) {
        ReportFormat reportFormat;
        try {
            reportFormat = ReportFormat.fromName(format);
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(ex.getMessage());
        }
        int size = limit == null || limit <= 0 ? reportSettings.getLimit() : limit;
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(reportFormat.getContentType()))
                .body(changeReportService.render(reportFormat, size));
    }

    private ResponseEntity<TriggerResponse> trigger(String name, Runnable run) {
        if (!runActive.compareAndSet(false, true)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(TriggerResponse.rejected("A crawl or change detection run is already active"));
        }
        log.info("{} requested", name);
        executor.submit(() -> {
            try {
                run.run();
            } catch (RuntimeException ex) {
                log.error("{} failed", name, ex);
            } finally {
                runActive.set(false);
            }
        });
        return ResponseEntity.accepted().body(TriggerResponse.started(name + " started"));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
