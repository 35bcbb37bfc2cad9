package catalogwatch.scheduling;

import catalogwatch.config.SchedulerSettings;
import catalogwatch.dto.change.DetectionSummary;
import catalogwatch.dto.change.ReportFormat;
import catalogwatch.services.ChangeDetectionService;
import catalogwatch.services.ChangeReportService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;

/**
 * Runs the change detection cycle on the configured daily schedule and saves reports when
 * something changed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "catalog.scheduler", name = "enabled", havingValue = "true")
public class ChangeDetectionScheduler {
    private final TaskScheduler taskScheduler;
    private final ChangeDetectionService changeDetectionService;
    private final ChangeReportService changeReportService;
    private final SchedulerSettings schedulerSettings;

    @PostConstruct
    public void start() {
        RunSchedule schedule = new DailyRunSchedule(schedulerSettings.getRunTime(), schedulerSettings.getTimezone());
        taskScheduler.schedule(this::runScheduledCycle, context -> {
            Instant last = context.lastCompletion();
            return schedule.nextRunAt(last != null ? last : Instant.now());
        });
        log.info("Change detection scheduled {}, next run at {}", schedule, schedule.nextRunAt(Instant.now()));
    }

    public void runScheduledCycle() {
        log.info("Scheduled change detection started");
        try {
            DetectionSummary summary = changeDetectionService.runChangeDetectionCycle();
            if (summary.hasChanges()) {
                changeReportService.saveReport(ReportFormat.JSON);
                changeReportService.saveReport(ReportFormat.CSV);
            }
        } catch (IOException ex) {
            log.error("Could not save change report", ex);
        } catch (RuntimeException ex) {
            log.error("Scheduled change detection failed", ex);
        }
    }
}
