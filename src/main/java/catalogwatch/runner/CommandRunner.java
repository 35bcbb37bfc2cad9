package catalogwatch.runner;

import catalogwatch.dto.change.DetectionSummary;
import catalogwatch.dto.change.ReportFormat;
import catalogwatch.dto.crawl.CrawlSummary;
import catalogwatch.services.ChangeDetectionService;
import catalogwatch.services.ChangeReportService;
import catalogwatch.services.CrawlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Command line verbs:
 * <pre>
 * crawl [--fresh]      crawl the catalogue, resuming unless --fresh is given
 * detect               run one change detection cycle
 * report [json|csv]    save a report of the recent changes
 * </pre>
 * Without a verb the application only serves HTTP.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRunner implements CommandLineRunner {
    private final CrawlService crawlService;
    private final ChangeDetectionService changeDetectionService;
    private final ChangeReportService changeReportService;

    @Override
    public void run(String... args) throws IOException {
        List<String> verbs = Arrays.stream(args).filter(arg -> !arg.startsWith("--spring.")).toList();
        if (verbs.isEmpty()) {
            return;
        }
        switch (verbs.get(0)) {
            case "crawl" -> {
                CrawlSummary summary = crawlService.runCrawl(!verbs.contains("--fresh"));
                log.info("Crawl {}: {} categories, {} pages, {} fetched, {} stored, {} duplicates, {} failed in {}",
                        summary.getOutcome(), summary.getCategoriesCrawled(), summary.getPagesCrawled(),
                        summary.getBooksFetched(), summary.getBooksStored(), summary.getDuplicatesSkipped(),
                        summary.getFailed(), summary.getDuration());
            }
            case "detect" -> {
                DetectionSummary summary = changeDetectionService.runChangeDetectionCycle();
                log.info("Detection: {}", summary);
            }
            case "report" -> {
                ReportFormat format = verbs.size() > 1 ? ReportFormat.fromName(verbs.get(1)) : ReportFormat.JSON;
                changeReportService.saveReport(format);
            }
            default -> log.warn("Unknown command '{}', expected crawl, detect or report", verbs.get(0));
        }
    }
}
