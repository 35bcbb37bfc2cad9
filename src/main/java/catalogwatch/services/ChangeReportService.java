package catalogwatch.services;

import catalogwatch.dto.change.ChangeReport;
import catalogwatch.dto.change.ReportFormat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders the most recent changes, newest first.
 */
public interface ChangeReportService {

    ChangeReport buildReport(int limit);

    String renderJson(int limit);

    String renderCsv(int limit);

    String render(ReportFormat format, int limit);

    /**
     * Writes {@code change_report_<timestamp>.<ext>} into the report directory.
     */
    Path saveReport(ReportFormat format) throws IOException;
}
