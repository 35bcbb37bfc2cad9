package catalogwatch.services.impl;

import catalogwatch.config.ReportSettings;
import catalogwatch.dto.change.ChangeEntry;
import catalogwatch.dto.change.ChangeReport;
import catalogwatch.dto.change.ReportFormat;
import catalogwatch.services.CatalogStore;
import catalogwatch.services.ChangeReportService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeReportServiceImpl implements ChangeReportService {
    static final String[] CSV_HEADER = {"Change Type", "Book URL", "Old Value", "New Value", "Changed At"};
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter CSV_TIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final CatalogStore catalogStore;
    private final ReportSettings reportSettings;

    @Override
    public ChangeReport buildReport(int limit) {
        List<ChangeEntry> changes = catalogStore.listRecentChanges(limit).stream()
                .map(ChangeEntry::of)
                .toList();
        return new ChangeReport(LocalDateTime.now(), changes.size(), changes);
    }

    @Override
    public String renderJson(int limit) {
        try {
            return MAPPER.writeValueAsString(buildReport(limit));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise change report", e);
        }
    }

    @Override
    public String renderCsv(int limit) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_HEADER);
            for (ChangeEntry change : buildReport(limit).changes()) {
                writer.writeNext(new String[]{
                        change.changeType().getCode(),
                        change.bookUrl(),
                        nullToEmpty(change.oldValue()),
                        nullToEmpty(change.newValue()),
                        change.changedAt() == null ? "" : CSV_TIME.format(change.changedAt())
                });
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    @Override
    public String render(ReportFormat format, int limit) {
        return format == ReportFormat.CSV ? renderCsv(limit) : renderJson(limit);
    }

    @Override
    public Path saveReport(ReportFormat format) throws IOException {
        Path directory = Path.of(reportSettings.getDirectory());
        Files.createDirectories(directory);
        String fileName = "change_report_" + FILE_STAMP.format(LocalDateTime.now()) + "." + format.getExtension();
        Path file = directory.resolve(fileName);
        Files.writeString(file, render(format, reportSettings.getLimit()), StandardCharsets.UTF_8);
        log.info("Change report saved to {}", file.toAbsolutePath());
        return file;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
