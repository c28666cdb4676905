package com.agenteval.service;

import com.agenteval.config.EvaluatorRuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes {@code <resultsDir>/<evaluationId>/comparison_report.md}.
 */
@Component
public class MarkdownReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportSink.class);

    static final String REPORT_FILE_NAME = "comparison_report.md";

    private final Path resultsRoot;

    @Autowired
    public MarkdownReportSink(EvaluatorRuntimeProperties runtimeProperties) {
        this(Paths.get(runtimeProperties.getWorkspace().getResultsDir()));
    }

    MarkdownReportSink(Path resultsRoot) {
        this.resultsRoot = resultsRoot.toAbsolutePath().normalize();
    }

    @Override
    public void publish(String evaluationId, List<RankedResult> rankedResults) {
        Path reportFile = resultsRoot.resolve(evaluationId).resolve(REPORT_FILE_NAME).normalize();
        if (!reportFile.startsWith(resultsRoot)) {
            throw new IllegalArgumentException("Invalid evaluation id for report path: " + evaluationId);
        }
        try {
            Files.createDirectories(reportFile.getParent());
            Files.writeString(reportFile, render(evaluationId, rankedResults), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write comparison report " + reportFile, ex);
        }
        log.info("Wrote comparison report for evaluation {} to {}", evaluationId, reportFile);
    }

    static String render(String evaluationId, List<RankedResult> rankedResults) {
        StringBuilder report = new StringBuilder();
        report.append("# Evaluation Comparison Report\n\n");
        report.append("- **Evaluation:** ").append(evaluationId).append('\n');
        report.append("- **Generated:** ")
                .append(OffsetDateTime.now().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME))
                .append('\n');
        report.append("- **Agents:** ").append(rankedResults.size()).append("\n\n");

        report.append("## Rankings\n\n");
        report.append("| Rank | Agent | Score |\n");
        report.append("|------|-------|-------|\n");
        for (RankedResult result : rankedResults) {
            report.append("| ")
                    .append(result.medal().isEmpty() ? "" : result.medal() + " ")
                    .append(result.rank())
                    .append(" | ")
                    .append(result.agentName())
                    .append(" | ")
                    .append(result.score())
                    .append("/100 |\n");
        }

        report.append("\n## Feedback\n");
        for (RankedResult result : rankedResults) {
            report.append("\n### ").append(result.rank()).append(". ").append(result.agentName()).append('\n');
            report.append(StringUtils.hasText(result.feedback()) ? result.feedback() : "No feedback recorded.")
                    .append('\n');
        }
        return report.toString();
    }
}
