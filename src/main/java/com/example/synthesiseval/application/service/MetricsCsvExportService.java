package com.example.synthesiseval.application.service;

import com.example.synthesiseval.application.exception.MetricsExportValidationException;
import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.model.EvaluationResult;
import com.example.synthesiseval.domain.model.Metrics;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Application-layer service that turns an evaluation result into downloadable CSV content.
 */
@Service
public class MetricsCsvExportService {

    private static final String HEADER = "Field,TP,FP,FN,Precision,Recall,F1\n";

	/**
	 * Renders one row per field, then the overall row and, when step sequences were scored, a sequence row.
	 *
	 * @param result cached evaluation result
	 * @return CSV content ready to stream to the client
	 * @throws MetricsExportValidationException when there is no result to export
	 */
    public String export(EvaluationResult result) {
        if (result == null || result.fields() == null || result.overall() == null) {
            throw new MetricsExportValidationException("No evaluation result available for export.");
        }
        StringBuilder builder = new StringBuilder(HEADER);
        for (Map.Entry<String, Metrics> entry : result.fields().entrySet()) {
            appendRow(builder, entry.getKey(), entry.getValue());
        }
        appendRow(builder, "Overall", result.overall());
        if (!result.sequence().isEmpty()) {
            appendRow(builder, "Sequence", result.sequence().total());
        }
        return builder.toString();
    }

    private void appendRow(StringBuilder builder, String label, Metrics metrics) {
        ConfusionCounts counts = metrics.counts();
        builder.append(escape(label)).append(',')
                .append(counts.truePositives()).append(',')
                .append(counts.falsePositives()).append(',')
                .append(counts.falseNegatives()).append(',')
                .append(rate(metrics.precision())).append(',')
                .append(rate(metrics.recall())).append(',')
                .append(rate(metrics.f1()))
                .append('\n');
    }

    private String rate(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
