package com.example.synthesiseval.interfaces.api;

import com.example.synthesiseval.application.service.EvaluationService;
import com.example.synthesiseval.application.service.FieldRegistryCatalog;
import com.example.synthesiseval.application.service.MetricsCsvExportService;
import com.example.synthesiseval.config.EvaluationProperties;
import com.example.synthesiseval.domain.model.EvaluationRequest;
import com.example.synthesiseval.domain.model.EvaluationResult;
import com.example.synthesiseval.domain.model.FieldRegistry;
import com.example.synthesiseval.interfaces.api.dto.EvaluationRequestPayload;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Interfaces-layer controller that runs evaluations over HTTP and exports the latest result as CSV.
 */
@Controller
public class EvaluationController {

    private static final String SESSION_RESULT_KEY = "LATEST_EVALUATION_RESULT";

    private final EvaluationService evaluationService;
    private final FieldRegistryCatalog registryCatalog;
    private final MetricsCsvExportService csvExportService;
    private final EvaluationProperties properties;

    /**
     * Creates the controller with the required application services.
     *
     * @param evaluationService service running the scoring engine
     * @param registryCatalog   lookup of bundled field registries
     * @param csvExportService  service responsible for CSV generation
     * @param properties        evaluation configuration
     */
    public EvaluationController(EvaluationService evaluationService,
                                FieldRegistryCatalog registryCatalog,
                                MetricsCsvExportService csvExportService,
                                EvaluationProperties properties) {
        this.evaluationService = evaluationService;
        this.registryCatalog = registryCatalog;
        this.csvExportService = csvExportService;
        this.properties = properties;
    }

    /**
     * Scores the posted collections and caches the result in the session for a later export.
     *
     * @param payload records, registry selection and flags
     * @param session HTTP session used to cache the result
     * @return evaluation result as JSON
     */
    @PostMapping(value = "/api/evaluations",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<EvaluationResult> evaluate(@RequestBody EvaluationRequestPayload payload, HttpSession session) {
        FieldRegistry registry = registryCatalog.resolve(payload.registry(), payload.fields());
        boolean debug = payload.debug() != null ? payload.debug() : properties.debugByDefault();

        EvaluationRequest request = new EvaluationRequest(
                payload.predicted(),
                payload.gold(),
                registry,
                payload.predictedSteps(),
                payload.goldSteps(),
                debug
        );
        EvaluationResult result = evaluationService.evaluate(request);
        session.setAttribute(SESSION_RESULT_KEY, result);
        return ResponseEntity.ok(result);
    }

    /**
     * @return names of the bundled field registries
     */
    @GetMapping(value = "/api/registries", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public Set<String> registries() {
        return registryCatalog.names();
    }

    /**
     * Streams the cached result's metrics as a CSV download.
     *
     * @param session HTTP session storing the cached evaluation result
     * @return CSV document as a {@link ResponseEntity}
     */
    @PostMapping("/export")
    public ResponseEntity<byte[]> exportCsv(HttpSession session) {
        EvaluationResult cached = (EvaluationResult) session.getAttribute(SESSION_RESULT_KEY);
        String csv = csvExportService.export(cached);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"evaluation-metrics.csv\"")
                .contentType(MediaType.TEXT_PLAIN)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
