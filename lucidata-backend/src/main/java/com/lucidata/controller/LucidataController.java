package com.lucidata.controller;

import com.lucidata.api.ErrorResponse;
import com.lucidata.api.ExecuteQueryRequest;
import com.lucidata.api.ExecuteQueryResponse;
import com.lucidata.api.FormatRequest;
import com.lucidata.api.FormatResponse;
import com.lucidata.api.ProcessQueryRequest;
import com.lucidata.api.ProcessQueryResponse;
import com.lucidata.api.RawQueryResponse;
import com.lucidata.api.StatusResponse;
import com.lucidata.api.TranslateAndExecuteRequest;
import com.lucidata.api.TranslateAndExecuteResponse;
import com.lucidata.model.ExecutionResult;
import com.lucidata.model.Outcome;
import com.lucidata.model.TranslationResult;
import com.lucidata.service.QueryExecutionException;
import com.lucidata.service.QueryExecutionGateway;
import com.lucidata.service.ResultPresenter;
import com.lucidata.service.TranslationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class LucidataController {

    private static final Logger log = LoggerFactory.getLogger(LucidataController.class);

    static final String CARS_QUERY = "SELECT * FROM cars";
    static final String CAR_BY_ID_QUERY = "SELECT * FROM cars WHERE id = :id";

    private final TranslationService translationService;
    private final QueryExecutionGateway queryExecutionGateway;
    private final ResultPresenter resultPresenter;

    public LucidataController(
            TranslationService translationService,
            QueryExecutionGateway queryExecutionGateway,
            ResultPresenter resultPresenter
    ) {
        this.translationService = translationService;
        this.queryExecutionGateway = queryExecutionGateway;
        this.resultPresenter = resultPresenter;
    }

    @GetMapping("/")
    public StatusResponse root() {
        return new StatusResponse("ok", "Lucidata query service is running");
    }

    @GetMapping({"/health", "/api/health"})
    public StatusResponse health() {
        return StatusResponse.ok();
    }

    /**
     * Translate a natural-language question into SQL.
     *
     * POST /process-query
     *
     * @param request question and optional model
     * @return SQL, explanation, confidence and fallback warnings; 500 when the model call fails
     */
    @PostMapping("/process-query")
    public ResponseEntity<?> processQuery(@Valid @RequestBody ProcessQueryRequest request) {
        Outcome<TranslationResult> outcome = translationService.translate(request.getQuery(), request.getModel());
        if (outcome.isFailed()) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "TRANSLATION_FAILED", outcome.getError());
        }
        TranslationResult result = outcome.getValue();
        return ResponseEntity.ok(ProcessQueryResponse.builder()
                .sqlQuery(result.sqlQuery())
                .explanation(result.explanation())
                .confidence(result.confidence())
                .warnings(outcome.getWarnings())
                .build());
    }

    /**
     * Execute a SQL statement with optional named parameters.
     *
     * POST /execute-query
     */
    @PostMapping("/execute-query")
    public ExecuteQueryResponse executeQuery(@Valid @RequestBody ExecuteQueryRequest request)
            throws QueryExecutionException {
        ExecutionResult result = queryExecutionGateway.execute(request.getQuery(), request.getParams());
        return ExecuteQueryResponse.from(result);
    }

    /**
     * Render rows as html, csv or json, with an optional chart.
     *
     * POST /format
     */
    @PostMapping("/format")
    public FormatResponse format(@RequestBody FormatRequest request) {
        ResultPresenter.Presentation presentation = resultPresenter.format(
                request.getData(),
                request.getFormat(),
                request.getVisualizationType(),
                request.getTitle(),
                request.getDescription());
        return FormatResponse.builder()
                .formattedData(presentation.formattedData())
                .visualization(presentation.visualization())
                .contentType(presentation.contentType())
                .build();
    }

    /**
     * Translate a question and run the resulting SQL in one request.
     *
     * POST /translate-and-execute
     *
     * @return rows plus timing; 502 when translation fails
     */
    @PostMapping("/translate-and-execute")
    public ResponseEntity<?> translateAndExecute(@Valid @RequestBody TranslateAndExecuteRequest request)
            throws QueryExecutionException {
        long startTime = System.currentTimeMillis();

        Outcome<TranslationResult> outcome = translationService.translate(request.getNaturalQuery(), request.getModel());
        long llmTime = System.currentTimeMillis() - startTime;
        if (outcome.isFailed()) {
            return error(HttpStatus.BAD_GATEWAY, "TRANSLATION_FAILED", outcome.getError());
        }
        TranslationResult translation = outcome.getValue();

        ExecutionResult result = queryExecutionGateway.execute(translation.sqlQuery(), null);
        long totalTime = System.currentTimeMillis() - startTime;
        log.info("Translate-and-execute completed: rows={}, llm_ms={}, total_ms={}",
                result.rowCount(), llmTime, totalTime);

        return ResponseEntity.ok(TranslateAndExecuteResponse.builder()
                .naturalQuery(request.getNaturalQuery())
                .sqlQuery(translation.sqlQuery())
                .results(result.rows())
                .explanation(translation.explanation())
                .warnings(outcome.getWarnings())
                .metadata(TranslateAndExecuteResponse.Metadata.builder()
                        .confidence(translation.confidence())
                        .executionTimeMs(result.durationMs())
                        .llmProcessingTimeMs(llmTime)
                        .totalTimeMs(totalTime)
                        .build())
                .build());
    }

    @GetMapping("/api/cars")
    public List<Map<String, Object>> listCars() throws QueryExecutionException {
        return queryExecutionGateway.execute(CARS_QUERY, null).rows();
    }

    /**
     * Run a SQL statement and echo it back with the rows.
     *
     * POST /api/query
     */
    @PostMapping("/api/query")
    public RawQueryResponse rawQuery(@Valid @RequestBody ExecuteQueryRequest request) throws QueryExecutionException {
        ExecutionResult result = queryExecutionGateway.execute(request.getQuery(), request.getParams());
        return RawQueryResponse.builder()
                .result(result.rows())
                .executedQuery(request.getQuery())
                .build();
    }

    @GetMapping("/api/cars/{id}")
    public ResponseEntity<?> getCar(@PathVariable("id") int id) throws QueryExecutionException {
        ExecutionResult result = queryExecutionGateway.execute(CAR_BY_ID_QUERY, Map.of("id", id));
        if (result.rows().isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "NOT_FOUND", "Car with id " + id + " not found");
        }
        return ResponseEntity.ok(result.rows().get(0));
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(code)
                .message(message)
                .traceId(MDC.get("trace_id"))
                .build());
    }
}
