package com.lucidata.service;

import com.lucidata.model.Outcome;
import com.lucidata.model.TranslationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts SQL, explanation and confidence from a free-text model response.
 *
 * <p>Fields are located by literal markers and are expected in the order
 * {@code SQL:}, {@code EXPLANATION:}, {@code CONFIDENCE:}. Each marker is searched from the start of the
 * text (first occurrence wins):
 * <ul>
 *     <li>SQL runs from {@code SQL:} to the next {@code EXPLANATION:}, or to the end of text;</li>
 *     <li>the explanation runs from {@code EXPLANATION:} to the next {@code CONFIDENCE:}, or to the end;</li>
 *     <li>the confidence runs from {@code CONFIDENCE:} to the end of text.</li>
 * </ul>
 * A response with reordered fields is sliced literally, not repaired. For example
 * {@code "CONFIDENCE: 0.9\nSQL: SELECT 1\nEXPLANATION: x"} yields SQL {@code SELECT 1}, explanation
 * {@code x} and confidence 0.5, because the confidence slice also contains the later fields.
 *
 * <p>The explanation is null only when its marker is absent; a marker followed by nothing gives an
 * empty explanation.
 *
 * <p>Parsing never fails. Missing SQL is replaced with {@link #FALLBACK_SQL}; a missing confidence is
 * 0.0 and an unreadable one is 0.5.
 */
@Slf4j
@Component
public class ResponseParser {

    public static final String SQL_MARKER = "SQL:";
    public static final String EXPLANATION_MARKER = "EXPLANATION:";
    public static final String CONFIDENCE_MARKER = "CONFIDENCE:";

    public static final String FALLBACK_SQL = "SELECT * FROM " + SchemaDescriptorProvider.FALLBACK_TABLE + " LIMIT 10;";

    static final double CONFIDENCE_ABSENT = 0.0;
    static final double CONFIDENCE_UNPARSEABLE = 0.5;

    /**
     * Parse a raw model response.
     *
     * @param raw response text, may be null
     * @return SUCCEEDED, or FALLBACK_APPLIED when the SQL or confidence had to be defaulted
     */
    public Outcome<TranslationResult> parse(String raw) {
        String text = raw != null ? raw : "";
        List<String> warnings = new ArrayList<>();

        String sql = sliceBetween(text, SQL_MARKER, EXPLANATION_MARKER);
        String explanation = sliceBetween(text, EXPLANATION_MARKER, CONFIDENCE_MARKER);

        double confidence = CONFIDENCE_ABSENT;
        String confidenceText = sliceBetween(text, CONFIDENCE_MARKER, null);
        if (confidenceText != null) {
            confidence = parseConfidence(confidenceText, warnings);
        }

        if (sql == null || sql.isEmpty()) {
            log.warn("Could not extract SQL from model response, using fallback query");
            warnings.add("No SQL statement found in model response; using fallback query");
            sql = FALLBACK_SQL;
        }

        TranslationResult result = new TranslationResult(sql, explanation, confidence);
        return warnings.isEmpty() ? Outcome.success(result) : Outcome.fallback(result, warnings);
    }

    /**
     * Text after the first {@code startMarker}, cut at the first {@code endMarker} that follows it.
     *
     * @return trimmed slice, or null when {@code startMarker} does not occur
     */
    private static String sliceBetween(String text, String startMarker, String endMarker) {
        int start = text.indexOf(startMarker);
        if (start < 0) {
            return null;
        }
        String remainder = text.substring(start + startMarker.length());
        if (endMarker != null) {
            int end = remainder.indexOf(endMarker);
            if (end >= 0) {
                remainder = remainder.substring(0, end);
            }
        }
        return remainder.strip();
    }

    private static double parseConfidence(String value, List<String> warnings) {
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            warnings.add("Confidence value is not a number; defaulting to " + CONFIDENCE_UNPARSEABLE);
            return CONFIDENCE_UNPARSEABLE;
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            warnings.add("Confidence value is not a finite number; defaulting to " + CONFIDENCE_UNPARSEABLE);
            return CONFIDENCE_UNPARSEABLE;
        }
        // out-of-range values are clamped rather than rejected
        return Math.max(0.0, Math.min(1.0, parsed));
    }
}
