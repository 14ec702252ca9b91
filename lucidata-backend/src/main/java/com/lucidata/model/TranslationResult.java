package com.lucidata.model;

/**
 * SQL extracted from a model response.
 *
 * @param sqlQuery the statement to run, never blank
 * @param explanation model's explanation, or null when absent
 * @param confidence estimate in [0, 1]
 */
public record TranslationResult(String sqlQuery, String explanation, double confidence) {

    public TranslationResult {
        if (sqlQuery == null || sqlQuery.isBlank()) {
            throw new IllegalArgumentException("SQL query must not be empty");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
    }
}
