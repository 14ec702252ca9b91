package com.lucidata.model;

/**
 * One natural-language question to translate, scoped to a single request.
 *
 * @param question the user's question, non-blank
 * @param modelName model override, or null for the configured default
 * @param schema schema context the translation is grounded on
 */
public record TranslationRequest(String question, String modelName, SchemaDescriptor schema) {

    public TranslationRequest {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
        if (modelName != null && modelName.isBlank()) {
            modelName = null;
        }
        if (schema == null) {
            schema = SchemaDescriptor.empty();
        }
    }

    public TranslationRequest withSchema(SchemaDescriptor schema) {
        return new TranslationRequest(question, modelName, schema);
    }
}
