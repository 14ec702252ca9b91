package com.lucidata.service;

import com.lucidata.model.Outcome;
import com.lucidata.model.SchemaDescriptor;
import com.lucidata.model.TranslationRequest;
import com.lucidata.model.TranslationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one question through schema fetch, prompt rendering, model completion and response parsing.
 *
 * <p>Stages run strictly in sequence and share nothing across calls. Schema and parse problems are
 * recovered with built-in defaults and reported as {@link Outcome.Status#FALLBACK_APPLIED}; a provider
 * failure has no safe default and yields {@link Outcome.Status#FAILED}.
 */
@Slf4j
@Service
public class TranslationService {

    private final SchemaDescriptorProvider schemaDescriptorProvider;
    private final PromptBuilder promptBuilder;
    private final TranslationClient translationClient;
    private final ResponseParser responseParser;

    public TranslationService(
            SchemaDescriptorProvider schemaDescriptorProvider,
            PromptBuilder promptBuilder,
            TranslationClient translationClient,
            ResponseParser responseParser
    ) {
        this.schemaDescriptorProvider = schemaDescriptorProvider;
        this.promptBuilder = promptBuilder;
        this.translationClient = translationClient;
        this.responseParser = responseParser;
    }

    /**
     * Translate a natural-language question into SQL.
     *
     * @param question question text, non-blank
     * @param modelName model override, or null for the configured default
     * @return translation outcome
     * @throws IllegalArgumentException if the question is blank
     */
    public Outcome<TranslationResult> translate(String question, String modelName) {
        // validates the question before any database round trip
        TranslationRequest request = new TranslationRequest(question, modelName, null);
        Outcome<SchemaDescriptor> schema = schemaDescriptorProvider.fetch();
        request = request.withSchema(schema.getValue());

        String prompt = promptBuilder.build(request.question(), request.schema());

        String raw;
        try {
            raw = translationClient.translate(prompt, request.modelName());
        } catch (ProviderException e) {
            log.error("Error processing query with language model (kind={}): {}", e.getKind(), e.getMessage());
            return Outcome.failed("Error processing query: " + e.getMessage());
        }

        Outcome<TranslationResult> result = schema.followedBy(responseParser.parse(raw));
        log.info("Processed query: '{}' -> SQL: '{}'", request.question(), result.getValue().sqlQuery());
        return result;
    }
}
