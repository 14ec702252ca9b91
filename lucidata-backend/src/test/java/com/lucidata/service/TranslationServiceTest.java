package com.lucidata.service;

import com.lucidata.model.Outcome;
import com.lucidata.model.SchemaDescriptor;
import com.lucidata.model.TranslationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Translation pipeline")
class TranslationServiceTest {

    private static final String QUESTION = "How many cars have more than 200 horsepower?";
    private static final String MODEL_RESPONSE = "SQL: SELECT COUNT(*) FROM cars WHERE hp > 200;\n"
            + "EXPLANATION: Counts rows where hp exceeds 200.\n"
            + "CONFIDENCE: 0.9";

    @Mock
    private SchemaDescriptorProvider schemaDescriptorProvider;

    @Mock
    private TranslationClient translationClient;

    private TranslationService service;

    @BeforeEach
    void setUp() {
        service = new TranslationService(schemaDescriptorProvider, new PromptBuilder(), translationClient,
                new ResponseParser());
    }

    @Test
    @DisplayName("Translates a question end to end")
    void endToEnd() throws Exception {
        when(schemaDescriptorProvider.fetch()).thenReturn(Outcome.success(SchemaDescriptorProvider.fallbackSchema()));
        when(translationClient.translate(anyString(), any())).thenReturn(MODEL_RESPONSE);

        Outcome<TranslationResult> outcome = service.translate(QUESTION, null);

        assertThat(outcome.getStatus()).isEqualTo(Outcome.Status.SUCCEEDED);
        assertThat(outcome.getValue()).isEqualTo(
                new TranslationResult("SELECT COUNT(*) FROM cars WHERE hp > 200;", "Counts rows where hp exceeds 200.", 0.9));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(translationClient).translate(prompt.capture(), eq(null));
        assertThat(prompt.getValue()).contains("Table: cars (id integer, model varchar(50),").contains(QUESTION);
    }

    @Test
    @DisplayName("Reports a schema fallback even when parsing succeeds")
    void schemaFallbackIsVisible() throws Exception {
        when(schemaDescriptorProvider.fetch()).thenReturn(Outcome.fallback(
                SchemaDescriptorProvider.fallbackSchema(), List.of("Database not configured; using built-in schema")));
        when(translationClient.translate(anyString(), eq("gpt-4o"))).thenReturn(MODEL_RESPONSE);

        Outcome<TranslationResult> outcome = service.translate(QUESTION, "gpt-4o");

        assertThat(outcome.isFallbackApplied()).isTrue();
        assertThat(outcome.getWarnings()).containsExactly("Database not configured; using built-in schema");
        assertThat(outcome.getValue().confidence()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Merges schema and parse warnings")
    void mergesWarnings() throws Exception {
        when(schemaDescriptorProvider.fetch()).thenReturn(Outcome.fallback(
                SchemaDescriptorProvider.fallbackSchema(), List.of("Schema introspection failed; using built-in schema")));
        when(translationClient.translate(anyString(), any())).thenReturn("I am not sure.");

        Outcome<TranslationResult> outcome = service.translate(QUESTION, null);

        assertThat(outcome.getValue().sqlQuery()).isEqualTo(ResponseParser.FALLBACK_SQL);
        assertThat(outcome.getWarnings()).hasSize(2)
                .first().isEqualTo("Schema introspection failed; using built-in schema");
    }

    @Test
    @DisplayName("Fails without a value when the provider call fails")
    void providerFailure() throws Exception {
        when(schemaDescriptorProvider.fetch()).thenReturn(Outcome.success(SchemaDescriptor.empty()));
        when(translationClient.translate(anyString(), any())).thenThrow(
                new ProviderException(ProviderException.Kind.RATE_LIMITED, "Language model API error: HTTP 429"));

        Outcome<TranslationResult> outcome = service.translate(QUESTION, null);

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.getError()).isEqualTo("Error processing query: Language model API error: HTTP 429");
        assertThatThrownBy(outcome::getValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Rejects a blank question before reading the schema or calling the model")
    void blankQuestion() throws Exception {
        assertThatThrownBy(() -> service.translate("   ", null)).isInstanceOf(IllegalArgumentException.class);
        verify(schemaDescriptorProvider, never()).fetch();
        verify(translationClient, never()).translate(anyString(), any());
    }
}
