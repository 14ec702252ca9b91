package com.lucidata.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Schema and request model")
class SchemaDescriptorTest {

    private static final List<ColumnDescriptor> ID = List.of(new ColumnDescriptor("id", "integer", false));

    @Test
    @DisplayName("Keeps tables in enumeration order")
    void order() {
        SchemaDescriptor schema = SchemaDescriptor.builder().table("owners", ID).table("cars", ID).build();

        assertThat(schema.getTables().keySet()).containsExactly("owners", "cars");
        assertThat(schema).isNotEqualTo(SchemaDescriptor.builder().table("cars", ID).table("owners", ID).build());
        assertThatThrownBy(() -> schema.getTables().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Rejects duplicate tables and columns")
    void duplicates() {
        assertThatThrownBy(() -> SchemaDescriptor.builder().table("cars", ID).table("cars", ID))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TableDescriptor(List.of(
                new ColumnDescriptor("id", "integer", false), new ColumnDescriptor("id", "text", true))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("An empty builder gives the empty schema")
    void empty() {
        assertThat(SchemaDescriptor.builder().build()).isSameAs(SchemaDescriptor.empty());
        assertThat(SchemaDescriptor.empty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Translation requests need a question and normalise optional parts")
    void translationRequest() {
        TranslationRequest request = new TranslationRequest("How many cars?", " ", null);

        assertThat(request.modelName()).isNull();
        assertThat(request.schema()).isSameAs(SchemaDescriptor.empty());
        assertThatThrownBy(() -> new TranslationRequest("  ", null, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Translation results keep confidence within bounds")
    void translationResult() {
        assertThatThrownBy(() -> new TranslationResult("SELECT 1", null, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TranslationResult(" ", null, 0.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
