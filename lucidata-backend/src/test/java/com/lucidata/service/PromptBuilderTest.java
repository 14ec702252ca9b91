package com.lucidata.service;

import com.lucidata.model.ColumnDescriptor;
import com.lucidata.model.SchemaDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Prompt builder")
class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    @DisplayName("Embeds the fallback schema and the question")
    void fallbackSchemaScenario() {
        String question = "How many cars have more than 200 horsepower?";

        String prompt = builder.build(question, SchemaDescriptorProvider.fallbackSchema());

        assertThat(prompt).contains("Table: cars (id integer, model varchar(50), mpg numeric(5,1), cyl integer");
        assertThat(prompt).contains("hp integer");
        assertThat(prompt).contains("\"" + question + "\"");
    }

    @Test
    @DisplayName("Renders the exact instruction layout")
    void exactLayout() {
        SchemaDescriptor schema = SchemaDescriptor.builder()
                .table("owners", List.of(new ColumnDescriptor("id", "integer", false)))
                .build();

        String prompt = builder.build("List owners", schema);

        assertThat(prompt).isEqualTo("\n"
                + "Given the following PostgreSQL database schema:\n"
                + "\n"
                + "Table: owners (id integer)\n"
                + "\n"
                + "Translate this natural language question into a valid SQL query:\n"
                + "\"List owners\"\n"
                + "\n"
                + "Return the answer in the following format:\n"
                + "SQL: <the SQL query>\n"
                + "EXPLANATION: <brief explanation of how the query works>\n"
                + "CONFIDENCE: <a number from 0 to 1 indicating confidence>\n"
                + "\n"
                + "Make sure the SQL is valid PostgreSQL syntax, contains no syntax errors, "
                + "and would run correctly against the described database.\n");
    }

    @Test
    @DisplayName("Uses a placeholder for an empty schema")
    void emptySchema() {
        assertThat(builder.build("anything", SchemaDescriptor.empty())).contains("No schema available.");
        assertThat(builder.build("anything", null)).contains("No schema available.");
    }

    @Test
    @DisplayName("Lists tables one per line in schema order")
    void multipleTables() {
        SchemaDescriptor schema = SchemaDescriptor.builder()
                .table("cars", List.of(new ColumnDescriptor("id", "integer", false),
                        new ColumnDescriptor("hp", "integer", true)))
                .table("owners", List.of(new ColumnDescriptor("name", "text", true)))
                .build();

        assertThat(builder.formatSchema(schema))
                .isEqualTo("Table: cars (id integer, hp integer)\nTable: owners (name text)");
    }
}
