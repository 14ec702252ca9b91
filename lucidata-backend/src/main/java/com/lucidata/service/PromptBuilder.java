package com.lucidata.service;

import com.lucidata.model.ColumnDescriptor;
import com.lucidata.model.SchemaDescriptor;
import com.lucidata.model.TableDescriptor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a question and schema into the instruction text sent to the model.
 *
 * <p>The {@code SQL:} / {@code EXPLANATION:} / {@code CONFIDENCE:} answer format requested here is the
 * contract {@link ResponseParser} relies on; change both together.
 */
@Component
public class PromptBuilder {

    static final String NO_SCHEMA = "No schema available.";

    /**
     * Build the user prompt. Pure and deterministic.
     *
     * @param question natural-language question, embedded verbatim
     * @param schema schema context, may be null or empty
     * @return prompt text
     */
    public String build(String question, SchemaDescriptor schema) {
        return "\n"
                + "Given the following PostgreSQL database schema:\n"
                + "\n"
                + formatSchema(schema) + "\n"
                + "\n"
                + "Translate this natural language question into a valid SQL query:\n"
                + "\"" + question + "\"\n"
                + "\n"
                + "Return the answer in the following format:\n"
                + ResponseParser.SQL_MARKER + " <the SQL query>\n"
                + ResponseParser.EXPLANATION_MARKER + " <brief explanation of how the query works>\n"
                + ResponseParser.CONFIDENCE_MARKER + " <a number from 0 to 1 indicating confidence>\n"
                + "\n"
                + "Make sure the SQL is valid PostgreSQL syntax, contains no syntax errors, "
                + "and would run correctly against the described database.\n";
    }

    /**
     * One line per table: {@code Table: name (col1 type1, col2 type2)}.
     *
     * @param schema schema, may be null
     * @return schema block, or {@value #NO_SCHEMA} when there are no tables
     */
    String formatSchema(SchemaDescriptor schema) {
        if (schema == null || schema.isEmpty()) {
            return NO_SCHEMA;
        }
        StringJoiner lines = new StringJoiner("\n");
        for (Map.Entry<String, TableDescriptor> table : schema.getTables().entrySet()) {
            StringJoiner columns = new StringJoiner(", ");
            for (ColumnDescriptor column : table.getValue().columns()) {
                columns.add(column.name() + " " + column.type());
            }
            lines.add("Table: " + table.getKey() + " (" + columns + ")");
        }
        return lines.toString();
    }
}
