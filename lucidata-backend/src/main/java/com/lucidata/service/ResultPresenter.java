package com.lucidata.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Formats result rows as HTML, CSV or JSON and optionally attaches a chart.
 */
@Slf4j
@Service
public class ResultPresenter {

    public static final String EMPTY_PLACEHOLDER = "No data to format";

    static final String HTML_TABLE_OPEN = "<table border=\"0\" class=\"dataframe table table-striped table-hover\">";

    enum Format {
        HTML("text/html"),
        CSV("text/csv"),
        JSON("application/json");

        private final String contentType;

        Format(String contentType) {
            this.contentType = contentType;
        }

        /**
         * Case-insensitive lookup; null and unknown values fall back to HTML.
         */
        static Format from(String value) {
            if (value == null) {
                return HTML;
            }
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "csv":
                    return CSV;
                case "json":
                    return JSON;
                default:
                    return HTML;
            }
        }
    }

    /**
     * Rendered output.
     *
     * @param formattedData document text
     * @param contentType MIME type of {@code formattedData}
     * @param visualization chart data URI, or null
     */
    public record Presentation(String formattedData, String contentType, String visualization) {
    }

    private final ObjectMapper objectMapper;
    private final ChartRenderer chartRenderer;

    public ResultPresenter(ObjectMapper objectMapper, ChartRenderer chartRenderer) {
        this.objectMapper = objectMapper;
        this.chartRenderer = chartRenderer;
    }

    /**
     * Format rows.
     *
     * @param rows row maps, may be null or empty
     * @param format {@code html}, {@code csv} or {@code json}; anything else means html
     * @param visualizationType chart hint, may be null
     * @param title optional heading, also used as chart title
     * @param description optional paragraph under the heading (html only)
     * @return formatted output
     * @throws FormattingException if the rows cannot be serialized
     */
    public Presentation format(List<Map<String, Object>> rows, String format, String visualizationType,
                               String title, String description) {
        if (rows == null || rows.isEmpty()) {
            return new Presentation(EMPTY_PLACEHOLDER, "text/plain", null);
        }
        List<Map<String, Object>> safeRows = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            safeRows.add(row != null ? row : Map.of());
        }
        List<String> columns = columnsOf(safeRows);

        Format selected = Format.from(format);
        String formatted;
        switch (selected) {
            case CSV:
                formatted = toCsv(columns, safeRows);
                break;
            case JSON:
                formatted = toJson(columns, safeRows);
                break;
            default:
                formatted = toHtml(columns, safeRows, title, description);
                break;
        }

        String visualization = null;
        if (visualizationType != null && !visualizationType.isBlank()) {
            visualization = chartRenderer.render(columns, safeRows, visualizationType, title);
        }
        log.debug("Formatted {} row(s) as {}", safeRows.size(), selected);
        return new Presentation(formatted, selected.contentType, visualization);
    }

    /**
     * Union of row keys, in first-seen order.
     */
    static List<String> columnsOf(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
        }
        return new ArrayList<>(columns);
    }

    String toCsv(List<String> columns, List<Map<String, Object>> rows) {
        StringBuilder sb = new StringBuilder();
        appendCsvLine(sb, new ArrayList<>(columns));
        for (Map<String, Object> row : rows) {
            List<Object> cells = new ArrayList<>(columns.size());
            for (String column : columns) {
                cells.add(row.get(column));
            }
            appendCsvLine(sb, cells);
        }
        return sb.toString();
    }

    private void appendCsvLine(StringBuilder sb, List<?> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            String text = cellText(cells.get(i));
            if (text.indexOf(',') >= 0 || text.indexOf('"') >= 0 || text.indexOf('\n') >= 0
                    || text.indexOf('\r') >= 0) {
                sb.append('"').append(text.replace("\"", "\"\"")).append('"');
            } else {
                sb.append(text);
            }
        }
        sb.append('\n');
    }

    String toJson(List<String> columns, List<Map<String, Object>> rows) {
        List<Map<String, Object>> ordered = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (String column : columns) {
                copy.put(column, row.get(column));
            }
            ordered.add(copy);
        }
        try {
            return objectMapper.writeValueAsString(ordered);
        } catch (JsonProcessingException e) {
            throw new FormattingException("Error formatting data as JSON: " + e.getOriginalMessage(), e);
        }
    }

    String toHtml(List<String> columns, List<Map<String, Object>> rows, String title, String description) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"lucidata-result\">\n");
        if (title != null && !title.isBlank()) {
            sb.append("<h3>").append(HtmlUtils.htmlEscape(title)).append("</h3>\n");
        }
        if (description != null && !description.isBlank()) {
            sb.append("<p>").append(HtmlUtils.htmlEscape(description)).append("</p>\n");
        }
        sb.append(HTML_TABLE_OPEN).append('\n');
        sb.append("<thead>\n<tr>");
        for (String column : columns) {
            sb.append("<th>").append(HtmlUtils.htmlEscape(column)).append("</th>");
        }
        sb.append("</tr>\n</thead>\n<tbody>\n");
        for (Map<String, Object> row : rows) {
            sb.append("<tr>");
            for (String column : columns) {
                sb.append("<td>").append(HtmlUtils.htmlEscape(cellText(row.get(column)))).append("</td>");
            }
            sb.append("</tr>\n");
        }
        sb.append("</tbody>\n</table>\n</div>");
        return sb.toString();
    }

    /**
     * Scalars print as themselves, nested lists and objects as JSON, null as empty text.
     */
    private String cellText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof List) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new FormattingException("Error formatting nested value: " + e.getOriginalMessage(), e);
            }
        }
        return String.valueOf(value);
    }
}
