package com.lucidata.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders row data as a PNG chart encoded in a {@code data:} URI.
 *
 * <p>Chart selection is done by {@link #plan}, which is pure; {@link #render} paints the plan with
 * Java2D. Any rendering problem yields {@code null} instead of an error.
 */
@Slf4j
@Component
public class ChartRenderer {

    static final String DATA_URI_PREFIX = "data:image/png;base64,";

    private static final int WIDTH = 800;
    private static final int HEIGHT = 500;
    private static final int MARGIN = 60;
    private static final Color[] PALETTE = {
            new Color(31, 119, 180), new Color(255, 127, 14), new Color(44, 160, 44), new Color(214, 39, 40),
            new Color(148, 103, 189), new Color(140, 86, 75), new Color(227, 119, 194), new Color(127, 127, 127)
    };

    enum ChartKind {
        BAR, LINE, PIE
    }

    record Series(String name, List<Double> values) {
    }

    /**
     * What to draw: one label per row and one or more value series.
     */
    record ChartPlan(ChartKind kind, List<String> labels, List<Series> series, String title) {
    }

    /**
     * Render a chart for the given rows.
     *
     * @param columns column names in display order
     * @param rows row maps
     * @param visualizationType requested chart type, case-insensitive
     * @param title chart title, may be null
     * @return data URI, or null when nothing can be drawn
     */
    public String render(List<String> columns, List<Map<String, Object>> rows, String visualizationType, String title) {
        ChartPlan plan = plan(columns, rows, visualizationType, title);
        if (plan == null) {
            log.info("No chart rendered for visualization_type={} (no plottable numeric data)", visualizationType);
            return null;
        }
        try {
            return DATA_URI_PREFIX + Base64.getEncoder().encodeToString(paint(plan));
        } catch (IOException | RuntimeException | LinkageError | InternalError e) {
            log.warn("Error creating {} chart: {}", plan.kind(), e.toString());
            return null;
        }
    }

    /**
     * Choose chart kind and data.
     *
     * <ul>
     *     <li>bar: labels from the first column and values from the second when there are at least two
     *     columns, otherwise the first numeric column by row index;</li>
     *     <li>line: every numeric column, by row index;</li>
     *     <li>pie: labels from the first column and values from the second, needs two columns;</li>
     *     <li>anything else: bar of the first numeric column.</li>
     * </ul>
     *
     * @return plan, or null when there is nothing numeric to draw
     */
    ChartPlan plan(List<String> columns, List<Map<String, Object>> rows, String visualizationType, String title) {
        if (rows == null || rows.isEmpty() || columns == null || columns.isEmpty()) {
            return null;
        }
        List<String> numericColumns = new ArrayList<>();
        for (String column : columns) {
            if (isNumericColumn(rows, column)) {
                numericColumns.add(column);
            }
        }
        if (numericColumns.isEmpty()) {
            return null;
        }

        String type = visualizationType == null ? "" : visualizationType.trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "bar":
                if (columns.size() >= 2) {
                    return labelled(ChartKind.BAR, columns.get(0), columns.get(1), rows, title);
                }
                return indexed(ChartKind.BAR, List.of(numericColumns.get(0)), rows, title);
            case "line":
                return indexed(ChartKind.LINE, numericColumns, rows, title);
            case "pie":
                if (columns.size() >= 2) {
                    return labelled(ChartKind.PIE, columns.get(0), columns.get(1), rows, title);
                }
                return indexed(ChartKind.BAR, List.of(numericColumns.get(0)), rows, title);
            default:
                return indexed(ChartKind.BAR, List.of(numericColumns.get(0)), rows, title);
        }
    }

    private static ChartPlan labelled(ChartKind kind, String labelColumn, String valueColumn,
                                      List<Map<String, Object>> rows, String title) {
        if (!isNumericColumn(rows, valueColumn)) {
            return null;
        }
        List<String> labels = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            labels.add(String.valueOf(row.get(labelColumn)));
        }
        return new ChartPlan(kind, labels, List.of(seriesOf(rows, valueColumn)), title);
    }

    private static ChartPlan indexed(ChartKind kind, List<String> valueColumns,
                                     List<Map<String, Object>> rows, String title) {
        List<String> labels = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            labels.add(Integer.toString(i));
        }
        List<Series> series = new ArrayList<>();
        for (String column : valueColumns) {
            series.add(seriesOf(rows, column));
        }
        return new ChartPlan(kind, labels, series, title);
    }

    private static Series seriesOf(List<Map<String, Object>> rows, String column) {
        List<Double> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            values.add(value instanceof Number n ? n.doubleValue() : Double.NaN);
        }
        return new Series(column, values);
    }

    /**
     * A column is numeric when it has at least one value and every non-null value is a number.
     */
    static boolean isNumericColumn(List<Map<String, Object>> rows, String column) {
        boolean seen = false;
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number)) {
                return false;
            }
            seen = true;
        }
        return seen;
    }

    private byte[] paint(ChartPlan plan) throws IOException {
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, WIDTH, HEIGHT);
            g.setColor(Color.BLACK);
            if (plan.title() != null && !plan.title().isBlank()) {
                FontMetrics fm = g.getFontMetrics();
                g.drawString(plan.title(), (WIDTH - fm.stringWidth(plan.title())) / 2, MARGIN / 2);
            }
            switch (plan.kind()) {
                case PIE -> paintPie(g, plan);
                case LINE -> paintLine(g, plan);
                default -> paintBars(g, plan);
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    private static void paintBars(Graphics2D g, ChartPlan plan) {
        List<Double> values = plan.series().get(0).values();
        double[] range = range(plan.series());
        int plotWidth = WIDTH - 2 * MARGIN;
        int plotHeight = HEIGHT - 2 * MARGIN;
        int baseline = yFor(0.0, range, plotHeight);
        drawAxes(g, baseline);

        int slot = plotWidth / Math.max(1, values.size());
        int barWidth = Math.max(1, (int) (slot * 0.8));
        for (int i = 0; i < values.size(); i++) {
            double value = values.get(i);
            if (Double.isNaN(value)) {
                continue;
            }
            int x = MARGIN + i * slot + (slot - barWidth) / 2;
            int y = yFor(value, range, plotHeight);
            g.setColor(PALETTE[0]);
            g.fillRect(x, Math.min(y, baseline), barWidth, Math.max(1, Math.abs(baseline - y)));
            g.setColor(Color.DARK_GRAY);
            drawLabel(g, plan.labels().get(i), x + barWidth / 2, HEIGHT - MARGIN + 15, slot);
        }
    }

    private static void paintLine(Graphics2D g, ChartPlan plan) {
        double[] range = range(plan.series());
        int plotWidth = WIDTH - 2 * MARGIN;
        int plotHeight = HEIGHT - 2 * MARGIN;
        drawAxes(g, yFor(Math.max(range[0], 0.0), range, plotHeight));

        int points = plan.labels().size();
        int step = points > 1 ? plotWidth / (points - 1) : 0;
        g.setStroke(new BasicStroke(2f));
        for (int s = 0; s < plan.series().size(); s++) {
            Series series = plan.series().get(s);
            g.setColor(PALETTE[s % PALETTE.length]);
            int prevX = -1;
            int prevY = -1;
            for (int i = 0; i < series.values().size(); i++) {
                double value = series.values().get(i);
                if (Double.isNaN(value)) {
                    prevX = -1;
                    continue;
                }
                int x = MARGIN + i * step;
                int y = yFor(value, range, plotHeight);
                if (prevX >= 0) {
                    g.drawLine(prevX, prevY, x, y);
                } else {
                    g.fillOval(x - 2, y - 2, 4, 4);
                }
                prevX = x;
                prevY = y;
            }
            g.drawString(series.name(), WIDTH - MARGIN - 100, MARGIN + 15 * (s + 1));
        }
    }

    private static void paintPie(Graphics2D g, ChartPlan plan) {
        List<Double> values = plan.series().get(0).values();
        double total = 0;
        for (double value : values) {
            if (value < 0) {
                throw new IllegalArgumentException("Pie chart values must be non-negative");
            }
            total += Double.isNaN(value) ? 0 : value;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Pie chart needs a positive total");
        }

        int diameter = HEIGHT - 2 * MARGIN;
        int x = MARGIN;
        int y = MARGIN;
        double angle = 90;
        for (int i = 0; i < values.size(); i++) {
            double value = Double.isNaN(values.get(i)) ? 0 : values.get(i);
            double extent = value / total * 360.0;
            g.setColor(PALETTE[i % PALETTE.length]);
            g.fillArc(x, y, diameter, diameter, (int) Math.round(angle), (int) Math.round(extent));
            g.drawString(plan.labels().get(i), x + diameter + 30, y + 15 * (i + 1));
            angle += extent;
        }
    }

    private static void drawAxes(Graphics2D g, int baseline) {
        g.setColor(Color.BLACK);
        g.drawLine(MARGIN, MARGIN, MARGIN, HEIGHT - MARGIN);
        g.drawLine(MARGIN, baseline, WIDTH - MARGIN, baseline);
    }

    private static void drawLabel(Graphics2D g, String label, int centerX, int y, int maxWidth) {
        FontMetrics fm = g.getFontMetrics();
        if (fm.stringWidth(label) > maxWidth) {
            return;
        }
        g.drawString(label, centerX - fm.stringWidth(label) / 2, y);
    }

    /**
     * Min and max over all series, always spanning zero.
     */
    private static double[] range(List<Series> series) {
        double min = 0;
        double max = 0;
        for (Series s : series) {
            for (double value : s.values()) {
                if (!Double.isNaN(value)) {
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
            }
        }
        if (max == min) {
            max = min + 1;
        }
        return new double[]{min, max};
    }

    private static int yFor(double value, double[] range, int plotHeight) {
        double ratio = (value - range[0]) / (range[1] - range[0]);
        return HEIGHT - MARGIN - (int) Math.round(ratio * plotHeight);
    }
}
