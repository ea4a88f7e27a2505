package org.csu.astrodsl.cli.tool;

import org.csu.astrodsl.common.exception.FormulaException;
import org.csu.astrodsl.common.model.ChartData;
import org.csu.astrodsl.common.model.Value;
import org.csu.astrodsl.compiler.lexer.Lexer;
import org.csu.astrodsl.compiler.lexer.Token;
import org.csu.astrodsl.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一个可重用的工具类，用于把公式的求值结果格式化为控制台报告。
 * 详细模式下附带一张带边框的表格，列出公式中提到的行星。
 */
public class FormulaResultFormatter {

    private static final int WIDTH = 60;
    private static final List<String> CONTEXT_COLUMNS = List.of("Planet", "Sign", "House", "Dignity", "Retrograde");

    /**
     * @param formula 公式文本，必须能通过词法分析
     * @param result  求值结果
     * @param chart   求值所用的星盘
     * @param verbose 是否附带行星表格
     */
    public static String format(String formula, Value result, ChartData chart, boolean verbose) {
        StringBuilder sb = header("DSL Formula Check");
        sb.append("Formula: ").append(formula).append("\n");
        sb.append("Result: ").append(verdict(result)).append(" ").append(result).append("\n");

        if (verbose) {
            List<List<String>> rows = contextRows(formula, chart);
            sb.append("-".repeat(WIDTH)).append("\n");
            if (rows.isEmpty()) {
                sb.append("Chart Context: no planets referenced.\n");
            } else {
                sb.append("Chart Context:\n");
                sb.append(table(rows));
            }
        }
        sb.append("=".repeat(WIDTH));
        return sb.toString();
    }

    public static String formatError(String formula, FormulaException error) {
        StringBuilder sb = header("DSL Formula Check");
        sb.append("Formula: ").append(formula).append("\n");
        sb.append("Result: ERROR (").append(error.getStage()).append(")\n");
        sb.append(error.getMessage()).append("\n");
        sb.append("=".repeat(WIDTH));
        return sb.toString();
    }

    private static String verdict(Value result) {
        if (!result.isBoolean()) {
            return "VALUE";
        }
        return result.asBoolean() ? "PASS" : "FAIL";
    }

    private static StringBuilder header(String title) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(WIDTH)).append("\n");
        sb.append(title).append("\n");
        sb.append("=".repeat(WIDTH)).append("\n");
        return sb;
    }

    // 按星盘中的顺序，取出公式里以标识符形式出现的行星
    private static List<List<String>> contextRows(String formula, ChartData chart) {
        Set<String> identifiers = new HashSet<>();
        for (Token token : new Lexer(formula).tokenize()) {
            if (token.type() == TokenType.IDENTIFIER) {
                identifiers.add(token.lexeme());
            }
        }
        List<List<String>> rows = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> planet : chart.getPlanets().entrySet()) {
            if (!identifiers.contains(planet.getKey())) {
                continue;
            }
            List<String> row = new ArrayList<>();
            row.add(planet.getKey());
            for (String column : CONTEXT_COLUMNS.subList(1, CONTEXT_COLUMNS.size())) {
                Object value = planet.getValue().get(column);
                row.add(value == null ? "N/A" : display(value));
            }
            rows.add(row);
        }
        return rows;
    }

    // 展示用，无法转换为公式值的属性 (NaN、任意对象) 原样输出
    private static String display(Object value) {
        try {
            return Value.fromAttribute(value).toString();
        } catch (IllegalArgumentException e) {
            return String.valueOf(value);
        }
    }

    private static String table(List<List<String>> rows) {
        List<Integer> columnWidths = new ArrayList<>();
        for (int i = 0; i < CONTEXT_COLUMNS.size(); i++) {
            int maxWidth = CONTEXT_COLUMNS.get(i).length();
            for (List<String> row : rows) {
                maxWidth = Math.max(maxWidth, row.get(i).length());
            }
            columnWidths.add(maxWidth);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(getRow(CONTEXT_COLUMNS, columnWidths)).append("\n");
        sb.append(getSeparator(columnWidths)).append("\n");
        for (List<String> row : rows) {
            sb.append(getRow(row, columnWidths)).append("\n");
        }
        sb.append(getSeparator(columnWidths)).append("\n");
        return sb.toString();
    }

    private static String getRow(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(String.format(" %-" + widths.get(i) + "s |", cells.get(i)));
        }
        return sb.toString();
    }

    private static String getSeparator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
