package com.measure.compiler.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lightweight syntax checks run over generated code. Findings are reported as warnings;
 * they never fail a generation run.
 */
final class GeneratedCodeCheck {
    private static final Pattern LIBRARY = Pattern.compile("(?m)^library\\s+\\w+\\s+version\\s+'[^']+'");
    private static final Pattern USING_FHIR = Pattern.compile("(?m)^using\\s+FHIR\\s+version\\s+'[^']+'");
    private static final Pattern CONTEXT = Pattern.compile("(?m)^context\\s+(Patient|Unfiltered|Population)\\b");
    private static final Pattern DEFINE = Pattern.compile("(?m)^define\\s+\"");
    private static final Pattern SELECT = Pattern.compile("(?i)\\bselect\\s+");

    private GeneratedCodeCheck() {
    }

    /**
     * Delimiter balance and the declarations every library needs.
     */
    static List<String> checkCqlLibrary(String cql) {
        List<String> problems = checkDelimiters(cql, "//");
        if (!LIBRARY.matcher(cql).find()) {
            problems.add("Missing library declaration");
        }
        if (!USING_FHIR.matcher(cql).find()) {
            problems.add("Missing FHIR using declaration");
        }
        if (!CONTEXT.matcher(cql).find()) {
            problems.add("Missing context declaration");
        }
        if (!DEFINE.matcher(cql).find()) {
            problems.add("No define statements found");
        }
        return problems;
    }

    /**
     * Delimiter balance plus the anchor and result CTEs of a full population query.
     */
    static List<String> checkSqlQuery(String sql) {
        List<String> problems = checkDelimiters(sql, "--");
        if (!sql.contains("DEMOG as (")) {
            problems.add("Missing DEMOG (demographics) CTE");
        }
        if (!sql.contains("MEASURE_RESULT as (")) {
            problems.add("Missing MEASURE_RESULT CTE");
        }
        if (!SELECT.matcher(sql).find()) {
            problems.add("No SELECT statement found");
        }
        return problems;
    }

    /**
     * Balanced parentheses, brackets and quotes, ignoring comments and string contents.
     * @param code Generated text
     * @param lineComment Line comment token of the target language
     * @return One message per problem, with 1-based line numbers
     */
    static List<String> checkDelimiters(String code, String lineComment) {
        List<String> problems = new ArrayList<>();
        Deque<Integer> parens = new ArrayDeque<>();
        Deque<Integer> brackets = new ArrayDeque<>();
        int line = 1;
        char quote = 0;
        int quoteLine = 0;

        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '\n') {
                line++;
            }
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (code.startsWith(lineComment, i)) {
                int end = code.indexOf('\n', i);
                if (end < 0) {
                    break;
                }
                i = end - 1;
                continue;
            }
            if (code.startsWith("/*", i)) {
                int end = code.indexOf("*/", i + 2);
                if (end < 0) {
                    problems.add("Unclosed block comment at line " + line);
                    break;
                }
                line += countNewlines(code, i, end);
                i = end + 1;
                continue;
            }
            switch (c) {
                case '\'', '"' -> {
                    quote = c;
                    quoteLine = line;
                }
                case '(' -> parens.push(line);
                case ')' -> {
                    if (parens.isEmpty()) {
                        problems.add("Unexpected closing parenthesis at line " + line);
                    } else {
                        parens.pop();
                    }
                }
                case '[' -> brackets.push(line);
                case ']' -> {
                    if (brackets.isEmpty()) {
                        problems.add("Unexpected closing bracket at line " + line);
                    } else {
                        brackets.pop();
                    }
                }
                default -> {
                }
            }
        }

        if (quote != 0) {
            problems.add("Unclosed string literal (" + quote + ") at line " + quoteLine);
        }
        for (Integer open : parens) {
            problems.add("Unclosed parenthesis at line " + open);
        }
        for (Integer open : brackets) {
            problems.add("Unclosed bracket at line " + open);
        }
        return problems;
    }

    private static int countNewlines(String code, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (code.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
