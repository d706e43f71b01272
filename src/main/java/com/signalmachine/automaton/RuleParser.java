package com.signalmachine.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses rule text into an ordered list of {@link Rule}s.
 *
 * <p>Each non-blank line is {@code condition: outputs}, {@code condition:} or {@code outputs}. A line's
 * condition is combined with the condition of the closest less-indented line above it, so
 *
 * <pre>
 * Right:
 *   -Half: 1.Right
 *   Half: 1.Wall
 * </pre>
 *
 * yields the rules {@code (Right -Half): 1.Right} and {@code (Right Half): 1.Wall}. Text after {@code #} is a
 * comment.
 *
 * <p>Condition items read {@code [time/][position.][sign]name}; {@code ( )} groups a conjunction,
 * {@code [ ]} a disjunction, and a standalone {@code -} or {@code +} applies to the next clause. Output items
 * read {@code [time/][neighbor.]name} with time defaulting to 1 and neighbor to 0.
 */
public final class RuleParser {

    /**
     * Largest absolute value accepted for a position, neighbor or time offset.
     */
    public static final int MAX_OFFSET = 1024;

    private static final String NAME = "[A-Za-z0-9_$']+";
    private static final String NUMBER = "[+-]?\\d+";
    private static final Pattern CONDITION_ITEM =
            Pattern.compile("(?:(" + NUMBER + ")/)?(?:(" + NUMBER + ")\\.)?([+-])?(" + NAME + ")");
    private static final Pattern OUTPUT_ITEM =
            Pattern.compile("(?:(" + NUMBER + ")/)?(?:(" + NUMBER + ")\\.)?(" + NAME + ")");

    private final SignalTable signals;

    public RuleParser(SignalTable signals) {
        this.signals = Objects.requireNonNull(signals, "signals");
    }

    public List<Rule> parse(String text) {
        Objects.requireNonNull(text, "text");
        List<Rule> rules = new ArrayList<>();
        Deque<Scope> scopes = new ArrayDeque<>();
        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String raw = lines[i];
            String line = stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }
            int indent = indentOf(raw);
            while (!scopes.isEmpty() && scopes.peek().indent() >= indent) {
                scopes.pop();
            }

            String conditionPart = null;
            String outputsPart = line;
            int colon = line.indexOf(':');
            if (colon >= 0) {
                conditionPart = line.substring(0, colon);
                outputsPart = line.substring(colon + 1);
            }

            Clause condition;
            if (conditionPart != null) {
                Clause lineCondition = parseCondition(conditionPart, lineNumber);
                if (scopes.isEmpty()) {
                    condition = lineCondition;
                } else if (lineCondition instanceof Clause.True) {
                    condition = scopes.peek().condition();
                } else {
                    condition = Clause.and(scopes.peek().condition(), lineCondition);
                }
                scopes.push(new Scope(condition, indent));
            } else {
                if (scopes.isEmpty()) {
                    throw new RuleSyntaxException(lineNumber, "Outputs '" + line + "' have no enclosing condition");
                }
                condition = scopes.peek().condition();
            }

            if (!outputsPart.isBlank()) {
                rules.add(new Rule(condition, parseOutputs(outputsPart, lineNumber)));
            }
        }
        return rules;
    }

    Clause parseCondition(String conditionText, int lineNumber) {
        ConditionReader reader = new ConditionReader(tokenizeCondition(conditionText, lineNumber), lineNumber);
        return reader.readAll();
    }

    List<RuleOutput> parseOutputs(String outputsText, int lineNumber) {
        List<RuleOutput> outputs = new ArrayList<>();
        for (String token : outputsText.trim().split("\\s+")) {
            Matcher matcher = OUTPUT_ITEM.matcher(token);
            if (!matcher.matches()) {
                throw new RuleSyntaxException(lineNumber, "Invalid output '" + token + "'");
            }
            int futureStep = parseNumber(matcher.group(1), RuleOutput.DEFAULT_FUTURE_STEP, token, lineNumber);
            int neighbor = parseNumber(matcher.group(2), 0, token, lineNumber);
            Signal signal = signals.intern(matcher.group(3));
            try {
                outputs.add(new RuleOutput(neighbor, signal, futureStep));
            } catch (IllegalArgumentException ex) {
                throw new RuleSyntaxException(lineNumber, "Invalid output '" + token + "': " + ex.getMessage(), ex);
            }
        }
        return outputs;
    }

    static List<String> tokenizeCondition(String text, int lineNumber) {
        List<String> tokens = new ArrayList<>();
        int length = text.length();
        int pos = 0;
        while (pos < length) {
            char ch = text.charAt(pos);
            if (Character.isWhitespace(ch)) {
                pos++;
                continue;
            }
            if (ch == '(' || ch == ')' || ch == '[' || ch == ']') {
                tokens.add(String.valueOf(ch));
                pos++;
                continue;
            }
            boolean sign = ch == '+' || ch == '-';
            if (sign && (pos + 1 >= length || !Character.isDigit(text.charAt(pos + 1)))) {
                tokens.add(String.valueOf(ch));
                pos++;
                continue;
            }
            if (!sign && !isItemChar(ch)) {
                throw new RuleSyntaxException(lineNumber, "Unexpected character '" + ch + "' in condition");
            }
            int start = pos++;
            while (pos < length) {
                char next = text.charAt(pos);
                char previous = text.charAt(pos - 1);
                if (isItemChar(next) || ((next == '+' || next == '-') && (previous == '.' || previous == '/'))) {
                    pos++;
                } else {
                    break;
                }
            }
            tokens.add(text.substring(start, pos));
        }
        return tokens;
    }

    private Clause literal(String token, int lineNumber) {
        Matcher matcher = CONDITION_ITEM.matcher(token);
        if (!matcher.matches()) {
            throw new RuleSyntaxException(lineNumber, "Invalid condition item '" + token + "'");
        }
        int timeStep = parseNumber(matcher.group(1), 0, token, lineNumber);
        int position = parseNumber(matcher.group(2), 0, token, lineNumber);
        Clause literal = new Clause.Literal(signals.intern(matcher.group(4)), position, timeStep);
        return "-".equals(matcher.group(3)) ? Clause.not(literal) : literal;
    }

    private static int parseNumber(String raw, int fallback, String token, int lineNumber) {
        if (raw == null) {
            return fallback;
        }
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new RuleSyntaxException(lineNumber, "Number out of range in '" + token + "'", ex);
        }
        if (value < -MAX_OFFSET || value > MAX_OFFSET) {
            throw new RuleSyntaxException(lineNumber, "Offset " + value + " in '" + token + "' exceeds " + MAX_OFFSET);
        }
        return value;
    }

    private static boolean isItemChar(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9')
                || ch == '_' || ch == '$' || ch == '\'' || ch == '.' || ch == '/';
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    private static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
            indent++;
        }
        return indent;
    }

    private record Scope(Clause condition, int indent) {
    }

    private final class ConditionReader {

        private final List<String> tokens;
        private final int lineNumber;
        private int index;

        ConditionReader(List<String> tokens, int lineNumber) {
            this.tokens = tokens;
            this.lineNumber = lineNumber;
        }

        Clause readAll() {
            List<Clause> clauses = new ArrayList<>();
            while (index < tokens.size()) {
                clauses.add(readClause());
            }
            if (clauses.isEmpty()) {
                return Clause.TRUE;
            }
            return clauses.size() == 1 ? clauses.get(0) : new Clause.Conjunction(clauses);
        }

        private Clause readClause() {
            String token = tokens.get(index++);
            return switch (token) {
                case "(" -> readGroup(")");
                case "[" -> readGroup("]");
                case ")", "]" -> throw new RuleSyntaxException(lineNumber, "Unbalanced '" + token + "' in condition");
                case "-" -> Clause.not(readSigned(token));
                case "+" -> readSigned(token);
                default -> literal(token, lineNumber);
            };
        }

        private Clause readSigned(String sign) {
            if (index >= tokens.size()) {
                throw new RuleSyntaxException(lineNumber, "Sign '" + sign + "' is not followed by a clause");
            }
            return readClause();
        }

        private Clause readGroup(String close) {
            List<Clause> subclauses = new ArrayList<>();
            while (true) {
                if (index >= tokens.size()) {
                    throw new RuleSyntaxException(lineNumber, "Unbalanced condition: missing '" + close + "'");
                }
                String next = tokens.get(index);
                if (next.equals(close)) {
                    index++;
                    break;
                }
                if (next.equals(")") || next.equals("]")) {
                    throw new RuleSyntaxException(lineNumber, "Unbalanced condition: expected '" + close
                            + "' but found '" + next + "'");
                }
                subclauses.add(readClause());
            }
            boolean conjunction = close.equals(")");
            if (subclauses.isEmpty()) {
                if (conjunction) {
                    throw new RuleSyntaxException(lineNumber, "Empty conjunction '()' in condition");
                }
                return Clause.FALSE;
            }
            if (subclauses.size() == 1) {
                return subclauses.get(0);
            }
            return conjunction ? new Clause.Conjunction(subclauses) : new Clause.Disjunction(subclauses);
        }
    }
}
