package com.treeq.predicate;

/**
 * Parses textual node filters such as {@code type(call) & !contains("print")}.
 *
 * <p>Terms: {@code type(x)}, {@code text(x)}, {@code contains(x)}, {@code kind(x)},
 * {@code capability(x)}, {@code field(x)} and {@code named}. Operators by increasing
 * precedence: {@code |}, {@code &}, {@code !}. Arguments may be double-quoted to include
 * operator characters.
 */
public class PredicateParser {
    public NodePredicate parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return NodePredicate.any();
        }

        String trimmed = expression.trim();

        int orIndex = findTopLevel(trimmed, '|');
        if (orIndex != -1) {
            return parse(requireOperand(trimmed.substring(0, orIndex), expression))
                .or(parse(requireOperand(trimmed.substring(orIndex + 1), expression)));
        }

        int andIndex = findTopLevel(trimmed, '&');
        if (andIndex != -1) {
            return parse(requireOperand(trimmed.substring(0, andIndex), expression))
                .and(parse(requireOperand(trimmed.substring(andIndex + 1), expression)));
        }

        if (trimmed.startsWith("!")) {
            return parse(requireOperand(trimmed.substring(1), expression)).not();
        }

        if (trimmed.startsWith("(") && closingParen(trimmed, 0) == trimmed.length() - 1) {
            return parse(requireOperand(trimmed.substring(1, trimmed.length() - 1), expression));
        }

        if (trimmed.equals("named")) {
            return NodePredicate.named();
        }

        int open = trimmed.indexOf('(');
        if (open > 0 && closingParen(trimmed, open) == trimmed.length() - 1) {
            String name = trimmed.substring(0, open).trim();
            String argument = unquote(trimmed.substring(open + 1, trimmed.length() - 1).trim());
            return switch (name) {
                case "type" -> NodePredicate.type(argument);
                case "text" -> NodePredicate.text(argument);
                case "contains" -> NodePredicate.textContains(argument);
                case "kind" -> NodePredicate.kind(argument);
                case "capability" -> NodePredicate.capability(argument);
                case "field" -> NodePredicate.field(argument);
                default -> throw new IllegalArgumentException("Unknown filter: " + name);
            };
        }

        throw new IllegalArgumentException("Unsupported filter: " + expression);
    }

    private String requireOperand(String operand, String expression) {
        if (operand.isBlank()) {
            throw new IllegalArgumentException("Missing operand in filter: " + expression);
        }
        return operand;
    }

    /**
     * Find the first occurrence of {@code operator} outside parentheses and quotes.
     */
    private int findTopLevel(String expression, char operator) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == operator && depth == 0) {
                return i;
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quote in filter: " + expression);
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced parentheses in filter: " + expression);
        }
        return -1;
    }

    private int closingParen(String expression, int open) {
        int depth = 0;
        boolean quoted = false;
        for (int i = open; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private String unquote(String argument) {
        if (argument.length() >= 2 && argument.startsWith("\"") && argument.endsWith("\"")) {
            return argument.substring(1, argument.length() - 1);
        }
        if (argument.isEmpty()) {
            throw new IllegalArgumentException("Empty filter argument");
        }
        return argument;
    }
}
