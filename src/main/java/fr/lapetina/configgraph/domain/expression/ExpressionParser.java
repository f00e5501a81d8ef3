package fr.lapetina.configgraph.domain.expression;

import fr.lapetina.configgraph.domain.exception.ExpressionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the expression language.
 *
 * Precedence from loosest to tightest: conditional, or, and, not,
 * comparisons, additive, multiplicative, unary sign, power, postfix.
 */
final class ExpressionParser {

    private static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "in", "is", "if", "else", "True", "False", "None");
    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", "<=", ">", ">=");

    private enum Kind { NUMBER, STRING, NAME, KEYWORD, OP, END }

    private record Token(Kind kind, String text, Object value, int position) {
    }

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionException("Empty expression");
        }
        ExpressionParser parser = new ExpressionParser(source);
        Expression expression = parser.conditional();
        if (parser.peek().kind() != Kind.END) {
            throw parser.error("Unexpected token '" + parser.peek().text() + "'");
        }
        return expression;
    }

    private Expression conditional() {
        Expression value = or();
        if (acceptKeyword("if")) {
            Expression test = or();
            expectKeyword("else");
            Expression otherwise = conditional();
            return new Expression.Conditional(test, value, otherwise);
        }
        return value;
    }

    private Expression or() {
        Expression left = and();
        while (acceptKeyword("or")) {
            left = new Expression.Binary("or", left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = not();
        while (acceptKeyword("and")) {
            left = new Expression.Binary("and", left, not());
        }
        return left;
    }

    private Expression not() {
        if (acceptKeyword("not")) {
            return new Expression.Unary("not", not());
        }
        return comparison();
    }

    private Expression comparison() {
        Expression first = additive();
        List<String> ops = new ArrayList<>();
        List<Expression> operands = new ArrayList<>();
        operands.add(first);
        while (true) {
            Token t = peek();
            String op;
            if (t.kind() == Kind.OP && COMPARISONS.contains(t.text())) {
                index++;
                op = t.text();
            } else if (isKeyword(t, "in")) {
                index++;
                op = "in";
            } else if (isKeyword(t, "not") && isKeyword(peekAhead(1), "in")) {
                index += 2;
                op = "not in";
            } else if (isKeyword(t, "is")) {
                index++;
                op = acceptKeyword("not") ? "is not" : "is";
            } else {
                break;
            }
            ops.add(op);
            operands.add(additive());
        }
        return ops.isEmpty() ? first : new Expression.Comparison(ops, operands);
    }

    private Expression additive() {
        Expression left = multiplicative();
        while (peekOp("+") || peekOp("-")) {
            String op = next().text();
            left = new Expression.Binary(op, left, multiplicative());
        }
        return left;
    }

    private Expression multiplicative() {
        Expression left = unary();
        while (peekOp("*") || peekOp("/") || peekOp("//") || peekOp("%")) {
            String op = next().text();
            left = new Expression.Binary(op, left, unary());
        }
        return left;
    }

    private Expression unary() {
        if (peekOp("-") || peekOp("+")) {
            String op = next().text();
            return new Expression.Unary(op, unary());
        }
        return power();
    }

    private Expression power() {
        Expression base = postfix();
        if (acceptOp("**")) {
            return new Expression.Binary("**", base, unary());
        }
        return base;
    }

    private Expression postfix() {
        Expression target = primary();
        while (true) {
            if (acceptOp(".")) {
                Token name = next();
                if (name.kind() != Kind.NAME) {
                    throw error("Expected attribute name after '.'");
                }
                target = new Expression.Attribute(target, name.text());
            } else if (acceptOp("(")) {
                target = call(target);
            } else if (acceptOp("[")) {
                Expression idx = conditional();
                expectOp("]");
                target = new Expression.Subscript(target, idx);
            } else {
                return target;
            }
        }
    }

    private Expression call(Expression function) {
        List<Expression> args = new ArrayList<>();
        Map<String, Expression> kwargs = new LinkedHashMap<>();
        while (!acceptOp(")")) {
            Token t = peek();
            if (t.kind() == Kind.NAME && peekAhead(1).kind() == Kind.OP && peekAhead(1).text().equals("=")) {
                index += 2;
                kwargs.put(t.text(), conditional());
            } else {
                if (!kwargs.isEmpty()) {
                    throw error("Positional argument follows keyword argument");
                }
                args.add(conditional());
            }
            if (!acceptOp(",")) {
                expectOp(")");
                break;
            }
        }
        return new Expression.Call(function, args, kwargs);
    }

    private Expression primary() {
        Token t = next();
        switch (t.kind()) {
            case NUMBER:
                return new Expression.Literal(t.value());
            case STRING: {
                StringBuilder sb = new StringBuilder((String) t.value());
                while (peek().kind() == Kind.STRING) {
                    sb.append((String) next().value());
                }
                return new Expression.Literal(sb.toString());
            }
            case NAME:
                return new Expression.Name(t.text());
            case KEYWORD:
                switch (t.text()) {
                    case "True":
                        return new Expression.Literal(Boolean.TRUE);
                    case "False":
                        return new Expression.Literal(Boolean.FALSE);
                    case "None":
                        return new Expression.Literal(null);
                    default:
                        throw error("Unexpected keyword '" + t.text() + "'");
                }
            case OP:
                switch (t.text()) {
                    case "(":
                        return parenthesized();
                    case "[":
                        return new Expression.ListDisplay(sequence("]"), false);
                    case "{":
                        return dict();
                    default:
                        throw error("Unexpected '" + t.text() + "'");
                }
            default:
                throw error("Unexpected end of expression");
        }
    }

    private Expression parenthesized() {
        if (acceptOp(")")) {
            return new Expression.ListDisplay(List.of(), true);
        }
        Expression first = conditional();
        if (acceptOp(")")) {
            return first;
        }
        expectOp(",");
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        elements.addAll(sequence(")"));
        return new Expression.ListDisplay(elements, true);
    }

    private List<Expression> sequence(String close) {
        List<Expression> elements = new ArrayList<>();
        while (!acceptOp(close)) {
            elements.add(conditional());
            if (!acceptOp(",")) {
                expectOp(close);
                break;
            }
        }
        return elements;
    }

    private Expression dict() {
        List<Expression> keys = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        while (!acceptOp("}")) {
            keys.add(conditional());
            expectOp(":");
            values.add(conditional());
            if (!acceptOp(",")) {
                expectOp("}");
                break;
            }
        }
        return new Expression.DictDisplay(keys, values);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.kind() != Kind.END) {
            index++;
        }
        return t;
    }

    private boolean peekOp(String op) {
        Token t = peek();
        return t.kind() == Kind.OP && t.text().equals(op);
    }

    private boolean acceptOp(String op) {
        if (peekOp(op)) {
            index++;
            return true;
        }
        return false;
    }

    private void expectOp(String op) {
        if (!acceptOp(op)) {
            throw error("Expected '" + op + "' but found '" + peek().text() + "'");
        }
    }

    private static boolean isKeyword(Token t, String keyword) {
        return t.kind() == Kind.KEYWORD && t.text().equals(keyword);
    }

    private boolean acceptKeyword(String keyword) {
        if (isKeyword(peek(), keyword)) {
            index++;
            return true;
        }
        return false;
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("Expected '" + keyword + "'");
        }
    }

    private ExpressionException error(String message) {
        return new ExpressionException(message + " at position " + peek().position() + " in: " + source);
    }

    private static List<Token> tokenize(String source) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(source.charAt(i + 1)))) {
                int start = i;
                boolean real = false;
                while (i < n && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '_')) i++;
                if (i < n && source.charAt(i) == '.') {
                    real = true;
                    i++;
                    while (i < n && Character.isDigit(source.charAt(i))) i++;
                }
                if (i < n && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
                    real = true;
                    i++;
                    if (i < n && (source.charAt(i) == '+' || source.charAt(i) == '-')) i++;
                    while (i < n && Character.isDigit(source.charAt(i))) i++;
                }
                String text = source.substring(start, i);
                String digits = text.replace("_", "");
                try {
                    Object value = real ? (Object) Double.parseDouble(digits) : (Object) Long.parseLong(digits);
                    out.add(new Token(Kind.NUMBER, text, value, start));
                } catch (NumberFormatException e) {
                    throw new ExpressionException("Invalid number literal '" + text + "'", e);
                }
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) i++;
                String word = source.substring(start, i);
                out.add(new Token(KEYWORDS.contains(word) ? Kind.KEYWORD : Kind.NAME, word, null, start));
            } else if (c == '\'' || c == '"') {
                int start = i;
                StringBuilder sb = new StringBuilder();
                i++;
                while (true) {
                    if (i >= n) {
                        throw new ExpressionException("Unterminated string literal at position " + start);
                    }
                    char ch = source.charAt(i++);
                    if (ch == c) break;
                    if (ch == '\\' && i < n) {
                        char esc = source.charAt(i++);
                        switch (esc) {
                            case 'n' -> sb.append('\n');
                            case 't' -> sb.append('\t');
                            case 'r' -> sb.append('\r');
                            default -> sb.append(esc);
                        }
                    } else {
                        sb.append(ch);
                    }
                }
                out.add(new Token(Kind.STRING, source.substring(start, i), sb.toString(), start));
            } else {
                String op = operator(source, i);
                out.add(new Token(Kind.OP, op, null, i));
                i += op.length();
            }
        }
        out.add(new Token(Kind.END, "<end>", null, n));
        return out;
    }

    private static String operator(String source, int i) {
        if (i + 1 < source.length()) {
            String two = source.substring(i, i + 2);
            switch (two) {
                case "**", "//", "==", "!=", "<=", ">=":
                    return two;
                default:
                    break;
            }
        }
        char c = source.charAt(i);
        if ("+-*/%<>()[]{}.,:=".indexOf(c) < 0) {
            throw new ExpressionException("Unexpected character '" + c + "' at position " + i);
        }
        return String.valueOf(c);
    }
}
