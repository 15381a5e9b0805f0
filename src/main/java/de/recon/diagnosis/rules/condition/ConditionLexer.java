package de.recon.diagnosis.rules.condition;

import de.recon.diagnosis.rules.RuleConditionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a condition string into tokens. Characters that only serve constructs outside the
 * condition grammar (member access, calls with arguments, indexing, arithmetic) fail here.
 */
final class ConditionLexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT,
            "is", TokenType.IS,
            "None", TokenType.NONE,
            "True", TokenType.TRUE,
            "False", TokenType.FALSE
    );

    private static final Set<String> RESERVED = Set.of(
            "import", "from", "lambda", "exec", "eval", "def", "class", "return",
            "if", "else", "for", "while", "in", "with", "global", "del", "yield", "await"
    );

    private final String source;
    private int pos;

    ConditionLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            char c = source.charAt(pos);
            int start = pos;
            if (Character.isLetter(c) || c == '_') {
                tokens.add(word(start));
            } else if (Character.isDigit(c) || (c == '-' && pos + 1 < source.length()
                    && (Character.isDigit(source.charAt(pos + 1)) || source.charAt(pos + 1) == '.'))) {
                tokens.add(number(start));
            } else if (c == '\'' || c == '"') {
                tokens.add(string(start, c));
            } else if (c == '=' && peek(1) == '=') {
                pos += 2;
                tokens.add(new Token(TokenType.EQ, "==", start));
            } else if (c == '!' && peek(1) == '=') {
                pos += 2;
                tokens.add(new Token(TokenType.NE, "!=", start));
            } else if (c == '(') {
                pos++;
                tokens.add(new Token(TokenType.LPAREN, "(", start));
            } else if (c == ')') {
                pos++;
                tokens.add(new Token(TokenType.RPAREN, ")", start));
            } else if (c == '.') {
                throw fail(start, "attribute access is not allowed");
            } else if (c == '[' || c == ']') {
                throw fail(start, "subscripts are not allowed");
            } else if (c == '=') {
                throw fail(start, "assignment is not allowed");
            } else {
                throw fail(start, "unexpected character '" + c + "'");
            }
        }
    }

    private Token word(int start) {
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String text = source.substring(start, pos);
        if (RESERVED.contains(text)) {
            throw fail(start, "reserved word '" + text + "' is not allowed");
        }
        if (text.startsWith("__")) {
            throw fail(start, "dunder names are not allowed");
        }
        TokenType keyword = KEYWORDS.get(text);
        return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, text, start);
    }

    private Token number(int start) {
        if (source.charAt(pos) == '-') {
            pos++;
        }
        boolean seenDot = false;
        boolean seenExponent = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !seenDot && !seenExponent) {
                seenDot = true;
                pos++;
            } else if ((c == 'e' || c == 'E') && !seenExponent) {
                seenExponent = true;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
            } else {
                break;
            }
        }
        String text = source.substring(start, pos);
        try {
            Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw fail(start, "malformed number '" + text + "'");
        }
        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw fail(pos, "malformed number '" + text + source.charAt(pos) + "'");
        }
        return new Token(TokenType.NUMBER, text, start);
    }

    private Token string(int start, char quote) {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                sb.append(source.charAt(pos + 1));
                pos += 2;
            } else if (c == quote) {
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw fail(start, "unterminated string literal");
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private RuleConditionException fail(int at, String message) {
        return new RuleConditionException(source, at, message);
    }
}
