package de.recon.diagnosis.rules.condition;

import de.recon.diagnosis.rules.RuleConditionException;

import java.util.List;

/**
 * Recursive-descent parser for rule conditions.
 *
 * <pre>
 * expr       := andExpr ('or' andExpr)*
 * andExpr    := notExpr ('and' notExpr)*
 * notExpr    := 'not' notExpr | primary
 * primary    := '(' expr ')' | comparison
 * comparison := IDENT ('==' | '!=') literal
 *             | IDENT 'is' ['not'] 'None'
 *             | IDENT
 * literal    := STRING | NUMBER | 'True' | 'False'
 * </pre>
 *
 * Nothing outside this grammar is accepted, so a condition can never call code.
 */
final class ConditionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    ConditionParser(String source) {
        if (source == null || source.isBlank()) {
            throw new RuleConditionException(String.valueOf(source), 0, "empty condition");
        }
        this.source = source;
        this.tokens = new ConditionLexer(source).tokenize();
    }

    Condition parse() {
        Condition condition = orExpr();
        Token trailing = current();
        if (!trailing.is(TokenType.EOF)) {
            throw fail(trailing, "unexpected '" + trailing.text() + "'");
        }
        return condition;
    }

    private Condition orExpr() {
        Condition left = andExpr();
        while (accept(TokenType.OR)) {
            left = new Conditions.Or(left, andExpr());
        }
        return left;
    }

    private Condition andExpr() {
        Condition left = notExpr();
        while (accept(TokenType.AND)) {
            left = new Conditions.And(left, notExpr());
        }
        return left;
    }

    private Condition notExpr() {
        if (accept(TokenType.NOT)) {
            return new Conditions.Not(notExpr());
        }
        return primary();
    }

    private Condition primary() {
        Token token = current();
        if (accept(TokenType.LPAREN)) {
            Condition inner = orExpr();
            expect(TokenType.RPAREN, "expected ')'");
            return inner;
        }
        if (!token.is(TokenType.IDENTIFIER)) {
            throw fail(token, "expected a field name but found '" + token.text() + "'");
        }
        index++;
        String field = token.text();

        Token next = current();
        if (next.is(TokenType.LPAREN)) {
            throw fail(next, "function calls are not allowed");
        }
        if (accept(TokenType.IS)) {
            boolean negated = accept(TokenType.NOT);
            expect(TokenType.NONE, "expected 'None' after 'is'");
            return new Conditions.NullCheck(field, !negated);
        }
        if (next.is(TokenType.EQ) || next.is(TokenType.NE)) {
            index++;
            Object literal = literal();
            return new Conditions.Compare(field, literal, next.is(TokenType.NE));
        }
        return new Conditions.Flag(field);
    }

    private Object literal() {
        Token token = current();
        index++;
        return switch (token.type()) {
            case STRING -> token.text();
            case NUMBER -> Double.parseDouble(token.text());
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case NONE -> throw fail(token, "compare against None with 'is None' or 'is not None'");
            case IDENTIFIER -> throw fail(token, "comparing two fields is not allowed");
            default -> throw fail(token, "expected a literal but found '" + token.text() + "'");
        };
    }

    private Token current() {
        return tokens.get(index);
    }

    private boolean accept(TokenType type) {
        if (current().is(type)) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String message) {
        Token token = current();
        if (!accept(type)) {
            throw fail(token, message);
        }
    }

    private RuleConditionException fail(Token at, String message) {
        return new RuleConditionException(source, at.position(), message);
    }
}
