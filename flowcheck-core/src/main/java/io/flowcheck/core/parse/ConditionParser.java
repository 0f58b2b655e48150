package io.flowcheck.core.parse;

import io.flowcheck.core.exception.ConditionParseException;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.Call;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Lookup;
import io.flowcheck.core.expr.Op;
import io.flowcheck.core.expr.Tag;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Recursive-descent parser for questionnaire transition conditions.
///
/// ### Grammar (loosest binding first)
/// ```
/// or         := and ('or' and)*
/// and        := relation ('and' relation)*
/// relation   := additive (('gt'|'ge'|'lt'|'le'|'=='|'!=') additive)*
/// additive   := term (('+'|'-') term)*
/// term       := unary (('*'|'/') unary)*
/// unary      := ('-'|'+'|'!') unary | primary
/// primary    := number | 'true' | 'false' | 'string' | path ['(' args ')'] | '(' or ')'
/// path       := identifier ('.' identifier)*
/// ```
///
/// A chain of one operator becomes a single n-ary node (`a and b and c`); mixed chains
/// associate to the left. Identifiers become {@link Lookup}s and calls {@link Call}s;
/// resolution against a scope happens in a later pass.
///
/// Stateless; one instance may parse concurrently.
public final class ConditionParser {

    private static final Map<String, Tag> RELATIONS = Map.of(
            "gt", Tag.GT, "ge", Tag.GE, "lt", Tag.LT, "le", Tag.LE, "==", Tag.EQ, "!=", Tag.NE);

    private static final Map<String, Tag> UNARY = Map.of("-", Tag.NEG, "+", Tag.POS, "!", Tag.NOT);

    /// Parses condition text.
    ///
    /// @param text condition, not null
    /// @return unresolved expression tree, never null
    /// @throws ConditionParseException if the text is not a valid condition
    public Expr parse(String text) {
        return new Parser(new Lexer(text).tokenize()).parseAll();
    }

    private static final class Parser {

        private final List<Token> tokens;
        private int index;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expr parseAll() {
            Expr expr = or();
            if (peek().type() != Token.Type.END) {
                throw error("Unexpected '" + peek().text() + "'");
            }
            return expr;
        }

        private Expr or() {
            return chain(this::and, Set.of("or"), Token.Type.KEYWORD);
        }

        private Expr and() {
            return chain(this::relation, Set.of("and"), Token.Type.KEYWORD);
        }

        private Expr relation() {
            Expr left = additive();
            while ((peek().type() == Token.Type.KEYWORD || peek().type() == Token.Type.SYMBOL)
                    && RELATIONS.containsKey(peek().text())) {
                Tag tag = RELATIONS.get(advance().text());
                left = Op.of(tag, left, additive());
            }
            return left;
        }

        private Expr additive() {
            return chain(this::term, Set.of("+", "-"), Token.Type.SYMBOL);
        }

        private Expr term() {
            return chain(this::unary, Set.of("*", "/"), Token.Type.SYMBOL);
        }

        private interface Level {
            Expr parse();
        }

        // same-operator runs become one n-ary node, operator changes nest to the left
        private Expr chain(Level next, Set<String> operators, Token.Type type) {
            Expr first = next.parse();
            String current = null;
            List<Expr> operands = new ArrayList<>(List.of(first));
            while (peek().type() == type && operators.contains(peek().text())) {
                String operator = advance().text();
                if (current != null && !current.equals(operator)) {
                    operands = new ArrayList<>(List.of(build(current, operands)));
                }
                current = operator;
                operands.add(next.parse());
            }
            return current == null ? first : build(current, operands);
        }

        private Expr build(String operator, List<Expr> operands) {
            Tag tag = switch (operator) {
                case "or" -> Tag.OR;
                case "and" -> Tag.AND;
                case "+" -> Tag.ADD;
                case "-" -> Tag.SUB;
                case "*" -> Tag.MUL;
                case "/" -> Tag.DIV;
                default -> throw new IllegalStateException("Unknown operator " + operator);
            };
            return new Op(tag, operands);
        }

        private Expr unary() {
            Token token = peek();
            if (token.type() == Token.Type.SYMBOL && UNARY.containsKey(token.text())) {
                advance();
                return Op.of(UNARY.get(token.text()), unary());
            }
            return primary();
        }

        private Expr primary() {
            Token token = advance();
            switch (token.type()) {
                case NUMBER:
                    return number(token);
                case STRING:
                    return Atom.of(token.text());
                case KEYWORD:
                    if (token.text().equals("true") || token.text().equals("false")) {
                        return Atom.of(Boolean.parseBoolean(token.text()));
                    }
                    throw errorAt(token, "Unexpected keyword '" + token.text() + "'");
                case IDENTIFIER:
                    return pathOrCall(token);
                case SYMBOL:
                    if (token.isSymbol("(")) {
                        Expr inner = or();
                        expect(")");
                        return inner;
                    }
                    throw errorAt(token, "Unexpected '" + token.text() + "'");
                default:
                    throw errorAt(token, "Unexpected end of condition");
            }
        }

        private Expr pathOrCall(Token first) {
            List<String> path = new ArrayList<>();
            path.add(first.text());
            while (peek().isSymbol(".")) {
                advance();
                Token segment = advance();
                if (segment.type() != Token.Type.IDENTIFIER) {
                    throw errorAt(segment, "Expected identifier after '.'");
                }
                path.add(segment.text());
            }
            Lookup lookup = new Lookup(path);
            if (!peek().isSymbol("(")) {
                return lookup;
            }
            advance();
            List<Expr> args = new ArrayList<>();
            if (!peek().isSymbol(")")) {
                args.add(or());
                while (peek().isSymbol(",")) {
                    advance();
                    args.add(or());
                }
            }
            expect(")");
            return new Call(lookup, args);
        }

        private Expr number(Token token) {
            String text = token.text();
            try {
                if (text.contains(".") || text.contains("e") || text.contains("E")) {
                    return Atom.of(Double.parseDouble(text));
                }
                return Atom.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw errorAt(token, "Invalid number '" + text + "'");
            }
        }

        private void expect(String symbol) {
            Token token = advance();
            if (!token.isSymbol(symbol)) {
                throw errorAt(token, "Expected '" + symbol + "' but found '" + token.text() + "'");
            }
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (token.type() != Token.Type.END) {
                index++;
            }
            return token;
        }

        private ConditionParseException error(String message) {
            return errorAt(peek(), message);
        }

        private static ConditionParseException errorAt(Token token, String message) {
            return new ConditionParseException(message, token.position());
        }
    }
}
