package io.flowcheck.core.parse;

import io.flowcheck.core.exception.ConditionParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Splits condition text into tokens.
final class Lexer {

    static final Set<String> KEYWORDS = Set.of("true", "false", "gt", "ge", "lt", "le", "and", "or");

    private final String text;
    private int pos;

    Lexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(Token.Type.END, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = text.charAt(pos);
        int start = pos;
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < text.length()
                    && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            String word = text.substring(start, pos);
            return new Token(KEYWORDS.contains(word) ? Token.Type.KEYWORD : Token.Type.IDENTIFIER, word, start);
        }
        if (c == '\'') {
            return string(start);
        }
        if ((c == '=' || c == '!') && pos + 1 < text.length() && text.charAt(pos + 1) == '=') {
            pos += 2;
            return new Token(Token.Type.SYMBOL, text.substring(start, pos), start);
        }
        if ("()+-*/!,.".indexOf(c) >= 0) {
            pos++;
            return new Token(Token.Type.SYMBOL, String.valueOf(c), start);
        }
        throw new ConditionParseException("Unexpected character '" + c + "'", start);
    }

    private Token number(int start) {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < text.length() && text.charAt(pos) == '.' && Character.isDigit(text.charAt(pos + 1))) {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        return new Token(Token.Type.NUMBER, text.substring(start, pos), start);
    }

    private Token string(int start) {
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '\\' && pos < text.length()) {
                sb.append(text.charAt(pos++));
            } else if (c == '\'') {
                return new Token(Token.Type.STRING, sb.toString(), start);
            } else {
                sb.append(c);
            }
        }
        throw new ConditionParseException("Unterminated string literal", start);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
