package io.flowcheck.core.parse;

/// Lexical token of the condition language.
///
/// @param type token class
/// @param text source text of the token (unquoted for strings)
/// @param position zero-based offset of the first character
record Token(Type type, String text, int position) {

    enum Type {
        NUMBER,
        STRING,
        IDENTIFIER,
        KEYWORD,
        SYMBOL,
        END
    }

    boolean is(Type expected, String value) {
        return type == expected && text.equals(value);
    }

    boolean isSymbol(String value) {
        return is(Type.SYMBOL, value);
    }

    boolean isKeyword(String value) {
        return is(Type.KEYWORD, value);
    }
}
