package com.spreadsheet.formula.engine;

import java.util.Objects;

/**
 * One lexical unit of a formula: its type and the text it was built from.
 * Cell and range references and function names are stored uppercased.
 */
public final class Token {

    public static final Token END = new Token(TokenType.EOF, "");

    private final TokenType type;
    private final String text;

    public Token(TokenType type, String text) {
        this.type = type;
        this.text = text;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token other = (Token) o;
        return type == other.type && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
