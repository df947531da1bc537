package com.spreadsheet.formula.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexer for formula bodies (the text after the leading "=").
 * Never fails: characters it doesn't recognize are skipped without a token.
 */
public final class Tokenizer {

    // One or more letters followed by one or more digits, e.g. "A1", "AB12"
    private static final Pattern CELL_PATTERN = Pattern.compile("^[A-Z]+[0-9]+$");

    private Tokenizer() {
    }

    /**
     * Splits the formula body into tokens, always ending with an EOF token.
     */
    public static List<Token> tokenize(String formula) {
        List<Token> tokens = new ArrayList<>();
        String src = formula == null ? "" : formula;
        int i = 0;

        while (i < src.length()) {
            char ch = src.charAt(i);

            if (ch == ' ' || ch == '\t') {
                i++;
                continue;
            }

            if (ch == '"') {
                i = readString(src, i + 1, tokens);
                continue;
            }

            if (isDigit(ch) || (ch == '.' && i + 1 < src.length() && isDigit(src.charAt(i + 1)))) {
                int start = i;
                while (i < src.length() && (isDigit(src.charAt(i)) || src.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, src.substring(start, i)));
                continue;
            }

            if (ch == '>' || ch == '<') {
                char next = i + 1 < src.length() ? src.charAt(i + 1) : '\0';
                if (next == '=') {
                    tokens.add(new Token(TokenType.COMPARISON, ch + "="));
                    i += 2;
                } else if (ch == '<' && next == '>') {
                    tokens.add(new Token(TokenType.COMPARISON, "<>"));
                    i += 2;
                } else {
                    tokens.add(new Token(TokenType.COMPARISON, String.valueOf(ch)));
                    i++;
                }
                continue;
            }

            // A bare "=" is always a comparison inside a formula body
            if (ch == '=') {
                tokens.add(new Token(TokenType.COMPARISON, "="));
                i++;
                continue;
            }

            if (ch == '&') {
                tokens.add(new Token(TokenType.CONCAT, "&"));
                i++;
                continue;
            }

            if (ch == '+' || ch == '-' || ch == '*' || ch == '/' || ch == '^') {
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(ch)));
                i++;
                continue;
            }

            TokenType punctuation = punctuationType(ch);
            if (punctuation != null) {
                tokens.add(new Token(punctuation, String.valueOf(ch)));
                i++;
                continue;
            }

            if (isLetter(ch) || ch == '_') {
                i = readIdentifier(src, i, tokens);
                continue;
            }

            // Unknown character, skip it
            i++;
        }

        tokens.add(Token.END);
        return tokens;
    }

    /**
     * Reads a quoted string starting just after the opening quote.
     * A backslash keeps the next character literally. Returns the index after the closing quote.
     */
    private static int readString(String src, int start, List<Token> tokens) {
        StringBuilder str = new StringBuilder();
        int i = start;
        while (i < src.length() && src.charAt(i) != '"') {
            if (src.charAt(i) == '\\' && i + 1 < src.length()) {
                i++;
            }
            str.append(src.charAt(i));
            i++;
        }
        if (i < src.length()) {
            i++;
        }
        tokens.add(new Token(TokenType.STRING, str.toString()));
        return i;
    }

    /**
     * Reads an identifier and classifies it as a range, a cell, a boolean or a function name.
     */
    private static int readIdentifier(String src, int start, List<Token> tokens) {
        int i = start;
        while (i < src.length() && (isLetter(src.charAt(i)) || isDigit(src.charAt(i)) || src.charAt(i) == '_')) {
            i++;
        }
        String upper = src.substring(start, i).toUpperCase(Locale.ROOT);
        boolean isCell = CELL_PATTERN.matcher(upper).matches();

        // "A1:B5" - look ahead once for a second cell after the colon
        if (isCell && i < src.length() && src.charAt(i) == ':') {
            int j = i + 1;
            while (j < src.length() && (isLetter(src.charAt(j)) || isDigit(src.charAt(j)))) {
                j++;
            }
            String second = src.substring(i + 1, j).toUpperCase(Locale.ROOT);
            if (CELL_PATTERN.matcher(second).matches()) {
                tokens.add(new Token(TokenType.RANGE_REF, upper + ":" + second));
                return j;
            }
        }

        if (isCell) {
            tokens.add(new Token(TokenType.CELL_REF, upper));
        } else if (upper.equals("TRUE")) {
            tokens.add(new Token(TokenType.NUMBER, "1"));
        } else if (upper.equals("FALSE")) {
            tokens.add(new Token(TokenType.NUMBER, "0"));
        } else {
            tokens.add(new Token(TokenType.FUNCTION, upper));
        }
        return i;
    }

    private static TokenType punctuationType(char ch) {
        switch (ch) {
            case '(':
                return TokenType.LPAREN;
            case ')':
                return TokenType.RPAREN;
            case ',':
                return TokenType.COMMA;
            case ':':
                return TokenType.COLON;
            default:
                return null;
        }
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }
}
