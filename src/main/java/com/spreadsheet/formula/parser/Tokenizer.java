package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.models.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans formula text (without the leading "=") into tokens.
 * <p>
 * The result always ends with either EOF or a single ERROR token that carries the
 * offending character and its offset; tokenizing never throws. A "-" is always an
 * OPERATOR, so "-5" becomes OPERATOR NUMBER and the parser decides whether the minus
 * is unary or binary.
 */
public class Tokenizer {

    private static final Pattern CELL_REF_PATTERN = Pattern.compile("^(\\$?)([A-Z]+)(\\$?)([0-9]+)$");
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Z_][A-Z0-9_]*$");

    private final String input;
    private int position;

    public Tokenizer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * Tokenizes the whole input. Calling it again restarts from the beginning.
     */
    public List<Token> tokenize() {
        position = 0;
        List<Token> tokens = new ArrayList<>();
        while (position < input.length()) {
            char c = input.charAt(position);

            if (Character.isWhitespace(c)) {
                position++;
                continue;
            }

            Token token;
            if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
                token = readNumber();
            } else if (c == '"' || c == '\'') {
                token = readString(c);
            } else if (isLetter(c) || c == '$' || c == '_') {
                token = readWord();
            } else if (c == '#') {
                token = readErrorLiteral();
            } else if (isOperatorStart(c)) {
                token = readOperator();
            } else if (c == '(') {
                token = single(TokenKind.LPAREN);
            } else if (c == ')') {
                token = single(TokenKind.RPAREN);
            } else if (c == ',') {
                token = single(TokenKind.COMMA);
            } else if (c == ':') {
                token = single(TokenKind.COLON);
            } else {
                token = new Token(TokenKind.ERROR, String.valueOf(c), position);
            }

            tokens.add(token);
            if (token.getKind() == TokenKind.ERROR) {
                return Collections.unmodifiableList(tokens);
            }
        }
        tokens.add(new Token(TokenKind.EOF, "", input.length()));
        return Collections.unmodifiableList(tokens);
    }

    // --- Readers ---

    private Token single(TokenKind kind) {
        Token token = new Token(kind, String.valueOf(input.charAt(position)), position);
        position++;
        return token;
    }

    private Token readNumber() {
        int start = position;
        while (isDigit(peek(0))) {
            position++;
        }
        if (peek(0) == '.') {
            position++;
            while (isDigit(peek(0))) {
                position++;
            }
        }
        // exponent only when a digit actually follows, so "2E" stays an error downstream
        char e = peek(0);
        if (e == 'e' || e == 'E') {
            int sign = (peek(1) == '+' || peek(1) == '-') ? 1 : 0;
            if (isDigit(peek(1 + sign))) {
                position += 1 + sign;
                while (isDigit(peek(0))) {
                    position++;
                }
            }
        }
        return new Token(TokenKind.NUMBER, input.substring(start, position), start);
    }

    private Token readString(char quote) {
        int start = position;
        position++;
        StringBuilder value = new StringBuilder();
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == quote) {
                position++;
                return new Token(TokenKind.STRING, value.toString(), start);
            }
            if (c == '\\' && position + 1 < input.length()) {
                position++;
                value.append(input.charAt(position));
            } else {
                value.append(c);
            }
            position++;
        }
        // unterminated: report the opening quote
        return new Token(TokenKind.ERROR, String.valueOf(quote), start);
    }

    private Token readWord() {
        int start = position;
        String word = scanWord();
        String upper = word.toUpperCase();

        if (upper.equals("TRUE") || upper.equals("FALSE")) {
            return new Token(TokenKind.BOOLEAN, upper, start);
        }

        Matcher cell = CELL_REF_PATTERN.matcher(upper);
        if (cell.matches() && nextNonSpace() != '(') {
            Token.RefParts first = toParts(cell);
            if (peek(0) == ':') {
                int colon = position;
                position++;
                String second = scanWord().toUpperCase();
                Matcher end = CELL_REF_PATTERN.matcher(second);
                if (end.matches()) {
                    return new Token(TokenKind.RANGE_REF, input.substring(start, position).toUpperCase(),
                            start, first, toParts(end));
                }
                // not a range after all; let the colon be its own token
                position = colon;
            }
            return new Token(TokenKind.CELL_REF, upper, start, first, null);
        }

        if (IDENTIFIER_PATTERN.matcher(upper).matches()) {
            return new Token(TokenKind.IDENTIFIER, upper, start);
        }

        // e.g. "A$" or "$FOO"
        return new Token(TokenKind.ERROR, String.valueOf(input.charAt(start)), start);
    }

    private Token readErrorLiteral() {
        for (ErrorKind kind : ErrorKind.values()) {
            String token = kind.getToken();
            if (input.regionMatches(true, position, token, 0, token.length())) {
                Token result = new Token(TokenKind.ERROR_LITERAL, token, position);
                position += token.length();
                return result;
            }
        }
        return new Token(TokenKind.ERROR, "#", position);
    }

    private Token readOperator() {
        int start = position;
        char c = input.charAt(position);
        char next = peek(1);

        if ((c == '<' && next == '>') || (c == '!' && next == '=')) {
            // "!=" is accepted as an alias of "<>"
            position += 2;
            return new Token(TokenKind.OPERATOR, "<>", start);
        }
        if ((c == '<' || c == '>') && next == '=') {
            position += 2;
            return new Token(TokenKind.OPERATOR, "" + c + next, start);
        }
        if (c == '!') {
            return new Token(TokenKind.ERROR, "!", start);
        }
        position++;
        return new Token(TokenKind.OPERATOR, String.valueOf(c), start);
    }

    // --- Helpers ---

    private String scanWord() {
        int start = position;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (isLetter(c) || isDigit(c) || c == '_' || c == '$') {
                position++;
            } else {
                break;
            }
        }
        return input.substring(start, position);
    }

    private static Token.RefParts toParts(Matcher m) {
        return new Token.RefParts(m.group(2), m.group(4), !m.group(1).isEmpty(), !m.group(3).isEmpty());
    }

    private char nextNonSpace() {
        int i = position;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private char peek(int offset) {
        int i = position + offset;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isOperatorStart(char c) {
        return "+-*/^&=<>!".indexOf(c) >= 0;
    }
}
