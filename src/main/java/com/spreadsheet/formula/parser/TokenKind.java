package com.spreadsheet.formula.parser;

/**
 * Lexical categories produced by the Tokenizer.
 */
public enum TokenKind {
    NUMBER,
    STRING,
    BOOLEAN,
    CELL_REF,
    RANGE_REF,
    // candidate function name; validity is only checked at evaluation
    IDENTIFIER,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    // a written error value such as #REF!
    ERROR_LITERAL,
    EOF,
    // unrecognized input; always the last token
    ERROR
}
