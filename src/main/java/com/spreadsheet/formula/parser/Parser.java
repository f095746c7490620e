package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.parser.ast.AstNode;
import com.spreadsheet.formula.parser.ast.BinaryOp;
import com.spreadsheet.formula.parser.ast.CellReference;
import com.spreadsheet.formula.parser.ast.FunctionCall;
import com.spreadsheet.formula.parser.ast.Group;
import com.spreadsheet.formula.parser.ast.Literal;
import com.spreadsheet.formula.parser.ast.Operator;
import com.spreadsheet.formula.parser.ast.ParseFailure;
import com.spreadsheet.formula.parser.ast.RangeReference;
import com.spreadsheet.formula.parser.ast.UnaryOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser turning tokens into an AST.
 * <p>
 * Precedence, loosest first: comparison, concatenation (&amp;), addition/subtraction,
 * multiplication/division, power (^), unary +/-, primary. All binary levels are
 * left-associative. Malformed input never throws: {@link #parse()} returns a
 * {@link ParseFailure} root instead.
 */
public class Parser {

    /** Deepest allowed nesting of parentheses, function calls and unary signs. */
    public static final int MAX_NESTING = 100;

    private final List<Token> tokens;
    private int position;
    private int nesting;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Tokenizes and parses formula text. A leading "=" is stripped if present.
     */
    public static AstNode parseFormula(String formula) {
        String body = formula.startsWith("=") ? formula.substring(1) : formula;
        return new Parser(new Tokenizer(body).tokenize()).parse();
    }

    public AstNode parse() {
        position = 0;
        nesting = 0;
        try {
            if (check(TokenKind.EOF)) {
                return Literal.of(FormulaValue.string(""));
            }
            AstNode ast = parseExpression();
            if (!check(TokenKind.EOF)) {
                throw error("Unexpected " + describe(peek()) + " after end of expression");
            }
            return ast;
        } catch (SyntaxException e) {
            return new ParseFailure(e.getMessage(), e.position);
        }
    }

    // --- Grammar, lowest precedence first ---

    private AstNode parseExpression() {
        return parseComparison();
    }

    private AstNode parseComparison() {
        AstNode left = parseConcatenation();
        while (checkOperator("=", "<>", "<", "<=", ">", ">=")) {
            Operator op = operator(advance());
            left = new BinaryOp(op, left, parseConcatenation());
        }
        return left;
    }

    private AstNode parseConcatenation() {
        AstNode left = parseAddition();
        while (checkOperator("&")) {
            Operator op = operator(advance());
            left = new BinaryOp(op, left, parseAddition());
        }
        return left;
    }

    private AstNode parseAddition() {
        AstNode left = parseMultiplication();
        while (checkOperator("+", "-")) {
            Operator op = operator(advance());
            left = new BinaryOp(op, left, parseMultiplication());
        }
        return left;
    }

    private AstNode parseMultiplication() {
        AstNode left = parsePower();
        while (checkOperator("*", "/")) {
            Operator op = operator(advance());
            left = new BinaryOp(op, left, parsePower());
        }
        return left;
    }

    private AstNode parsePower() {
        AstNode left = parseUnary();
        while (checkOperator("^")) {
            Operator op = operator(advance());
            left = new BinaryOp(op, left, parseUnary());
        }
        return left;
    }

    private AstNode parseUnary() {
        if (checkOperator("+", "-")) {
            Operator op = operator(advance());
            enterNesting();
            AstNode operand = parseUnary();
            nesting--;
            return new UnaryOp(op, operand);
        }
        return parsePrimary();
    }

    private AstNode parsePrimary() {
        Token token = peek();
        switch (token.getKind()) {
            case NUMBER:
                advance();
                return new Literal(FormulaValue.number(Double.parseDouble(token.getText())), token.getText());
            case STRING:
                advance();
                return Literal.of(FormulaValue.string(token.getText()));
            case BOOLEAN:
                advance();
                return Literal.of(FormulaValue.bool("TRUE".equals(token.getText())));
            case ERROR_LITERAL:
                advance();
                return Literal.error(ErrorKind.fromToken(token.getText()).orElse(ErrorKind.PARSE));
            case RANGE_REF:
                advance();
                return new RangeReference(toReference(token.getReference()), toReference(token.getRangeEnd()));
            case CELL_REF:
                advance();
                if (check(TokenKind.COLON)) {
                    advance();
                    Token end = peek();
                    if (end.getKind() != TokenKind.CELL_REF) {
                        throw error("Expected cell reference after ':' but found " + describe(end));
                    }
                    advance();
                    return new RangeReference(toReference(token.getReference()), toReference(end.getReference()));
                }
                return toReference(token.getReference());
            case IDENTIFIER:
                advance();
                if (!check(TokenKind.LPAREN)) {
                    throw error("Unknown name " + token.getText(), token);
                }
                advance();
                enterNesting();
                List<AstNode> args = parseArguments();
                expect(TokenKind.RPAREN, "Expected ')' after arguments of " + token.getText());
                nesting--;
                return new FunctionCall(token.getText(), args);
            case LPAREN:
                advance();
                enterNesting();
                AstNode inner = parseExpression();
                expect(TokenKind.RPAREN, "Expected ')' to close parenthesis");
                nesting--;
                return new Group(inner);
            case ERROR:
                throw error("Unexpected character '" + token.getText() + "'", token);
            case EOF:
                throw error("Unexpected end of formula, an operand is missing", token);
            default:
                throw error("Unexpected " + describe(token), token);
        }
    }

    private List<AstNode> parseArguments() {
        List<AstNode> args = new ArrayList<>();
        if (check(TokenKind.RPAREN)) {
            return args;
        }
        args.add(parseExpression());
        while (check(TokenKind.COMMA)) {
            advance();
            args.add(parseExpression());
        }
        return args;
    }

    // --- Utility methods ---

    private void enterNesting() {
        if (++nesting > MAX_NESTING) {
            throw error("Formula is nested deeper than " + MAX_NESTING + " levels");
        }
    }

    static CellReference toReference(Token.RefParts parts) {
        return new CellReference(
                CellAddress.columnIndex(parts.getColumnLetters()),
                CellAddress.parseRow(parts.getRowDigits()),
                parts.isColumnAbsolute(),
                parts.isRowAbsolute());
    }

    private static Operator operator(Token token) {
        return Operator.fromSymbol(token.getText())
                .orElseThrow(() -> new SyntaxException("Unknown operator " + token.getText(), token.getPosition()));
    }

    private boolean checkOperator(String... symbols) {
        Token token = peek();
        if (token.getKind() != TokenKind.OPERATOR) {
            return false;
        }
        for (String symbol : symbols) {
            if (token.getText().equals(symbol)) {
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenKind kind) {
        return peek().getKind() == kind;
    }

    private void expect(TokenKind kind, String message) {
        if (!check(kind)) {
            throw error(message);
        }
        advance();
    }

    private Token peek() {
        return tokens.get(Math.min(position, tokens.size() - 1));
    }

    private Token advance() {
        Token token = peek();
        // never step past the terminal EOF/ERROR token
        if (position < tokens.size() - 1) {
            position++;
        }
        return token;
    }

    private SyntaxException error(String message) {
        return error(message, peek());
    }

    private SyntaxException error(String message, Token at) {
        return new SyntaxException(message, at.getPosition());
    }

    private static String describe(Token token) {
        if (token.getKind() == TokenKind.EOF) {
            return "end of formula";
        }
        return "'" + token.getText() + "'";
    }

    private static class SyntaxException extends RuntimeException {
        private final int position;

        SyntaxException(String message, int position) {
            super(message);
            this.position = position;
        }
    }
}
