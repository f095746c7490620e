package com.spreadsheet.formula.parser.ast;

public interface AstVisitor<T> {

    T visitLiteral(Literal node);

    T visitCellReference(CellReference node);

    T visitRangeReference(RangeReference node);

    T visitUnaryOp(UnaryOp node);

    T visitBinaryOp(BinaryOp node);

    T visitFunctionCall(FunctionCall node);

    T visitGroup(Group node);

    T visitParseFailure(ParseFailure node);
}
