package com.spreadsheet.formula.parser.ast;

/**
 * Base type of the formula syntax tree. Nodes are immutable;
 * transformations (e.g. reference translation) build new trees.
 */
public abstract class AstNode {

    public abstract <T> T accept(AstVisitor<T> visitor);
}
