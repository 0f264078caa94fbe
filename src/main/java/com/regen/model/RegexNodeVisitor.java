package com.regen.model;

/**
 * Visitor pattern interface for traversing a regular expression AST.
 */
public interface RegexNodeVisitor<R> {
    R visit(NoMatchNode noMatch);
    R visit(EmptyMatchNode emptyMatch);
    R visit(LiteralNode literal);
    R visit(CharClassNode charClass);
    R visit(AnyCharNode anyChar);
    R visit(AssertionNode assertion);
    R visit(RepeatNode repeat);
    R visit(ConcatNode concat);
    R visit(CaptureNode capture);
    R visit(AlternateNode alternate);
}
