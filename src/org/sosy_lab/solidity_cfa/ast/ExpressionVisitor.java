// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

/**
 * Visitor over all expression kinds. Adding an expression kind adds a method here, so every
 * visitor has to decide how to handle it.
 *
 * @param <R> return type of the visit methods
 * @param <X> exception the visit methods may throw
 */
public interface ExpressionVisitor<R, X extends Exception> {

  R visit(Identifier pIdentifier) throws X;

  R visit(Literal pLiteral) throws X;

  R visit(UnaryOperation pOperation) throws X;

  R visit(BinaryOperation pOperation) throws X;

  R visit(Assignment pAssignment) throws X;

  R visit(Conditional pConditional) throws X;

  R visit(FunctionCall pCall) throws X;

  R visit(MemberAccess pAccess) throws X;

  R visit(IndexAccess pAccess) throws X;

  R visit(TupleExpression pTuple) throws X;
}
