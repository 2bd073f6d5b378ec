// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

public final class BinaryOperation extends Expression {

  public enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    EXP("**"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    LESS_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_EQUAL(">="),
    AND("&&"),
    OR("||"),
    BITWISE_AND("&"),
    BITWISE_OR("|"),
    BITWISE_XOR("^"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>");

    private final String op;

    BinaryOperator(String pOp) {
      op = pOp;
    }

    public String getOperator() {
      return op;
    }

    /** Whether the right operand is only evaluated depending on the value of the left one. */
    public boolean isShortCircuit() {
      return this == AND || this == OR;
    }
  }

  private final Expression leftExpression;
  private final Expression rightExpression;
  private final BinaryOperator operator;

  public BinaryOperation(
      FileLocation pFileLocation,
      Expression pLeftExpression,
      BinaryOperator pOperator,
      Expression pRightExpression) {
    super(pFileLocation);
    leftExpression = checkNotNull(pLeftExpression);
    operator = checkNotNull(pOperator);
    rightExpression = checkNotNull(pRightExpression);
  }

  public Expression getLeftExpression() {
    return leftExpression;
  }

  public Expression getRightExpression() {
    return rightExpression;
  }

  public BinaryOperator getOperator() {
    return operator;
  }

  @Override
  public String toASTString() {
    return leftExpression.toASTString()
        + " "
        + operator.getOperator()
        + " "
        + rightExpression.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
