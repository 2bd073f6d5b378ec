// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

public final class UnaryOperation extends Expression {

  public enum UnaryOperator {
    NOT("!"),
    MINUS("-"),
    BITWISE_NOT("~"),
    INCREMENT("++"),
    DECREMENT("--"),
    DELETE("delete ");

    private final String op;

    UnaryOperator(String pOp) {
      op = pOp;
    }

    public String getOperator() {
      return op;
    }
  }

  private final UnaryOperator operator;
  private final Expression operand;
  private final boolean prefix;

  public UnaryOperation(
      FileLocation pFileLocation, UnaryOperator pOperator, Expression pOperand, boolean pPrefix) {
    super(pFileLocation);
    operator = checkNotNull(pOperator);
    operand = checkNotNull(pOperand);
    prefix = pPrefix;
  }

  public UnaryOperator getOperator() {
    return operator;
  }

  public Expression getSubExpression() {
    return operand;
  }

  public boolean isPrefixOperation() {
    return prefix;
  }

  @Override
  public String toASTString() {
    return prefix
        ? operator.getOperator() + operand.toASTString()
        : operand.toASTString() + operator.getOperator();
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
