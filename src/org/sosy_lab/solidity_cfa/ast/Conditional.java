// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** Ternary expression {@code condition ? trueExpression : falseExpression}. */
public final class Conditional extends Expression {

  private final Expression condition;
  private final Expression trueExpression;
  private final Expression falseExpression;

  public Conditional(
      FileLocation pFileLocation,
      Expression pCondition,
      Expression pTrueExpression,
      Expression pFalseExpression) {
    super(pFileLocation);
    condition = checkNotNull(pCondition);
    trueExpression = checkNotNull(pTrueExpression);
    falseExpression = checkNotNull(pFalseExpression);
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getTrueExpression() {
    return trueExpression;
  }

  public Expression getFalseExpression() {
    return falseExpression;
  }

  @Override
  public String toASTString() {
    return condition.toASTString()
        + " ? "
        + trueExpression.toASTString()
        + " : "
        + falseExpression.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
