// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** Assignment expression, {@code lhs = rhs} or a compound form like {@code lhs += rhs}. */
public final class Assignment extends Expression {

  private final Expression leftHandSide;
  private final String operator;
  private final Expression rightHandSide;

  public Assignment(
      FileLocation pFileLocation,
      Expression pLeftHandSide,
      String pOperator,
      Expression pRightHandSide) {
    super(pFileLocation);
    leftHandSide = checkNotNull(pLeftHandSide);
    operator = checkNotNull(pOperator);
    rightHandSide = checkNotNull(pRightHandSide);
  }

  public Expression getLeftHandSide() {
    return leftHandSide;
  }

  public String getOperator() {
    return operator;
  }

  public Expression getRightHandSide() {
    return rightHandSide;
  }

  @Override
  public String toASTString() {
    return leftHandSide.toASTString() + " " + operator + " " + rightHandSide.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
