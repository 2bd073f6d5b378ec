// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

public final class ExpressionStatement extends Statement {

  private final Expression expression;

  public ExpressionStatement(FileLocation pFileLocation, Expression pExpression) {
    super(pFileLocation);
    expression = checkNotNull(pExpression);
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  public String toASTString() {
    return expression.toASTString() + ";";
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
