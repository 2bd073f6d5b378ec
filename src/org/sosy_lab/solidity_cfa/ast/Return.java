// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

public final class Return extends Statement {

  private final @Nullable Expression expression;

  public Return(FileLocation pFileLocation, @Nullable Expression pExpression) {
    super(pFileLocation);
    expression = pExpression;
  }

  public Optional<Expression> getExpression() {
    return Optional.ofNullable(expression);
  }

  @Override
  public String toASTString() {
    return expression == null ? "return;" : "return " + expression.toASTString() + ";";
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
