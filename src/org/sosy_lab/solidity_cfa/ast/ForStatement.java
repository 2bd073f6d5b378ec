// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** {@code for (init; condition; loopExpression) body}, each of the three parts is optional. */
public final class ForStatement extends Statement {

  private final @Nullable Statement initializationExpression;
  private final @Nullable Expression condition;
  private final @Nullable ExpressionStatement loopExpression;
  private final Statement body;

  public ForStatement(
      FileLocation pFileLocation,
      @Nullable Statement pInitializationExpression,
      @Nullable Expression pCondition,
      @Nullable ExpressionStatement pLoopExpression,
      Statement pBody) {
    super(pFileLocation);
    initializationExpression = pInitializationExpression;
    condition = pCondition;
    loopExpression = pLoopExpression;
    body = checkNotNull(pBody);
  }

  public Optional<Statement> getInitializationExpression() {
    return Optional.ofNullable(initializationExpression);
  }

  public Optional<Expression> getCondition() {
    return Optional.ofNullable(condition);
  }

  public Optional<ExpressionStatement> getLoopExpression() {
    return Optional.ofNullable(loopExpression);
  }

  public Statement getBody() {
    return body;
  }

  @Override
  public String toASTString() {
    return "for ("
        + (initializationExpression == null ? ";" : initializationExpression.toASTString())
        + " "
        + (condition == null ? "" : condition.toASTString())
        + "; "
        + (loopExpression == null ? "" : loopExpression.getExpression().toASTString())
        + ") "
        + body.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
