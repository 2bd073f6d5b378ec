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

public final class IfStatement extends Statement {

  private final Expression condition;
  private final Statement trueBody;
  private final @Nullable Statement falseBody;

  public IfStatement(
      FileLocation pFileLocation,
      Expression pCondition,
      Statement pTrueBody,
      @Nullable Statement pFalseBody) {
    super(pFileLocation);
    condition = checkNotNull(pCondition);
    trueBody = checkNotNull(pTrueBody);
    falseBody = pFalseBody;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getTrueStatement() {
    return trueBody;
  }

  public Optional<Statement> getFalseStatement() {
    return Optional.ofNullable(falseBody);
  }

  @Override
  public String toASTString() {
    return "if ("
        + condition.toASTString()
        + ") "
        + trueBody.toASTString()
        + (falseBody == null ? "" : " else " + falseBody.toASTString());
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
