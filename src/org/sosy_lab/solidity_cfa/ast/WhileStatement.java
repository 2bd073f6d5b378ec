// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** {@code while} loop, or a {@code do ... while} loop if {@link #isDoWhile()} is set. */
public final class WhileStatement extends Statement {

  private final Expression condition;
  private final Statement body;
  private final boolean doWhile;

  public WhileStatement(
      FileLocation pFileLocation, Expression pCondition, Statement pBody, boolean pDoWhile) {
    super(pFileLocation);
    condition = checkNotNull(pCondition);
    body = checkNotNull(pBody);
    doWhile = pDoWhile;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getBody() {
    return body;
  }

  public boolean isDoWhile() {
    return doWhile;
  }

  @Override
  public String toASTString() {
    if (doWhile) {
      return "do " + body.toASTString() + " while (" + condition.toASTString() + ");";
    }
    return "while (" + condition.toASTString() + ") " + body.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
