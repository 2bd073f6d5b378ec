// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

public final class EmitStatement extends Statement {

  private final FunctionCall eventCall;

  public EmitStatement(FileLocation pFileLocation, FunctionCall pEventCall) {
    super(pFileLocation);
    eventCall = checkNotNull(pEventCall);
  }

  public FunctionCall getEventCall() {
    return eventCall;
  }

  @Override
  public String toASTString() {
    return "emit " + eventCall.toASTString() + ";";
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
