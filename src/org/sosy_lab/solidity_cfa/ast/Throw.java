// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

/** Legacy {@code throw;} statement, equivalent to {@code revert();}. */
public final class Throw extends Statement {

  public Throw(FileLocation pFileLocation) {
    super(pFileLocation);
  }

  @Override
  public String toASTString() {
    return "throw;";
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
