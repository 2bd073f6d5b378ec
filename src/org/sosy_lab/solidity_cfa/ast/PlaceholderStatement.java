// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

/** The {@code _;} marker inside a modifier body where the modified function is executed. */
public final class PlaceholderStatement extends Statement {

  public PlaceholderStatement(FileLocation pFileLocation) {
    super(pFileLocation);
  }

  @Override
  public String toASTString() {
    return "_;";
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
