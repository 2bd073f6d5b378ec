// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** An {@code assembly { ... }} block. Its body is kept as opaque source text. */
public final class InlineAssembly extends Statement {

  private final String code;

  public InlineAssembly(FileLocation pFileLocation, String pCode) {
    super(pFileLocation);
    code = checkNotNull(pCode);
  }

  public String getCode() {
    return code;
  }

  @Override
  public String toASTString() {
    return "assembly { " + code + " }";
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
