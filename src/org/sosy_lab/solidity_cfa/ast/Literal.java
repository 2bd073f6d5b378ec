// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** Number, string, boolean or address literal, kept in its source spelling. */
public final class Literal extends Expression {

  private final String value;

  public Literal(FileLocation pFileLocation, String pValue) {
    super(pFileLocation);
    value = checkNotNull(pValue);
  }

  public String getValue() {
    return value;
  }

  @Override
  public String toASTString() {
    return value;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
