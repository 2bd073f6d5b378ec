// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** Reference to a named entity, e.g. a local variable or a function. */
public final class Identifier extends Expression {

  private final String name;

  public Identifier(FileLocation pFileLocation, String pName) {
    super(pFileLocation);
    name = checkNotNull(pName);
  }

  public String getName() {
    return name;
  }

  @Override
  public String toASTString() {
    return name;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
