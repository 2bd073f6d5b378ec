// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/** Named declaration: contracts, functions, modifiers and variables. */
public abstract class Declaration extends AstNode {

  private final String name;

  protected Declaration(FileLocation pFileLocation, String pName) {
    super(pFileLocation);
    name = checkNotNull(pName);
  }

  /** The declared name, empty for unnamed return parameters. */
  public String getName() {
    return name;
  }

  public abstract <R, X extends Exception> R accept(DeclarationVisitor<R, X> pVisitor) throws X;

  @Override
  public final <R, X extends Exception> R accept(AstNodeVisitor<R, X> pVisitor) throws X {
    return accept((DeclarationVisitor<R, X>) pVisitor);
  }
}
