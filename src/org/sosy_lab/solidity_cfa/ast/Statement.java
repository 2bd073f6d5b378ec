// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

/** Base class for all statement nodes in the AST. */
public abstract class Statement extends AstNode {

  protected Statement(FileLocation pFileLocation) {
    super(pFileLocation);
  }

  public abstract <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X;

  @Override
  public final <R, X extends Exception> R accept(AstNodeVisitor<R, X> pVisitor) throws X {
    return accept((StatementVisitor<R, X>) pVisitor);
  }
}
