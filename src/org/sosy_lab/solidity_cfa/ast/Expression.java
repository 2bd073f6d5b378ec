// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

/** Base class for all expression nodes in the AST. */
public abstract class Expression extends AstNode {

  protected Expression(FileLocation pFileLocation) {
    super(pFileLocation);
  }

  public abstract <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X;

  @Override
  public final <R, X extends Exception> R accept(AstNodeVisitor<R, X> pVisitor) throws X {
    return accept((ExpressionVisitor<R, X>) pVisitor);
  }
}
