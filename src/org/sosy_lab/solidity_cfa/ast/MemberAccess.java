// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

public final class MemberAccess extends Expression {

  private final Expression expression;
  private final String memberName;

  public MemberAccess(FileLocation pFileLocation, Expression pExpression, String pMemberName) {
    super(pFileLocation);
    expression = checkNotNull(pExpression);
    memberName = checkNotNull(pMemberName);
  }

  public Expression getExpression() {
    return expression;
  }

  public String getMemberName() {
    return memberName;
  }

  @Override
  public String toASTString() {
    return expression.toASTString() + "." + memberName;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
