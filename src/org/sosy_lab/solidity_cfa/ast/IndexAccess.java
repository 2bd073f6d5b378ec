// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Index access {@code base[index]}; the index is missing in type expressions like {@code T[]}. */
public final class IndexAccess extends Expression {

  private final Expression baseExpression;
  private final @Nullable Expression indexExpression;

  public IndexAccess(
      FileLocation pFileLocation, Expression pBaseExpression, @Nullable Expression pIndex) {
    super(pFileLocation);
    baseExpression = checkNotNull(pBaseExpression);
    indexExpression = pIndex;
  }

  public Expression getBaseExpression() {
    return baseExpression;
  }

  public Optional<Expression> getIndexExpression() {
    return Optional.ofNullable(indexExpression);
  }

  @Override
  public String toASTString() {
    return baseExpression.toASTString()
        + "["
        + (indexExpression == null ? "" : indexExpression.toASTString())
        + "]";
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
