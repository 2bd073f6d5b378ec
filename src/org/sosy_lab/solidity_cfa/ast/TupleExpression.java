// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Parenthesized tuple or inline array literal. */
public final class TupleExpression extends Expression {

  private final ImmutableList<Expression> components;
  private final boolean inlineArray;

  public TupleExpression(
      FileLocation pFileLocation, List<? extends Expression> pComponents, boolean pInlineArray) {
    super(pFileLocation);
    components = ImmutableList.copyOf(pComponents);
    inlineArray = pInlineArray;
  }

  public ImmutableList<Expression> getComponents() {
    return components;
  }

  public boolean isInlineArray() {
    return inlineArray;
  }

  @Override
  public String toASTString() {
    String inner =
        FluentIterable.from(components).transform(Expression::toASTString).join(Joiner.on(", "));
    return inlineArray ? "[" + inner + "]" : "(" + inner + ")";
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
