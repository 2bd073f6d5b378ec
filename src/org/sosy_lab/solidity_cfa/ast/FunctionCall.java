// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Call of a function, event, contract constructor or builtin. The resolved kind of the callee is
 * determined by name resolution and stored as {@link CallKind}.
 */
public final class FunctionCall extends Expression {

  public enum CallKind {
    /** Call of a function of the same contract or one of its bases. */
    INTERNAL,
    /** High-level call of a function of another contract, reverts if the callee fails. */
    EXTERNAL,
    /** Low-level {@code call}, {@code delegatecall} or {@code send}, returns failure as a value. */
    BARE_CALL,
    /** Contract creation with {@code new}. */
    CREATION,
    /** Ether transfer with {@code transfer}. */
    TRANSFER,
    ASSERT,
    REQUIRE,
    /** {@code revert(...)}, never returns. */
    REVERT,
    /** Event invocation inside an {@code emit} statement. */
    EVENT,
    /** Explicit type conversion like {@code uint8(x)}. */
    TYPE_CONVERSION
  }

  private static final Joiner ARGUMENT_JOINER = Joiner.on(", ");

  private final CallKind kind;
  private final Expression functionExpression;
  private final ImmutableList<Expression> arguments;

  public FunctionCall(
      FileLocation pFileLocation,
      CallKind pKind,
      Expression pFunctionExpression,
      List<? extends Expression> pArguments) {
    super(pFileLocation);
    kind = checkNotNull(pKind);
    functionExpression = checkNotNull(pFunctionExpression);
    arguments = ImmutableList.copyOf(pArguments);
  }

  public CallKind getKind() {
    return kind;
  }

  public Expression getFunctionExpression() {
    return functionExpression;
  }

  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  @Override
  public String toASTString() {
    return functionExpression.toASTString()
        + "("
        + FluentIterable.from(arguments).transform(Expression::toASTString).join(ARGUMENT_JOINER)
        + ")";
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
