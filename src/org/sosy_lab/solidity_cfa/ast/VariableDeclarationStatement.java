// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declaration of one or more local variables, e.g. {@code uint x = 1;} or {@code (uint a, bool b)
 * = f();}.
 */
public final class VariableDeclarationStatement extends Statement {

  private final ImmutableList<VariableDeclaration> declarations;
  private final @Nullable Expression initialValue;

  public VariableDeclarationStatement(
      FileLocation pFileLocation,
      List<VariableDeclaration> pDeclarations,
      @Nullable Expression pInitialValue) {
    super(pFileLocation);
    checkArgument(!pDeclarations.isEmpty(), "declaration statement without variables");
    declarations = ImmutableList.copyOf(pDeclarations);
    initialValue = pInitialValue;
  }

  public ImmutableList<VariableDeclaration> getDeclarations() {
    return declarations;
  }

  public Optional<Expression> getInitialValue() {
    return Optional.ofNullable(initialValue);
  }

  @Override
  public String toASTString() {
    String decls =
        FluentIterable.from(declarations)
            .transform(VariableDeclaration::toASTString)
            .join(Joiner.on(", "));
    if (declarations.size() > 1) {
      decls = "(" + decls + ")";
    }
    return decls + (initialValue == null ? "" : " = " + initialValue.toASTString()) + ";";
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
