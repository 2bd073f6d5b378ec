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

/**
 * Declaration of a state variable, local variable, or parameter. Only state variables carry their
 * initial value here; local variables get it from their {@link VariableDeclarationStatement}.
 */
public final class VariableDeclaration extends Declaration {

  private final String typeName;
  private final @Nullable Expression value;

  public VariableDeclaration(
      FileLocation pFileLocation, String pTypeName, String pName, @Nullable Expression pValue) {
    super(pFileLocation, pName);
    typeName = checkNotNull(pTypeName);
    value = pValue;
  }

  public String getTypeName() {
    return typeName;
  }

  public Optional<Expression> getValue() {
    return Optional.ofNullable(value);
  }

  @Override
  public String toASTString() {
    String result = getName().isEmpty() ? typeName : typeName + " " + getName();
    return value == null ? result : result + " = " + value.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(DeclarationVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
