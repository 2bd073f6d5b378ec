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
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Function of a contract; functions without a body are declared but not implemented. */
public final class FunctionDefinition extends Declaration {

  private final ImmutableList<VariableDeclaration> parameters;
  private final ImmutableList<VariableDeclaration> returnParameters;
  private final ImmutableList<ModifierInvocation> modifiers;
  private final @Nullable Block body;

  public FunctionDefinition(
      FileLocation pFileLocation,
      String pName,
      List<VariableDeclaration> pParameters,
      List<VariableDeclaration> pReturnParameters,
      List<ModifierInvocation> pModifiers,
      @Nullable Block pBody) {
    super(pFileLocation, pName);
    parameters = ImmutableList.copyOf(pParameters);
    returnParameters = ImmutableList.copyOf(pReturnParameters);
    modifiers = ImmutableList.copyOf(pModifiers);
    body = pBody;
  }

  public ImmutableList<VariableDeclaration> getParameters() {
    return parameters;
  }

  public ImmutableList<VariableDeclaration> getReturnParameters() {
    return returnParameters;
  }

  public Optional<Block> getBody() {
    return Optional.ofNullable(body);
  }

  @Override
  public String toASTString() {
    Joiner commaJoiner = Joiner.on(", ");
    StringBuilder sb = new StringBuilder();
    sb.append("function ").append(getName()).append("(");
    sb.append(
        FluentIterable.from(parameters)
            .transform(VariableDeclaration::toASTString)
            .join(commaJoiner));
    sb.append(")");
    for (ModifierInvocation modifier : modifiers) {
      sb.append(" ").append(modifier.toASTString());
    }
    if (!returnParameters.isEmpty()) {
      sb.append(" returns (");
      sb.append(
          FluentIterable.from(returnParameters)
              .transform(VariableDeclaration::toASTString)
              .join(commaJoiner));
      sb.append(")");
    }
    sb.append(body == null ? ";" : " " + body.toASTString());
    return sb.toString();
  }

  @Override
  public <R, X extends Exception> R accept(DeclarationVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
