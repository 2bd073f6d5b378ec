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

public final class ModifierDefinition extends Declaration {

  private final ImmutableList<VariableDeclaration> parameters;
  private final Block body;

  public ModifierDefinition(
      FileLocation pFileLocation,
      String pName,
      List<VariableDeclaration> pParameters,
      Block pBody) {
    super(pFileLocation, pName);
    parameters = ImmutableList.copyOf(pParameters);
    body = checkNotNull(pBody);
  }

  public ImmutableList<VariableDeclaration> getParameters() {
    return parameters;
  }

  public Block getBody() {
    return body;
  }

  @Override
  public String toASTString() {
    return "modifier "
        + getName()
        + "("
        + FluentIterable.from(parameters)
            .transform(VariableDeclaration::toASTString)
            .join(Joiner.on(", "))
        + ") "
        + body.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(DeclarationVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
