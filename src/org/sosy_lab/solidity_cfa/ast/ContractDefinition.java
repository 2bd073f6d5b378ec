// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.List;

public final class ContractDefinition extends Declaration {

  private final ImmutableList<Declaration> subNodes;

  public ContractDefinition(
      FileLocation pFileLocation, String pName, List<? extends Declaration> pSubNodes) {
    super(pFileLocation, pName);
    subNodes = ImmutableList.copyOf(pSubNodes);
  }

  /** State variables, functions and modifiers in source order. */
  public ImmutableList<Declaration> getSubNodes() {
    return subNodes;
  }

  public ImmutableList<FunctionDefinition> getDefinedFunctions() {
    return FluentIterable.from(subNodes).filter(FunctionDefinition.class).toList();
  }

  public ImmutableList<ModifierDefinition> getFunctionModifiers() {
    return FluentIterable.from(subNodes).filter(ModifierDefinition.class).toList();
  }

  public ImmutableList<VariableDeclaration> getStateVariables() {
    return FluentIterable.from(subNodes).filter(VariableDeclaration.class).toList();
  }

  @Override
  public String toASTString() {
    StringBuilder sb = new StringBuilder("contract ").append(getName()).append(" {\n");
    for (Declaration sub : subNodes) {
      sb.append(sub.toASTString()).append("\n");
    }
    return sb.append("}").toString();
  }

  @Override
  public <R, X extends Exception> R accept(DeclarationVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
