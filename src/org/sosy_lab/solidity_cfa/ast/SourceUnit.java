// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Root of the AST of one source file. */
public final class SourceUnit extends AstNode {

  private final ImmutableList<ContractDefinition> contracts;

  public SourceUnit(FileLocation pFileLocation, List<ContractDefinition> pContracts) {
    super(pFileLocation);
    contracts = ImmutableList.copyOf(pContracts);
  }

  public ImmutableList<ContractDefinition> getContracts() {
    return contracts;
  }

  @Override
  public String toASTString() {
    StringBuilder sb = new StringBuilder();
    for (ContractDefinition contract : contracts) {
      sb.append(contract.toASTString()).append("\n");
    }
    return sb.toString();
  }

  @Override
  public <R, X extends Exception> R accept(AstNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
