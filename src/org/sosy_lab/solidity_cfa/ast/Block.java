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

/** Sequence of statements in curly braces. */
public final class Block extends Statement {

  private final ImmutableList<Statement> statements;

  public Block(FileLocation pFileLocation, List<? extends Statement> pStatements) {
    super(pFileLocation);
    statements = ImmutableList.copyOf(pStatements);
  }

  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  @Override
  public String toASTString() {
    return "{\n"
        + FluentIterable.from(statements).transform(s -> s.toASTString() + "\n").join(Joiner.on(""))
        + "}";
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
