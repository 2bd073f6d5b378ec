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

/** {@code try externalCall { ... } catch { ... }}. */
public final class TryStatement extends Statement {

  private static final Joiner CATCH_JOINER = Joiner.on(" catch ");

  private final FunctionCall externalCall;
  private final ImmutableList<Block> clauses;

  public TryStatement(
      FileLocation pFileLocation, FunctionCall pExternalCall, List<Block> pClauses) {
    super(pFileLocation);
    externalCall = checkNotNull(pExternalCall);
    clauses = ImmutableList.copyOf(pClauses);
  }

  public FunctionCall getExternalCall() {
    return externalCall;
  }

  /** The success clause first, followed by the catch clauses. */
  public ImmutableList<Block> getClauses() {
    return clauses;
  }

  @Override
  public String toASTString() {
    return "try "
        + externalCall.toASTString()
        + " "
        + FluentIterable.from(clauses).transform(Block::toASTString).join(CATCH_JOINER);
  }

  @Override
  public <R, X extends Exception> R accept(StatementVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
