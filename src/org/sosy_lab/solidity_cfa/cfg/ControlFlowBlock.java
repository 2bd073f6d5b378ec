// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.solidity_cfa.ast.Expression;
import org.sosy_lab.solidity_cfa.ast.InlineAssembly;
import org.sosy_lab.solidity_cfa.ast.Return;
import org.sosy_lab.solidity_cfa.ast.VariableDeclaration;

/**
 * Basic block of control flow: the AST parts that are executed one after the other without any
 * branching. Expressions include all subexpressions in evaluation order, operands before the
 * operation that uses them.
 *
 * <p>The block is filled while its subprogram is constructed and sealed afterwards.
 */
public final class ControlFlowBlock {

  private List<VariableDeclaration> variableDeclarations = new ArrayList<>();
  private List<Expression> expressions = new ArrayList<>();
  private List<InlineAssembly> inlineAssemblyStatements = new ArrayList<>();
  private @Nullable Return returnStatement = null;
  private boolean sealed = false;

  ControlFlowBlock() {}

  void addVariableDeclaration(VariableDeclaration pDeclaration) {
    checkWritable();
    variableDeclarations.add(checkNotNull(pDeclaration));
  }

  void addExpression(Expression pExpression) {
    checkWritable();
    expressions.add(checkNotNull(pExpression));
  }

  void addInlineAssembly(InlineAssembly pAssembly) {
    checkWritable();
    inlineAssemblyStatements.add(checkNotNull(pAssembly));
  }

  /**
   * Mark this block as ending with the given return statement.
   *
   * @return false if the block already ends with a return statement, which is left in place
   */
  boolean setReturnStatement(Return pReturn) {
    checkState(!sealed, "block is sealed");
    if (returnStatement != null) {
      return false;
    }
    returnStatement = checkNotNull(pReturn);
    return true;
  }

  private void checkWritable() {
    checkState(!sealed, "block is sealed");
    checkState(returnStatement == null, "block already ends with %s", returnStatement);
  }

  void seal() {
    if (!sealed) {
      variableDeclarations = ImmutableList.copyOf(variableDeclarations);
      expressions = ImmutableList.copyOf(expressions);
      inlineAssemblyStatements = ImmutableList.copyOf(inlineAssemblyStatements);
      sealed = true;
    }
  }

  public boolean isSealed() {
    return sealed;
  }

  /** All variable declarations executed in this block. */
  public ImmutableList<VariableDeclaration> getVariableDeclarations() {
    return ImmutableList.copyOf(variableDeclarations);
  }

  /** All expressions executed in this block, including every subexpression. */
  public ImmutableList<Expression> getExpressions() {
    return ImmutableList.copyOf(expressions);
  }

  public ImmutableList<InlineAssembly> getInlineAssemblyStatements() {
    return ImmutableList.copyOf(inlineAssemblyStatements);
  }

  /** The return statement control flow leaves this block with, if any. */
  public Optional<Return> getReturnStatement() {
    return Optional.ofNullable(returnStatement);
  }

  public boolean isEmpty() {
    return variableDeclarations.isEmpty()
        && expressions.isEmpty()
        && inlineAssemblyStatements.isEmpty()
        && returnStatement == null;
  }

  @Override
  public String toString() {
    return "declarations: "
        + variableDeclarations
        + ", expressions: "
        + expressions
        + ", assembly: "
        + inlineAssemblyStatements.size()
        + (returnStatement == null ? "" : ", " + returnStatement.toASTString());
  }
}
