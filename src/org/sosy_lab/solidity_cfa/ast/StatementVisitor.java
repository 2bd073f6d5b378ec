// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

public interface StatementVisitor<R, X extends Exception> {

  R visit(Block pBlock) throws X;

  R visit(ExpressionStatement pStatement) throws X;

  R visit(VariableDeclarationStatement pStatement) throws X;

  R visit(IfStatement pStatement) throws X;

  R visit(WhileStatement pStatement) throws X;

  R visit(ForStatement pStatement) throws X;

  R visit(Continue pStatement) throws X;

  R visit(Break pStatement) throws X;

  R visit(Return pStatement) throws X;

  R visit(Throw pStatement) throws X;

  R visit(EmitStatement pStatement) throws X;

  R visit(InlineAssembly pStatement) throws X;

  R visit(PlaceholderStatement pStatement) throws X;

  R visit(TryStatement pStatement) throws X;
}
