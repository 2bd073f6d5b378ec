// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

/** Visitor for every kind of {@link AstNode}. */
public interface AstNodeVisitor<R, X extends Exception>
    extends ExpressionVisitor<R, X>, StatementVisitor<R, X>, DeclarationVisitor<R, X> {}
