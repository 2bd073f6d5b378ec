// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

/** Visitor for declarations and the structural nodes that hold them. */
public interface DeclarationVisitor<R, X extends Exception> {

  R visit(SourceUnit pSourceUnit) throws X;

  R visit(ContractDefinition pContract) throws X;

  R visit(FunctionDefinition pFunction) throws X;

  R visit(ModifierDefinition pModifier) throws X;

  R visit(ModifierInvocation pInvocation) throws X;

  R visit(VariableDeclaration pDeclaration) throws X;
}
