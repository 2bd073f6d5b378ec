// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.solidity_cfa.ast.Assignment;
import org.sosy_lab.solidity_cfa.ast.BinaryOperation;
import org.sosy_lab.solidity_cfa.ast.BinaryOperation.BinaryOperator;
import org.sosy_lab.solidity_cfa.ast.Block;
import org.sosy_lab.solidity_cfa.ast.Break;
import org.sosy_lab.solidity_cfa.ast.Continue;
import org.sosy_lab.solidity_cfa.ast.ContractDefinition;
import org.sosy_lab.solidity_cfa.ast.Declaration;
import org.sosy_lab.solidity_cfa.ast.Expression;
import org.sosy_lab.solidity_cfa.ast.ExpressionStatement;
import org.sosy_lab.solidity_cfa.ast.FileLocation;
import org.sosy_lab.solidity_cfa.ast.FunctionCall;
import org.sosy_lab.solidity_cfa.ast.FunctionCall.CallKind;
import org.sosy_lab.solidity_cfa.ast.FunctionDefinition;
import org.sosy_lab.solidity_cfa.ast.Identifier;
import org.sosy_lab.solidity_cfa.ast.IfStatement;
import org.sosy_lab.solidity_cfa.ast.Literal;
import org.sosy_lab.solidity_cfa.ast.ModifierDefinition;
import org.sosy_lab.solidity_cfa.ast.PlaceholderStatement;
import org.sosy_lab.solidity_cfa.ast.Return;
import org.sosy_lab.solidity_cfa.ast.Statement;
import org.sosy_lab.solidity_cfa.ast.Throw;
import org.sosy_lab.solidity_cfa.ast.VariableDeclaration;
import org.sosy_lab.solidity_cfa.ast.WhileStatement;

/** Short factory methods for hand-built ASTs in tests. */
final class CFGTestUtils {

  static final FileLocation LOC = new FileLocation("Test.sol", 1, 0, 0);

  private CFGTestUtils() {}

  static Identifier id(String pName) {
    return new Identifier(LOC, pName);
  }

  static Literal lit(String pValue) {
    return new Literal(LOC, pValue);
  }

  static BinaryOperation binary(Expression pLeft, BinaryOperator pOperator, Expression pRight) {
    return new BinaryOperation(LOC, pLeft, pOperator, pRight);
  }

  static Assignment assign(Expression pLeft, Expression pRight) {
    return new Assignment(LOC, pLeft, "=", pRight);
  }

  static FunctionCall call(CallKind pKind, String pName, Expression... pArguments) {
    return new FunctionCall(LOC, pKind, id(pName), ImmutableList.copyOf(pArguments));
  }

  static ExpressionStatement stmt(Expression pExpression) {
    return new ExpressionStatement(LOC, pExpression);
  }

  static Block block(Statement... pStatements) {
    return new Block(LOC, ImmutableList.copyOf(pStatements));
  }

  static IfStatement ifThen(Expression pCondition, Statement pThen, @Nullable Statement pElse) {
    return new IfStatement(LOC, pCondition, pThen, pElse);
  }

  static WhileStatement whileLoop(Expression pCondition, Statement pBody) {
    return new WhileStatement(LOC, pCondition, pBody, false);
  }

  static WhileStatement doWhileLoop(Statement pBody, Expression pCondition) {
    return new WhileStatement(LOC, pCondition, pBody, true);
  }

  static Break breakStmt() {
    return new Break(LOC);
  }

  static Continue continueStmt() {
    return new Continue(LOC);
  }

  static Return returnStmt(@Nullable Expression pExpression) {
    return new Return(LOC, pExpression);
  }

  static Throw throwStmt() {
    return new Throw(LOC);
  }

  static PlaceholderStatement placeholder() {
    return new PlaceholderStatement(LOC);
  }

  static VariableDeclaration variable(String pName) {
    return new VariableDeclaration(LOC, "uint256", pName, null);
  }

  static FunctionDefinition function(String pName, Statement... pBody) {
    return new FunctionDefinition(
        LOC, pName, ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), block(pBody));
  }

  static ModifierDefinition modifier(String pName, Statement... pBody) {
    return new ModifierDefinition(LOC, pName, ImmutableList.of(), block(pBody));
  }

  static ContractDefinition contract(String pName, Declaration... pSubNodes) {
    return new ContractDefinition(LOC, pName, ImmutableList.copyOf(pSubNodes));
  }
}
