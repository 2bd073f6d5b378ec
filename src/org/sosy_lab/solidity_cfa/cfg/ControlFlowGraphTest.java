// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.LOC;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.assign;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.binary;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.block;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.breakStmt;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.call;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.continueStmt;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.contract;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.doWhileLoop;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.function;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.id;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.ifThen;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.lit;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.modifier;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.placeholder;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.returnStmt;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.stmt;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.throwStmt;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.variable;
import static org.sosy_lab.solidity_cfa.cfg.CFGTestUtils.whileLoop;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.solidity_cfa.ast.Assignment;
import org.sosy_lab.solidity_cfa.ast.BinaryOperation;
import org.sosy_lab.solidity_cfa.ast.BinaryOperation.BinaryOperator;
import org.sosy_lab.solidity_cfa.ast.Conditional;
import org.sosy_lab.solidity_cfa.ast.ContractDefinition;
import org.sosy_lab.solidity_cfa.ast.Declaration;
import org.sosy_lab.solidity_cfa.ast.EmitStatement;
import org.sosy_lab.solidity_cfa.ast.Expression;
import org.sosy_lab.solidity_cfa.ast.ForStatement;
import org.sosy_lab.solidity_cfa.ast.FunctionCall;
import org.sosy_lab.solidity_cfa.ast.FunctionCall.CallKind;
import org.sosy_lab.solidity_cfa.ast.FunctionDefinition;
import org.sosy_lab.solidity_cfa.ast.Identifier;
import org.sosy_lab.solidity_cfa.ast.InlineAssembly;
import org.sosy_lab.solidity_cfa.ast.Literal;
import org.sosy_lab.solidity_cfa.ast.ModifierDefinition;
import org.sosy_lab.solidity_cfa.ast.TryStatement;
import org.sosy_lab.solidity_cfa.ast.VariableDeclaration;
import org.sosy_lab.solidity_cfa.ast.VariableDeclarationStatement;
import org.sosy_lab.solidity_cfa.errors.CollectingErrorReporter;
import org.sosy_lab.solidity_cfa.errors.Diagnostic;
import org.sosy_lab.solidity_cfa.errors.Severity;

public class ControlFlowGraphTest {

  private final LogManager logger = LogManager.createTestLogManager();
  private CollectingErrorReporter errors;
  private ControlFlowGraph graph;

  @Before
  public void setUp() throws InvalidConfigurationException {
    errors = new CollectingErrorReporter(logger);
    graph = createGraph(Configuration.builder().setOption("cfg.checkConsistency", "true").build());
  }

  private ControlFlowGraph createGraph(Configuration pConfig)
      throws InvalidConfigurationException {
    return new ControlFlowGraph(pConfig, logger, errors);
  }

  private FunctionFlow build(FunctionDefinition pFunction) {
    assertThat(graph.constructFlow(pFunction)).isTrue();
    assertThat(errors.getErrors()).isEmpty();
    return graph.functionFlow(pFunction);
  }

  private CFGNode nodeOf(Declaration pSubprogram, Expression pExpression) {
    return CFGUtils.nodeContaining(graph, pSubprogram, pExpression).orElseThrow();
  }

  private static CFGNode firstNode(FunctionFlow pFlow) {
    return pFlow.getEntry().getLeavingNode(0);
  }

  @Test
  public void emptyFunctionFallsThroughToExit() {
    FunctionDefinition f = function("f");
    FunctionFlow flow = build(f);

    assertThat(graph.nodesOf(f)).hasSize(4);
    assertThat(flow.getEntry().getNumEnteringEdges()).isEqualTo(0);
    assertThat(flow.getEntry().getNumLeavingEdges()).isEqualTo(1);
    CFGNode first = firstNode(flow);
    assertThat(first.getExits()).containsExactly(flow.getExit());
    assertThat(flow.getException().getNumEnteringEdges()).isEqualTo(0);
    assertThat(flow.getAnchors())
        .containsExactly(flow.getEntry(), flow.getExit(), flow.getException())
        .inOrder();
  }

  @Test
  public void functionWithoutBody() {
    FunctionDefinition f =
        new FunctionDefinition(
            LOC, "f", ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), null);
    FunctionFlow flow = build(f);

    assertThat(firstNode(flow).getExits()).containsExactly(flow.getExit());
  }

  @Test
  public void assignmentRecordsTargetBeforeValue() {
    Identifier x = id("x");
    Identifier a = id("a");
    Identifier b = id("b");
    BinaryOperation sum = binary(a, BinaryOperator.PLUS, b);
    Assignment assignment = assign(x, sum);
    FunctionDefinition f = function("f", stmt(assignment));
    FunctionFlow flow = build(f);

    assertThat(firstNode(flow).getBlock().getExpressions())
        .containsExactly(x, a, b, sum, assignment)
        .inOrder();
  }

  @Test
  public void parametersAreDeclaredInEntryBlock() {
    VariableDeclaration p = variable("p");
    VariableDeclaration r = variable("r");
    FunctionDefinition f =
        new FunctionDefinition(
            LOC, "f", ImmutableList.of(p), ImmutableList.of(r), ImmutableList.of(), block());
    FunctionFlow flow = build(f);

    assertThat(flow.getEntry().getBlock().getVariableDeclarations())
        .containsExactly(p, r)
        .inOrder();
  }

  @Test
  public void localVariablesAreDeclaredAfterInitialValue() {
    VariableDeclaration v = variable("v");
    Identifier a = id("a");
    FunctionDefinition f =
        function("f", new VariableDeclarationStatement(LOC, ImmutableList.of(v), a));
    FunctionFlow flow = build(f);

    ControlFlowBlock first = firstNode(flow).getBlock();
    assertThat(first.getExpressions()).containsExactly(a);
    assertThat(first.getVariableDeclarations()).containsExactly(v);
  }

  @Test
  public void returnLeadsOnlyToExit() {
    Identifier x = id("x");
    Identifier y = id("y");
    FunctionDefinition f = function("f", returnStmt(x), stmt(y));
    FunctionFlow flow = build(f);

    CFGNode returnNode = nodeOf(f, x);
    assertThat(returnNode.getBlock().getReturnStatement().isPresent()).isTrue();
    assertThat(returnNode.getExits()).containsExactly(flow.getExit());

    CFGNode deadNode = nodeOf(f, y);
    assertThat(deadNode.getNumEnteringEdges()).isEqualTo(0);
    assertThat(deadNode.getNumLeavingEdges()).isEqualTo(0);
    assertThat(CFGUtils.reachableNodes(flow)).doesNotContain(deadNode);
  }

  @Test
  public void ifWithoutElseMergesWithCondition() {
    Identifier c = id("c");
    Identifier a = id("a");
    Identifier b = id("b");
    FunctionDefinition f = function("f", ifThen(c, block(stmt(a)), null), stmt(b));
    build(f);

    CFGNode condition = nodeOf(f, c);
    CFGNode trueBranch = nodeOf(f, a);
    CFGNode merge = nodeOf(f, b);
    assertThat(condition.getExits()).containsExactly(trueBranch, merge);
    assertThat(trueBranch.getExits()).containsExactly(merge);
    assertThat(merge.getEntries()).containsExactly(trueBranch, condition);
  }

  @Test
  public void codeAfterReturningBranchesIsUnreachable() {
    Identifier c = id("c");
    Identifier a = id("a");
    Identifier b = id("b");
    Identifier d = id("d");
    FunctionDefinition f =
        function("f", ifThen(c, returnStmt(a), returnStmt(b)), stmt(d));
    FunctionFlow flow = build(f);

    assertThat(nodeOf(f, d).getNumEnteringEdges()).isEqualTo(0);
    assertThat(flow.getExit().getEntries()).containsExactly(nodeOf(f, a), nodeOf(f, b));
    assertThat(nodeOf(f, c).getExits()).containsExactly(nodeOf(f, a), nodeOf(f, b));
  }

  @Test
  public void returnAndRevertInBothBranches() {
    Identifier a = id("a");
    Identifier after = id("after");
    FunctionCall revert = call(CallKind.REVERT, "revert");
    FunctionDefinition f =
        function(
            "f",
            ifThen(a, block(returnStmt(null)), block(stmt(revert))),
            stmt(after));
    FunctionFlow flow = build(f);

    CFGNode condition = nodeOf(f, a);
    CFGNode revertNode = nodeOf(f, revert);
    CFGNode returnNode = condition.getExits().get(0);
    assertThat(condition.getExits()).containsExactly(returnNode, revertNode).inOrder();
    assertThat(flow.getExit().getEntries()).containsExactly(returnNode);
    assertThat(flow.getException().getEntries()).containsExactly(revertNode);
    assertThat(nodeOf(f, after).getNumEnteringEdges()).isEqualTo(0);
  }

  @Test
  public void breakLeavesWhileLoop() {
    Identifier c = id("c");
    Identifier d = id("d");
    Identifier e = id("e");
    Identifier afterLoop = id("f");
    FunctionDefinition f =
        function(
            "f",
            whileLoop(c, block(ifThen(d, breakStmt(), null), stmt(e))),
            stmt(afterLoop));
    FunctionFlow flow = build(f);

    CFGNode condition = nodeOf(f, c);
    CFGNode body = nodeOf(f, d);
    CFGNode rest = nodeOf(f, e);
    CFGNode loopExit = nodeOf(f, afterLoop);

    assertThat(condition.getExits()).containsExactly(body, loopExit).inOrder();
    assertThat(rest.getExits()).containsExactly(condition);
    assertThat(rest.getEntries()).containsExactly(body);
    assertThat(body.getExits()).hasSize(2);
    assertThat(body.getExits()).contains(rest);

    CFGNode breakNode = body.getExits().get(0);
    assertThat(breakNode).isNotEqualTo(rest);
    assertThat(breakNode.getExits()).containsExactly(loopExit);
    assertThat(loopExit.getEntries()).containsExactly(condition, breakNode);
    assertThat(loopExit.getExits()).containsExactly(flow.getExit());
  }

  @Test
  public void continueJumpsToLoopExpression() {
    Identifier c = id("c");
    Identifier d = id("d");
    Identifier e = id("e");
    Assignment init = assign(id("i"), lit("0"));
    Assignment increment = assign(id("i"), binary(id("i"), BinaryOperator.PLUS, lit("1")));
    ForStatement loop =
        new ForStatement(
            LOC,
            stmt(init),
            c,
            stmt(increment),
            block(ifThen(d, continueStmt(), null), stmt(e)));
    FunctionDefinition f = function("f", loop);
    FunctionFlow flow = build(f);

    CFGNode initNode = nodeOf(f, init);
    CFGNode condition = nodeOf(f, c);
    CFGNode body = nodeOf(f, d);
    CFGNode incrementNode = nodeOf(f, increment);

    assertThat(initNode).isEqualTo(firstNode(flow));
    assertThat(initNode.getExits()).containsExactly(condition);
    assertThat(incrementNode.getExits()).containsExactly(condition);
    assertThat(incrementNode.getEntries()).hasSize(2);
    assertThat(incrementNode.getEntries()).contains(nodeOf(f, e));

    CFGNode continueNode = body.getExits().get(0);
    assertThat(continueNode.getExits()).containsExactly(incrementNode);
    assertThat(condition.getExits()).hasSize(2);
    assertThat(condition.getExits().get(0)).isEqualTo(body);
  }

  @Test
  public void jumpsInNestedLoopsTargetTheirOwnLoop() {
    Identifier outerCondition = id("c");
    Identifier innerCondition = id("k");
    Identifier d = id("d");
    Identifier e = id("e");
    Identifier g = id("g");
    Identifier h = id("h");
    Identifier afterLoops = id("after");
    Assignment increment = assign(id("i"), binary(id("i"), BinaryOperator.PLUS, lit("1")));
    ForStatement inner =
        new ForStatement(
            LOC,
            null,
            innerCondition,
            stmt(increment),
            block(ifThen(d, breakStmt(), null), stmt(e)));
    FunctionDefinition f =
        function(
            "f",
            whileLoop(
                outerCondition, block(inner, ifThen(g, continueStmt(), null), stmt(h))),
            stmt(afterLoops));
    FunctionFlow flow = build(f);

    CFGNode outerHead = nodeOf(f, outerCondition);
    CFGNode innerHead = nodeOf(f, innerCondition);
    CFGNode innerExit = nodeOf(f, g);
    CFGNode outerExit = nodeOf(f, afterLoops);

    CFGNode breakNode = nodeOf(f, d).getExits().get(0);
    assertThat(breakNode.getExits()).containsExactly(innerExit);
    assertThat(innerExit.getEntries()).containsExactly(innerHead, breakNode);
    assertThat(nodeOf(f, e).getExits()).containsExactly(nodeOf(f, increment));

    // after the inner loop is closed, jumps go to the outer loop again
    CFGNode continueNode = innerExit.getExits().get(0);
    assertThat(continueNode.getExits()).containsExactly(outerHead);
    assertThat(nodeOf(f, h).getExits()).containsExactly(outerHead);
    assertThat(outerHead.getEntries()).containsExactly(firstNode(flow), continueNode, nodeOf(f, h));
    assertThat(outerExit.getEntries()).containsExactly(outerHead);
    assertThat(outerExit.getExits()).containsExactly(flow.getExit());
  }

  @Test
  public void forWithoutConditionIsOnlyLeftByBreak() {
    ForStatement loop = new ForStatement(LOC, null, null, null, block(breakStmt()));
    FunctionDefinition f = function("f", loop);
    FunctionFlow flow = build(f);

    CFGNode first = firstNode(flow);
    assertThat(first.getNumLeavingEdges()).isEqualTo(1);
    CFGNode condition = first.getLeavingNode(0);
    assertThat(condition.getNumLeavingEdges()).isEqualTo(1);
    CFGNode body = condition.getLeavingNode(0);
    assertThat(body.getNumLeavingEdges()).isEqualTo(1);
    CFGNode loopExit = body.getLeavingNode(0);
    assertThat(loopExit.getExits()).containsExactly(flow.getExit());
    assertThat(loopExit.getEntries()).containsExactly(body);
    assertThat(condition.getEntries()).containsExactly(first);
  }

  @Test
  public void doWhileEvaluatesBodyFirst() {
    Identifier a = id("a");
    Identifier c = id("c");
    Identifier d = id("d");
    FunctionDefinition f = function("f", doWhileLoop(block(stmt(a)), c), stmt(d));
    FunctionFlow flow = build(f);

    CFGNode body = nodeOf(f, a);
    CFGNode condition = nodeOf(f, c);
    CFGNode loopExit = nodeOf(f, d);
    assertThat(body.getEntries()).containsExactly(firstNode(flow), condition).inOrder();
    assertThat(body.getExits()).containsExactly(condition);
    assertThat(condition.getExits()).containsExactly(body, loopExit).inOrder();
  }

  @Test
  public void shortCircuitSplitsRightOperand() {
    Identifier x = id("x");
    Identifier a = id("a");
    Identifier b = id("b");
    BinaryOperation and = binary(a, BinaryOperator.AND, b);
    FunctionDefinition f = function("f", stmt(assign(x, and)));
    FunctionFlow flow = build(f);

    CFGNode fork = nodeOf(f, a);
    CFGNode right = nodeOf(f, b);
    CFGNode merge = nodeOf(f, and);
    assertThat(fork).isEqualTo(firstNode(flow));
    assertThat(fork.getExits()).containsExactly(right, merge).inOrder();
    assertThat(right.getExits()).containsExactly(merge);
    assertThat(merge.getEntries()).containsExactly(fork, right);
    assertThat(fork.getBlock().getExpressions()).containsExactly(x, a).inOrder();
    assertThat(merge.getBlock().getExpressions()).doesNotContain(x);
  }

  @Test
  public void shortCircuitOrWithFailingCall() {
    Identifier a = id("a");
    FunctionCall external = call(CallKind.EXTERNAL, "g");
    BinaryOperation or = binary(a, BinaryOperator.OR, external);
    FunctionDefinition f = function("f", stmt(or));
    FunctionFlow flow = build(f);

    CFGNode fork = nodeOf(f, a);
    CFGNode right = nodeOf(f, external);
    CFGNode merge = nodeOf(f, or);
    assertThat(fork).isEqualTo(firstNode(flow));
    assertThat(fork.getExits()).containsExactly(right, merge).inOrder();

    // the call fails only on the path that evaluates it
    assertThat(right.getExits()).hasSize(2);
    assertThat(right.getExits().get(0)).isEqualTo(flow.getException());
    CFGNode afterCall = right.getExits().get(1);
    assertThat(afterCall.getExits()).containsExactly(merge);
    assertThat(merge.getEntries()).containsExactly(fork, afterCall).inOrder();
    assertThat(flow.getException().getEntries()).containsExactly(right);
    assertThat(merge.getExits()).containsExactly(flow.getExit());
  }

  @Test
  public void nonShortCircuitOperatorStaysInBlock() {
    Identifier a = id("a");
    Identifier b = id("b");
    BinaryOperation or = binary(a, BinaryOperator.BITWISE_OR, b);
    FunctionDefinition f = function("f", stmt(or));
    FunctionFlow flow = build(f);

    assertThat(firstNode(flow).getBlock().getExpressions()).containsExactly(a, b, or).inOrder();
  }

  @Test
  public void conditionalExpressionBranches() {
    Identifier c = id("c");
    Identifier a = id("a");
    Identifier b = id("b");
    Conditional conditional = new Conditional(LOC, c, a, b);
    FunctionDefinition f = function("f", stmt(conditional));
    build(f);

    CFGNode fork = nodeOf(f, c);
    CFGNode merge = nodeOf(f, conditional);
    assertThat(fork.getExits()).containsExactly(nodeOf(f, a), nodeOf(f, b)).inOrder();
    assertThat(merge.getEntries()).containsExactly(nodeOf(f, a), nodeOf(f, b)).inOrder();
  }

  @Test
  public void failingCallForksToException() {
    FunctionCall require = call(CallKind.REQUIRE, "require", id("c"));
    Identifier d = id("d");
    FunctionDefinition f = function("f", stmt(require), stmt(d));
    FunctionFlow flow = build(f);

    CFGNode callNode = nodeOf(f, require);
    CFGNode next = nodeOf(f, d);
    assertThat(callNode.getExits()).containsExactly(flow.getException(), next).inOrder();
    assertThat(flow.getException().getEntries()).containsExactly(callNode);
  }

  @Test
  public void internalCallDoesNotFork() {
    FunctionCall internal = call(CallKind.INTERNAL, "g");
    Identifier d = id("d");
    FunctionDefinition f = function("f", stmt(internal), stmt(d));
    FunctionFlow flow = build(f);

    assertThat(nodeOf(f, internal)).isEqualTo(nodeOf(f, d));
    assertThat(flow.getException().getNumEnteringEdges()).isEqualTo(0);
  }

  @Test
  public void revertDiverges() {
    FunctionCall revert = call(CallKind.REVERT, "revert");
    Identifier a = id("a");
    FunctionDefinition f = function("f", stmt(revert), stmt(a));
    FunctionFlow flow = build(f);

    assertThat(nodeOf(f, revert).getExits()).containsExactly(flow.getException());
    assertThat(nodeOf(f, a).getNumEnteringEdges()).isEqualTo(0);
    assertThat(flow.getExit().getNumEnteringEdges()).isEqualTo(0);
  }

  @Test
  public void throwLeadsToException() {
    FunctionDefinition f = function("f", throwStmt());
    FunctionFlow flow = build(f);

    assertThat(firstNode(flow).getExits()).containsExactly(flow.getException());
    assertThat(flow.getExit().getNumEnteringEdges()).isEqualTo(0);
  }

  @Test
  public void emitAndAssemblyAreRecorded() {
    FunctionCall event = call(CallKind.EVENT, "Transfer", id("a"));
    InlineAssembly assembly = new InlineAssembly(LOC, "{ sstore(0, 1) }");
    FunctionDefinition f = function("f", new EmitStatement(LOC, event), assembly);
    FunctionFlow flow = build(f);

    ControlFlowBlock first = firstNode(flow).getBlock();
    assertThat(first.getExpressions()).contains(event);
    assertThat(first.getInlineAssemblyStatements()).containsExactly(assembly);
    assertThat(firstNode(flow).getExits()).containsExactly(flow.getExit());
  }

  @Test
  public void placeholderCutsModifier() {
    FunctionCall require = call(CallKind.REQUIRE, "require", id("c"));
    Identifier a = id("a");
    ModifierDefinition m = modifier("m", stmt(require), placeholder(), stmt(a));
    assertThat(graph.constructFlow(m)).isTrue();
    ModifierFlow flow = graph.modifierFlow(m);

    assertThat(flow.getPlaceholders()).hasSize(1);
    PlaceholderCut cut = flow.getPlaceholders().get(0);
    CFGNode before = cut.getNodeBefore();
    CFGNode after = cut.getNodeAfter();
    assertThat(before.hasEdgeTo(after)).isFalse();
    assertThat(after.hasEdgeTo(before)).isFalse();
    assertThat(before.getNumLeavingEdges()).isEqualTo(0);
    assertThat(before.getEntries()).containsExactly(nodeOf(m, require));
    assertThat(after.getNumEnteringEdges()).isEqualTo(0);
    assertThat(after.getBlock().getExpressions()).containsExactly(a);
    assertThat(after.getExits()).containsExactly(flow.getExit());
  }

  @Test
  public void consecutivePlaceholdersShareNodes() {
    Identifier a = id("a");
    ModifierDefinition m = modifier("m", placeholder(), stmt(a), placeholder());
    assertThat(graph.constructFlow(m)).isTrue();
    ModifierFlow flow = graph.modifierFlow(m);

    assertThat(flow.getPlaceholders()).hasSize(2);
    PlaceholderCut first = flow.getPlaceholders().get(0);
    PlaceholderCut second = flow.getPlaceholders().get(1);
    assertThat(first.getNodeBefore()).isEqualTo(firstNode(flow));
    assertThat(first.getNodeAfter()).isEqualTo(nodeOf(m, a));
    assertThat(second.getNodeBefore()).isEqualTo(first.getNodeAfter());
    assertThat(second.getNodeAfter().getExits()).containsExactly(flow.getExit());
  }

  @Test
  public void placeholderOutsideModifierIsError() {
    FunctionDefinition f = function("f", placeholder());
    assertThat(graph.constructFlow(f)).isFalse();

    assertThat(errors.getErrors()).hasSize(1);
    assertThat(graph.isConstructed(f)).isTrue();
  }

  @Test
  public void breakOutsideLoopIsError() {
    Identifier a = id("a");
    FunctionDefinition f = function("f", breakStmt(), stmt(a));
    assertThat(graph.constructFlow(f)).isFalse();

    assertThat(errors.getErrors())
        .containsExactly(
            new Diagnostic(
                Severity.ERROR, LOC, "\"break\" has to be in a \"for\" or \"while\" loop."));
    // no jump is created, control continues with the next statement
    FunctionFlow flow = graph.functionFlow(f);
    assertThat(nodeOf(f, a)).isEqualTo(firstNode(flow));
  }

  @Test
  public void continueOutsideLoopIsError() {
    FunctionDefinition f = function("f", continueStmt());
    assertThat(graph.constructFlow(f)).isFalse();
    assertThat(errors.getErrors()).hasSize(1);
  }

  @Test
  public void tryStatementIsReportedAsUnsupported() {
    Identifier x = id("x");
    FunctionCall external = call(CallKind.EXTERNAL, "g", x);
    TryStatement tryStatement = new TryStatement(LOC, external, ImmutableList.of(block()));
    FunctionDefinition f = function("f", tryStatement);
    assertThat(graph.constructFlow(f)).isTrue();

    assertThat(errors.getDiagnostics()).hasSize(1);
    assertThat(errors.getDiagnostics().get(0).getSeverity()).isEqualTo(Severity.WARNING);
    FunctionFlow flow = graph.functionFlow(f);
    assertThat(firstNode(flow).getBlock().getExpressions()).contains(external);
    assertThat(firstNode(flow).getExits()).containsExactly(flow.getExit());
  }

  @Test
  public void tryClausesAreRecordedWithoutBranching() {
    FunctionCall external = call(CallKind.EXTERNAL, "g");
    Identifier x = id("x");
    Literal one = lit("1");
    Assignment inSuccess = assign(x, one);
    Identifier y = id("y");
    Literal two = lit("2");
    Assignment inCatch = assign(y, two);
    VariableDeclaration v = variable("v");
    TryStatement tryStatement =
        new TryStatement(
            LOC,
            external,
            ImmutableList.of(
                block(stmt(inSuccess), returnStmt(null)),
                block(
                    new VariableDeclarationStatement(LOC, ImmutableList.of(v), null),
                    stmt(inCatch),
                    breakStmt())));
    FunctionDefinition f = function("f", tryStatement);
    assertThat(graph.constructFlow(f)).isTrue();
    FunctionFlow flow = graph.functionFlow(f);

    assertThat(errors.getDiagnostics()).hasSize(1);
    CFGNode first = firstNode(flow);
    assertThat(nodeOf(f, inSuccess)).isEqualTo(first);
    assertThat(nodeOf(f, inCatch)).isEqualTo(first);
    assertThat(first.getBlock().getExpressions())
        .containsExactly(
            external.getFunctionExpression(), external, x, one, inSuccess, y, two, inCatch)
        .inOrder();
    assertThat(first.getBlock().getVariableDeclarations()).containsExactly(v);
    // jumps inside the clauses are not wired
    assertThat(first.getBlock().getReturnStatement().isPresent()).isFalse();
    assertThat(first.getExits()).containsExactly(flow.getExit());
    assertThat(graph.nodesOf(f)).hasSize(4);
  }

  @Test
  public void tryStatementWithErrorSeverityFails() throws InvalidConfigurationException {
    graph =
        createGraph(
            Configuration.builder().setOption("cfg.unsupportedConstructSeverity", "ERROR").build());
    FunctionCall external = call(CallKind.EXTERNAL, "g");
    FunctionDefinition f =
        function("f", new TryStatement(LOC, external, ImmutableList.of(block())));

    assertThat(graph.constructFlow(f)).isFalse();
    assertThat(errors.hasErrors()).isTrue();
  }

  @Test
  public void statementRootIsRejected() {
    assertThat(graph.constructFlow(stmt(id("a")))).isFalse();
    assertThat(errors.getErrors()).hasSize(1);
    assertThat(graph.getNodes()).isEmpty();
  }

  @Test
  public void unknownFunctionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> graph.functionFlow(function("g")));
    assertThrows(IllegalArgumentException.class, () -> graph.modifierFlow(modifier("m")));
  }

  @Test
  public void contractConstructsAllSubprograms() {
    FunctionDefinition f = function("f", stmt(id("a")));
    FunctionDefinition g = function("g", returnStmt(null));
    ModifierDefinition m = modifier("m", placeholder());
    ContractDefinition c = contract("C", variable("s"), f, m, g);

    assertThat(graph.constructFlow(c)).isTrue();
    assertThat(graph.getFunctionFlows().keySet()).containsExactly(f, g).inOrder();
    assertThat(graph.getModifierFlows().keySet()).containsExactly(m);
    assertThat(CFGCheck.checkFull(graph)).isTrue();

    for (CFGNode node : graph.getNodes()) {
      for (CFGNode successor : node.getExits()) {
        assertThat(successor.getEntries()).contains(node);
      }
      for (CFGNode predecessor : node.getEntries()) {
        assertThat(predecessor.getExits()).contains(node);
      }
    }
  }

  @Test
  public void repeatedConstructionKeepsExistingFlows() {
    FunctionDefinition f = function("f", stmt(id("a")));
    ContractDefinition c = contract("C", f);
    assertThat(graph.constructFlow(c)).isTrue();
    FunctionFlow flow = graph.functionFlow(f);
    int nodes = graph.getNumberOfNodes();

    assertThat(graph.constructFlow(c)).isTrue();
    assertThat(graph.functionFlow(f)).isSameInstanceAs(flow);
    assertThat(graph.getNumberOfNodes()).isEqualTo(nodes);
  }

  @Test
  public void blocksAreSealedAfterConstruction() {
    FunctionDefinition f = function("f", stmt(id("a")));
    build(f);

    for (CFGNode node : graph.nodesOf(f)) {
      assertThat(node.getBlock().isSealed()).isTrue();
    }
  }
}
