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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.solidity_cfa.ast.Assignment;
import org.sosy_lab.solidity_cfa.ast.AstNodeVisitor;
import org.sosy_lab.solidity_cfa.ast.BinaryOperation;
import org.sosy_lab.solidity_cfa.ast.Block;
import org.sosy_lab.solidity_cfa.ast.Break;
import org.sosy_lab.solidity_cfa.ast.Conditional;
import org.sosy_lab.solidity_cfa.ast.Continue;
import org.sosy_lab.solidity_cfa.ast.ContractDefinition;
import org.sosy_lab.solidity_cfa.ast.Declaration;
import org.sosy_lab.solidity_cfa.ast.EmitStatement;
import org.sosy_lab.solidity_cfa.ast.Expression;
import org.sosy_lab.solidity_cfa.ast.ExpressionStatement;
import org.sosy_lab.solidity_cfa.ast.ExpressionVisitor;
import org.sosy_lab.solidity_cfa.ast.ForStatement;
import org.sosy_lab.solidity_cfa.ast.FunctionCall;
import org.sosy_lab.solidity_cfa.ast.FunctionCall.CallKind;
import org.sosy_lab.solidity_cfa.ast.FunctionDefinition;
import org.sosy_lab.solidity_cfa.ast.Identifier;
import org.sosy_lab.solidity_cfa.ast.IfStatement;
import org.sosy_lab.solidity_cfa.ast.IndexAccess;
import org.sosy_lab.solidity_cfa.ast.InlineAssembly;
import org.sosy_lab.solidity_cfa.ast.Literal;
import org.sosy_lab.solidity_cfa.ast.MemberAccess;
import org.sosy_lab.solidity_cfa.ast.ModifierDefinition;
import org.sosy_lab.solidity_cfa.ast.ModifierInvocation;
import org.sosy_lab.solidity_cfa.ast.NoException;
import org.sosy_lab.solidity_cfa.ast.PlaceholderStatement;
import org.sosy_lab.solidity_cfa.ast.Return;
import org.sosy_lab.solidity_cfa.ast.SourceUnit;
import org.sosy_lab.solidity_cfa.ast.Statement;
import org.sosy_lab.solidity_cfa.ast.StatementVisitor;
import org.sosy_lab.solidity_cfa.ast.Throw;
import org.sosy_lab.solidity_cfa.ast.TryStatement;
import org.sosy_lab.solidity_cfa.ast.TupleExpression;
import org.sosy_lab.solidity_cfa.ast.UnaryOperation;
import org.sosy_lab.solidity_cfa.ast.VariableDeclaration;
import org.sosy_lab.solidity_cfa.ast.VariableDeclarationStatement;
import org.sosy_lab.solidity_cfa.ast.WhileStatement;
import org.sosy_lab.solidity_cfa.errors.ErrorReporter;
import org.sosy_lab.solidity_cfa.errors.Severity;

/**
 * Walks the AST once and creates the nodes and edges of every function and modifier it finds.
 *
 * <p>Expressions and declarations are appended to the block of the current node when they are
 * visited. Statements that branch or jump allocate new nodes, connect them, and move the current
 * node. The finished flow of a subprogram is handed to the graph only after all its edges exist.
 */
final class CFGBuilder implements AstNodeVisitor<Void, NoException> {

  private final ControlFlowGraph graph;
  private final ErrorReporter errorReporter;
  private final CallFailurePolicy callFailurePolicy;
  private final Severity unsupportedConstructSeverity;
  private final LogManager logger;

  // enclosing subprograms whose traversal is suspended
  private final Deque<FlowContext> suspendedContexts = new ArrayDeque<>();
  private @Nullable FlowContext context = null;

  CFGBuilder(
      ControlFlowGraph pGraph,
      ErrorReporter pErrorReporter,
      CallFailurePolicy pCallFailurePolicy,
      Severity pUnsupportedConstructSeverity,
      LogManager pLogger) {
    graph = checkNotNull(pGraph);
    errorReporter = checkNotNull(pErrorReporter);
    callFailurePolicy = checkNotNull(pCallFailurePolicy);
    unsupportedConstructSeverity = checkNotNull(pUnsupportedConstructSeverity);
    logger = checkNotNull(pLogger);
  }

  private FlowContext context() {
    checkState(context != null, "not inside a function or modifier");
    return context;
  }

  private CFGNode newNode() {
    return graph.newNode(context().getSubprogram());
  }

  private CFGNode currentNode() {
    return context().getCurrentNode();
  }

  private void setCurrentNode(CFGNode pNode) {
    context().setCurrentNode(pNode);
  }

  /** Add an edge, unless the predecessor is dead code. */
  private void connect(CFGNode pFrom, CFGNode pTo) {
    if (context().isLive(pFrom)) {
      graph.addEdge(pFrom, pTo);
    }
  }

  /** Code after the current point is unreachable, continue in a node nothing flows into. */
  private void diverge() {
    setCurrentNode(newNode());
  }

  private void append(Expression pExpression) {
    currentNode().getBlock().addExpression(pExpression);
  }

  // subprograms

  private FlowContext enterSubprogram(Declaration pDefinition, boolean pIsModifier) {
    if (context != null) {
      suspendedContexts.push(context);
    }
    CFGNode entry = graph.newNode(pDefinition);
    CFGNode exit = graph.newNode(pDefinition);
    CFGNode exception = graph.newNode(pDefinition);
    context = new FlowContext(pDefinition, entry, exit, exception, pIsModifier);
    return context;
  }

  private void recordParameters(List<VariableDeclaration> pDeclarations) {
    for (VariableDeclaration declaration : pDeclarations) {
      currentNode().getBlock().addVariableDeclaration(declaration);
    }
  }

  /** Move from the entry node, which keeps exactly one leaving edge, into the body. */
  private void startBody() {
    CFGNode first = newNode();
    connect(context().getEntry(), first);
    setCurrentNode(first);
  }

  /** Falling off the end of the body is an implicit return. */
  private void finishBody() {
    connect(currentNode(), context().getReturnJump());
  }

  private void leaveSubprogram() {
    context = suspendedContexts.poll();
  }

  @Override
  public Void visit(SourceUnit pSourceUnit) {
    for (ContractDefinition contract : pSourceUnit.getContracts()) {
      contract.accept(this);
    }
    return null;
  }

  @Override
  public Void visit(ContractDefinition pContract) {
    for (Declaration subNode : pContract.getSubNodes()) {
      subNode.accept(this);
    }
    return null;
  }

  @Override
  public Void visit(FunctionDefinition pFunction) {
    if (graph.isConstructed(pFunction)) {
      logger.log(Level.FINE, "Skipping function", pFunction.getName(), "with existing CFG");
      return null;
    }
    FlowContext functionContext = enterSubprogram(pFunction, false);
    recordParameters(pFunction.getParameters());
    recordParameters(pFunction.getReturnParameters());
    startBody();
    Optional<Block> body = pFunction.getBody();
    if (body.isPresent()) {
      body.orElseThrow().accept(this);
    }
    finishBody();

    FunctionFlow flow =
        new FunctionFlow(
            pFunction,
            functionContext.getEntry(),
            functionContext.getReturnJump(),
            functionContext.getExceptionJump());
    leaveSubprogram();
    graph.registerFunctionFlow(pFunction, flow);
    return null;
  }

  @Override
  public Void visit(ModifierDefinition pModifier) {
    if (graph.isConstructed(pModifier)) {
      logger.log(Level.FINE, "Skipping modifier", pModifier.getName(), "with existing CFG");
      return null;
    }
    FlowContext modifierContext = enterSubprogram(pModifier, true);
    recordParameters(pModifier.getParameters());
    startBody();
    pModifier.getBody().accept(this);
    finishBody();

    ModifierFlow flow =
        new ModifierFlow(
            pModifier,
            modifierContext.getEntry(),
            modifierContext.getReturnJump(),
            modifierContext.getExceptionJump(),
            modifierContext.getPlaceholders());
    leaveSubprogram();
    graph.registerModifierFlow(pModifier, flow);
    return null;
  }

  @Override
  public Void visit(ModifierInvocation pInvocation) {
    // composition with modifiers happens when flows are linked
    return null;
  }

  @Override
  public Void visit(VariableDeclaration pDeclaration) {
    if (context == null) {
      // state variable, its initializer runs in the constructor
      return null;
    }
    currentNode().getBlock().addVariableDeclaration(pDeclaration);
    return null;
  }

  // statements

  @Override
  public Void visit(Block pBlock) {
    for (Statement statement : pBlock.getStatements()) {
      statement.accept(this);
    }
    return null;
  }

  @Override
  public Void visit(ExpressionStatement pStatement) {
    pStatement.getExpression().accept(this);
    return null;
  }

  @Override
  public Void visit(VariableDeclarationStatement pStatement) {
    Optional<Expression> initialValue = pStatement.getInitialValue();
    if (initialValue.isPresent()) {
      initialValue.orElseThrow().accept(this);
    }
    for (VariableDeclaration declaration : pStatement.getDeclarations()) {
      declaration.accept(this);
    }
    return null;
  }

  @Override
  public Void visit(IfStatement pStatement) {
    pStatement.getCondition().accept(this);
    CFGNode beforeBranch = currentNode();

    CFGNode trueBranch = newNode();
    connect(beforeBranch, trueBranch);
    setCurrentNode(trueBranch);
    pStatement.getTrueStatement().accept(this);
    CFGNode trueEnd = currentNode();

    CFGNode afterBranch = newNode();
    connect(trueEnd, afterBranch);

    Optional<Statement> falseStatement = pStatement.getFalseStatement();
    if (falseStatement.isPresent()) {
      CFGNode falseBranch = newNode();
      connect(beforeBranch, falseBranch);
      setCurrentNode(falseBranch);
      falseStatement.orElseThrow().accept(this);
      connect(currentNode(), afterBranch);
    } else {
      connect(beforeBranch, afterBranch);
    }

    setCurrentNode(afterBranch);
    return null;
  }

  @Override
  public Void visit(WhileStatement pStatement) {
    if (pStatement.isDoWhile()) {
      return visitDoWhile(pStatement);
    }

    CFGNode condition = newNode();
    CFGNode afterLoop = newNode();
    connect(currentNode(), condition);

    setCurrentNode(condition);
    pStatement.getCondition().accept(this);
    CFGNode conditionEnd = currentNode();

    CFGNode body = newNode();
    connect(conditionEnd, body);
    connect(conditionEnd, afterLoop);

    context().enterLoop(afterLoop, condition);
    setCurrentNode(body);
    pStatement.getBody().accept(this);
    connect(currentNode(), condition);
    context().leaveLoop();

    setCurrentNode(afterLoop);
    return null;
  }

  private Void visitDoWhile(WhileStatement pStatement) {
    CFGNode body = newNode();
    CFGNode condition = newNode();
    CFGNode afterLoop = newNode();
    connect(currentNode(), body);

    context().enterLoop(afterLoop, condition);
    setCurrentNode(body);
    pStatement.getBody().accept(this);
    connect(currentNode(), condition);
    context().leaveLoop();

    setCurrentNode(condition);
    pStatement.getCondition().accept(this);
    CFGNode conditionEnd = currentNode();
    connect(conditionEnd, body);
    connect(conditionEnd, afterLoop);

    setCurrentNode(afterLoop);
    return null;
  }

  @Override
  public Void visit(ForStatement pStatement) {
    Optional<Statement> initialization = pStatement.getInitializationExpression();
    if (initialization.isPresent()) {
      initialization.orElseThrow().accept(this);
    }

    CFGNode condition = newNode();
    CFGNode loopExpression = newNode();
    CFGNode afterLoop = newNode();
    connect(currentNode(), condition);

    CFGNode body = newNode();
    setCurrentNode(condition);
    Optional<Expression> conditionExpression = pStatement.getCondition();
    if (conditionExpression.isPresent()) {
      conditionExpression.orElseThrow().accept(this);
      CFGNode conditionEnd = currentNode();
      connect(conditionEnd, body);
      connect(conditionEnd, afterLoop);
    } else {
      // without condition the loop is only left by break
      connect(condition, body);
    }

    context().enterLoop(afterLoop, loopExpression);
    setCurrentNode(body);
    pStatement.getBody().accept(this);
    connect(currentNode(), loopExpression);
    context().leaveLoop();

    setCurrentNode(loopExpression);
    Optional<ExpressionStatement> increment = pStatement.getLoopExpression();
    if (increment.isPresent()) {
      increment.orElseThrow().accept(this);
    }
    connect(currentNode(), condition);

    setCurrentNode(afterLoop);
    return null;
  }

  @Override
  public Void visit(Break pStatement) {
    Optional<CFGNode> target = context().getBreakTarget();
    if (target.isEmpty()) {
      errorReporter.error(
          pStatement.getFileLocation(), "\"break\" has to be in a \"for\" or \"while\" loop.");
      return null;
    }
    connect(currentNode(), target.orElseThrow());
    diverge();
    return null;
  }

  @Override
  public Void visit(Continue pStatement) {
    Optional<CFGNode> target = context().getContinueTarget();
    if (target.isEmpty()) {
      errorReporter.error(
          pStatement.getFileLocation(), "\"continue\" has to be in a \"for\" or \"while\" loop.");
      return null;
    }
    connect(currentNode(), target.orElseThrow());
    diverge();
    return null;
  }

  @Override
  public Void visit(Return pStatement) {
    Optional<Expression> expression = pStatement.getExpression();
    if (expression.isPresent()) {
      expression.orElseThrow().accept(this);
    }
    if (!currentNode().getBlock().setReturnStatement(pStatement)) {
      errorReporter.error(
          pStatement.getFileLocation(),
          "Internal error: control flow block "
              + currentNode()
              + " already ends with a return statement.");
    }
    connect(currentNode(), context().getReturnJump());
    diverge();
    return null;
  }

  @Override
  public Void visit(Throw pStatement) {
    connect(currentNode(), context().getExceptionJump());
    diverge();
    return null;
  }

  @Override
  public Void visit(EmitStatement pStatement) {
    pStatement.getEventCall().accept(this);
    return null;
  }

  @Override
  public Void visit(InlineAssembly pStatement) {
    currentNode().getBlock().addInlineAssembly(pStatement);
    return null;
  }

  @Override
  public Void visit(PlaceholderStatement pStatement) {
    if (!context().isModifier()) {
      errorReporter.error(
          pStatement.getFileLocation(), "Placeholder statements are only allowed in modifiers.");
      return null;
    }
    PlaceholderCut cut = new PlaceholderCut(currentNode(), newNode());
    context().addPlaceholder(cut);
    logger.log(Level.FINER, "Cut at", cut, "in", context().getSubprogram().getName());
    setCurrentNode(cut.getNodeAfter());
    return null;
  }

  @Override
  public Void visit(TryStatement pStatement) {
    errorReporter.report(
        unsupportedConstructSeverity,
        pStatement.getFileLocation(),
        "Control flow of try statements is not supported, its contents are recorded without"
            + " branching.");
    pStatement.accept(new FlatRecorder(currentNode().getBlock()));
    return null;
  }

  // expressions, appended after their operands

  @Override
  public Void visit(Identifier pIdentifier) {
    append(pIdentifier);
    return null;
  }

  @Override
  public Void visit(Literal pLiteral) {
    append(pLiteral);
    return null;
  }

  @Override
  public Void visit(UnaryOperation pOperation) {
    pOperation.getSubExpression().accept(this);
    append(pOperation);
    return null;
  }

  @Override
  public Void visit(BinaryOperation pOperation) {
    pOperation.getLeftExpression().accept(this);
    if (!pOperation.getOperator().isShortCircuit()) {
      pOperation.getRightExpression().accept(this);
      append(pOperation);
      return null;
    }

    CFGNode fork = currentNode();
    CFGNode evaluateRight = newNode();
    CFGNode afterOperation = newNode();
    connect(fork, evaluateRight);
    connect(fork, afterOperation);

    setCurrentNode(evaluateRight);
    pOperation.getRightExpression().accept(this);
    connect(currentNode(), afterOperation);

    setCurrentNode(afterOperation);
    append(pOperation);
    return null;
  }

  @Override
  public Void visit(Assignment pAssignment) {
    pAssignment.getLeftHandSide().accept(this);
    pAssignment.getRightHandSide().accept(this);
    append(pAssignment);
    return null;
  }

  @Override
  public Void visit(Conditional pConditional) {
    pConditional.getCondition().accept(this);
    CFGNode fork = currentNode();

    CFGNode trueBranch = newNode();
    CFGNode falseBranch = newNode();
    CFGNode afterConditional = newNode();
    connect(fork, trueBranch);
    connect(fork, falseBranch);

    setCurrentNode(trueBranch);
    pConditional.getTrueExpression().accept(this);
    connect(currentNode(), afterConditional);

    setCurrentNode(falseBranch);
    pConditional.getFalseExpression().accept(this);
    connect(currentNode(), afterConditional);

    setCurrentNode(afterConditional);
    append(pConditional);
    return null;
  }

  @Override
  public Void visit(FunctionCall pCall) {
    pCall.getFunctionExpression().accept(this);
    for (Expression argument : pCall.getArguments()) {
      argument.accept(this);
    }
    append(pCall);

    if (pCall.getKind() == CallKind.REVERT) {
      connect(currentNode(), context().getExceptionJump());
      diverge();
    } else if (callFailurePolicy.mayFail(pCall)) {
      CFGNode beforeCall = currentNode();
      CFGNode afterCall = newNode();
      connect(beforeCall, context().getExceptionJump());
      connect(beforeCall, afterCall);
      setCurrentNode(afterCall);
    }
    return null;
  }

  @Override
  public Void visit(MemberAccess pAccess) {
    pAccess.getExpression().accept(this);
    append(pAccess);
    return null;
  }

  @Override
  public Void visit(IndexAccess pAccess) {
    pAccess.getBaseExpression().accept(this);
    Optional<Expression> index = pAccess.getIndexExpression();
    if (index.isPresent()) {
      index.orElseThrow().accept(this);
    }
    append(pAccess);
    return null;
  }

  @Override
  public Void visit(TupleExpression pTuple) {
    for (Expression component : pTuple.getComponents()) {
      component.accept(this);
    }
    append(pTuple);
    return null;
  }

  /**
   * Appends all expressions, declarations and inline assembly below a node to one block, in source
   * order and without creating any node or edge. Jumps and return statements are ignored.
   */
  private static final class FlatRecorder
      implements ExpressionVisitor<Void, NoException>, StatementVisitor<Void, NoException> {

    private final ControlFlowBlock block;

    FlatRecorder(ControlFlowBlock pBlock) {
      block = pBlock;
    }

    private void recordExpression(Optional<? extends Expression> pExpression) {
      if (pExpression.isPresent()) {
        pExpression.orElseThrow().accept(this);
      }
    }

    private void recordStatement(Optional<? extends Statement> pStatement) {
      if (pStatement.isPresent()) {
        pStatement.orElseThrow().accept(this);
      }
    }

    @Override
    public Void visit(Block pBlock) {
      for (Statement statement : pBlock.getStatements()) {
        statement.accept(this);
      }
      return null;
    }

    @Override
    public Void visit(ExpressionStatement pStatement) {
      return pStatement.getExpression().accept(this);
    }

    @Override
    public Void visit(VariableDeclarationStatement pStatement) {
      recordExpression(pStatement.getInitialValue());
      for (VariableDeclaration declaration : pStatement.getDeclarations()) {
        block.addVariableDeclaration(declaration);
      }
      return null;
    }

    @Override
    public Void visit(IfStatement pStatement) {
      pStatement.getCondition().accept(this);
      pStatement.getTrueStatement().accept(this);
      recordStatement(pStatement.getFalseStatement());
      return null;
    }

    @Override
    public Void visit(WhileStatement pStatement) {
      if (pStatement.isDoWhile()) {
        pStatement.getBody().accept(this);
        pStatement.getCondition().accept(this);
      } else {
        pStatement.getCondition().accept(this);
        pStatement.getBody().accept(this);
      }
      return null;
    }

    @Override
    public Void visit(ForStatement pStatement) {
      recordStatement(pStatement.getInitializationExpression());
      recordExpression(pStatement.getCondition());
      pStatement.getBody().accept(this);
      recordStatement(pStatement.getLoopExpression());
      return null;
    }

    @Override
    public Void visit(Continue pStatement) {
      return null;
    }

    @Override
    public Void visit(Break pStatement) {
      return null;
    }

    @Override
    public Void visit(Return pStatement) {
      recordExpression(pStatement.getExpression());
      return null;
    }

    @Override
    public Void visit(Throw pStatement) {
      return null;
    }

    @Override
    public Void visit(EmitStatement pStatement) {
      return pStatement.getEventCall().accept(this);
    }

    @Override
    public Void visit(InlineAssembly pStatement) {
      block.addInlineAssembly(pStatement);
      return null;
    }

    @Override
    public Void visit(PlaceholderStatement pStatement) {
      return null;
    }

    @Override
    public Void visit(TryStatement pStatement) {
      pStatement.getExternalCall().accept(this);
      for (Block clause : pStatement.getClauses()) {
        clause.accept(this);
      }
      return null;
    }

    @Override
    public Void visit(Identifier pIdentifier) {
      block.addExpression(pIdentifier);
      return null;
    }

    @Override
    public Void visit(Literal pLiteral) {
      block.addExpression(pLiteral);
      return null;
    }

    @Override
    public Void visit(UnaryOperation pOperation) {
      pOperation.getSubExpression().accept(this);
      block.addExpression(pOperation);
      return null;
    }

    @Override
    public Void visit(BinaryOperation pOperation) {
      pOperation.getLeftExpression().accept(this);
      pOperation.getRightExpression().accept(this);
      block.addExpression(pOperation);
      return null;
    }

    @Override
    public Void visit(Assignment pAssignment) {
      pAssignment.getLeftHandSide().accept(this);
      pAssignment.getRightHandSide().accept(this);
      block.addExpression(pAssignment);
      return null;
    }

    @Override
    public Void visit(Conditional pConditional) {
      pConditional.getCondition().accept(this);
      pConditional.getTrueExpression().accept(this);
      pConditional.getFalseExpression().accept(this);
      block.addExpression(pConditional);
      return null;
    }

    @Override
    public Void visit(FunctionCall pCall) {
      pCall.getFunctionExpression().accept(this);
      for (Expression argument : pCall.getArguments()) {
        argument.accept(this);
      }
      block.addExpression(pCall);
      return null;
    }

    @Override
    public Void visit(MemberAccess pAccess) {
      pAccess.getExpression().accept(this);
      block.addExpression(pAccess);
      return null;
    }

    @Override
    public Void visit(IndexAccess pAccess) {
      pAccess.getBaseExpression().accept(this);
      recordExpression(pAccess.getIndexExpression());
      block.addExpression(pAccess);
      return null;
    }

    @Override
    public Void visit(TupleExpression pTuple) {
      for (Expression component : pTuple.getComponents()) {
        component.accept(this);
      }
      block.addExpression(pTuple);
      return null;
    }
  }
}
