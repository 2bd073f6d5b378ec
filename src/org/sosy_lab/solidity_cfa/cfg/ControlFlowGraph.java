// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.solidity_cfa.ast.AstNode;
import org.sosy_lab.solidity_cfa.ast.Declaration;
import org.sosy_lab.solidity_cfa.ast.Expression;
import org.sosy_lab.solidity_cfa.ast.FileLocation;
import org.sosy_lab.solidity_cfa.ast.FunctionDefinition;
import org.sosy_lab.solidity_cfa.ast.ModifierDefinition;
import org.sosy_lab.solidity_cfa.ast.Statement;
import org.sosy_lab.solidity_cfa.errors.ErrorReporter;
import org.sosy_lab.solidity_cfa.errors.Severity;

/**
 * Control-flow graphs of all functions and modifiers of one or more source units.
 *
 * <p>All nodes live in one arena owned by this object and are identified by their node number.
 * {@link #constructFlow(AstNode)} may be called repeatedly, a function or modifier whose CFG
 * already exists is skipped. Once a function or modifier is registered, its nodes and edges do not
 * change anymore.
 *
 * <p>Instances are not thread-safe.
 */
public final class ControlFlowGraph {

  private final LogManager logger;
  private final ErrorReporter errorReporter;
  private final CFGBuilderOptions options;
  private final CallFailurePolicy callFailurePolicy;

  private final List<CFGNode> nodes = new ArrayList<>();
  private final ListMultimap<Declaration, CFGNode> nodesOfSubprogram =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  private final Map<FunctionDefinition, FunctionFlow> functionFlows = new LinkedHashMap<>();
  private final Map<ModifierDefinition, ModifierFlow> modifierFlows = new LinkedHashMap<>();

  /** Create an empty graph, failing calls are configured by option {@code cfg.failingCalls}. */
  public ControlFlowGraph(Configuration pConfig, LogManager pLogger, ErrorReporter pErrorReporter)
      throws InvalidConfigurationException {
    this(pConfig, pLogger, pErrorReporter, null);
  }

  /** Create an empty graph that decides with the given policy which calls may fail. */
  public ControlFlowGraph(
      Configuration pConfig,
      LogManager pLogger,
      ErrorReporter pErrorReporter,
      @Nullable CallFailurePolicy pCallFailurePolicy)
      throws InvalidConfigurationException {
    logger = pLogger.withComponentName(CFGBuilder.class.getSimpleName());
    errorReporter = checkNotNull(pErrorReporter);
    options = new CFGBuilderOptions(pConfig);
    callFailurePolicy =
        pCallFailurePolicy != null
            ? pCallFailurePolicy
            : CallFailurePolicy.forKinds(options.getFailingCalls());
  }

  /**
   * Construct the CFGs of all functions and modifiers in the given part of the AST.
   *
   * <p>The root has to be a source unit, contract, function or modifier. Problems are passed to the
   * error reporter of this graph.
   *
   * @return true iff no error was reported while processing this root
   */
  public boolean constructFlow(AstNode pRoot) {
    checkNotNull(pRoot);
    if (pRoot instanceof Statement || pRoot instanceof Expression) {
      errorReporter.error(
          pRoot.getFileLocation(),
          "Control flow can only be constructed for source units, contracts, functions "
              + "and modifiers.");
      return false;
    }

    CountingErrorReporter reporter = new CountingErrorReporter(errorReporter);
    CFGBuilder builder =
        new CFGBuilder(
            this,
            reporter,
            callFailurePolicy,
            options.getUnsupportedConstructSeverity(),
            logger);
    pRoot.accept(builder);
    return reporter.errors == 0;
  }

  /** The CFG of the given function, which has to be constructed already. */
  public FunctionFlow functionFlow(FunctionDefinition pFunction) {
    FunctionFlow flow = functionFlows.get(pFunction);
    checkArgument(flow != null, "No control flow constructed for function %s", pFunction.getName());
    return flow;
  }

  /** The CFG of the given modifier, which has to be constructed already. */
  public ModifierFlow modifierFlow(ModifierDefinition pModifier) {
    ModifierFlow flow = modifierFlows.get(pModifier);
    checkArgument(flow != null, "No control flow constructed for modifier %s", pModifier.getName());
    return flow;
  }

  public boolean isConstructed(Declaration pDefinition) {
    return functionFlows.containsKey(pDefinition) || modifierFlows.containsKey(pDefinition);
  }

  /** All function CFGs in the order they were constructed. */
  public ImmutableMap<FunctionDefinition, FunctionFlow> getFunctionFlows() {
    return ImmutableMap.copyOf(functionFlows);
  }

  /** All modifier CFGs in the order they were constructed. */
  public ImmutableMap<ModifierDefinition, ModifierFlow> getModifierFlows() {
    return ImmutableMap.copyOf(modifierFlows);
  }

  public CFGNode getNode(int pNodeNumber) {
    return nodes.get(pNodeNumber);
  }

  /** All nodes of the arena, ordered by node number. */
  public ImmutableList<CFGNode> getNodes() {
    return ImmutableList.copyOf(nodes);
  }

  public int getNumberOfNodes() {
    return nodes.size();
  }

  /** All nodes created for the given function or modifier, including unreachable ones. */
  public List<CFGNode> nodesOf(Declaration pDefinition) {
    return Collections.unmodifiableList(nodesOfSubprogram.get(pDefinition));
  }

  CFGNode newNode(Declaration pSubprogram) {
    CFGNode node = new CFGNode(nodes.size(), this, pSubprogram);
    nodes.add(node);
    nodesOfSubprogram.put(pSubprogram, node);
    return node;
  }

  /** Add an edge between two nodes of this graph. Adding an existing edge again has no effect. */
  void addEdge(CFGNode pFrom, CFGNode pTo) {
    checkArgument(pFrom.belongsTo(this), "%s is not part of this graph", pFrom);
    checkArgument(pTo.belongsTo(this), "%s is not part of this graph", pTo);
    if (pFrom.hasEdgeTo(pTo)) {
      return;
    }
    pFrom.addLeavingEdge(pTo);
    pTo.addEnteringEdge(pFrom);
  }

  void registerFunctionFlow(FunctionDefinition pFunction, FunctionFlow pFlow) {
    checkState(!functionFlows.containsKey(pFunction), "duplicate CFG for %s", pFunction.getName());
    finish(pFlow);
    functionFlows.put(pFunction, pFlow);
  }

  void registerModifierFlow(ModifierDefinition pModifier, ModifierFlow pFlow) {
    checkState(!modifierFlows.containsKey(pModifier), "duplicate CFG for %s", pModifier.getName());
    finish(pFlow);
    modifierFlows.put(pModifier, pFlow);
  }

  private void finish(FunctionFlow pFlow) {
    List<CFGNode> subprogramNodes = nodesOfSubprogram.get(pFlow.getDefinition());
    for (CFGNode node : subprogramNodes) {
      node.getBlock().seal();
    }
    if (options.checkConsistency()) {
      CFGCheck.check(this, pFlow);
    }
    logger.log(
        Level.FINE,
        "Constructed CFG of",
        pFlow.getName(),
        "with",
        subprogramNodes.size(),
        "nodes");
  }

  /** Forwards all diagnostics and remembers whether there were errors among them. */
  private static final class CountingErrorReporter implements ErrorReporter {

    private final ErrorReporter delegate;
    private int errors = 0;

    CountingErrorReporter(ErrorReporter pDelegate) {
      delegate = pDelegate;
    }

    @Override
    public void report(Severity pSeverity, FileLocation pLocation, String pMessage) {
      if (pSeverity.isError()) {
        errors++;
      }
      delegate.report(pSeverity, pLocation, pMessage);
    }
  }
}
