// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.graph.Traverser;
import java.util.Optional;
import org.sosy_lab.solidity_cfa.ast.Declaration;
import org.sosy_lab.solidity_cfa.ast.Expression;

/** Helper methods for iterating over the nodes of a {@link ControlFlowGraph}. */
public final class CFGUtils {

  private CFGUtils() {}

  public static FluentIterable<CFGNode> successorsOf(CFGNode pNode) {
    return FluentIterable.from(pNode.getExits());
  }

  public static FluentIterable<CFGNode> predecessorsOf(CFGNode pNode) {
    return FluentIterable.from(pNode.getEntries());
  }

  /** All nodes reachable from the given node, including itself, in depth-first pre-order. */
  public static ImmutableSet<CFGNode> reachableNodes(CFGNode pStart) {
    return ImmutableSet.copyOf(
        Traverser.forGraph(CFGUtils::successorsOf).depthFirstPreOrder(pStart));
  }

  /** All nodes of the flow that can be reached from its entry node. */
  public static ImmutableSet<CFGNode> reachableNodes(FunctionFlow pFlow) {
    return reachableNodes(pFlow.getEntry());
  }

  /**
   * The node of the given subprogram whose block contains exactly this expression, compared by
   * identity.
   */
  public static Optional<CFGNode> nodeContaining(
      ControlFlowGraph pGraph, Declaration pSubprogram, Expression pExpression) {
    return FluentIterable.from(pGraph.nodesOf(pSubprogram))
        .firstMatch(n -> Iterables.any(n.getBlock().getExpressions(), e -> e == pExpression))
        .toJavaUtil();
  }
}
