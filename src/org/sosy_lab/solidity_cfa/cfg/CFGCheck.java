// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import static com.google.common.base.Verify.verify;

import com.google.common.base.Joiner;
import com.google.common.base.VerifyException;
import java.util.HashSet;
import java.util.Set;

/** Verifies the structural properties every constructed function and modifier CFG has. */
public final class CFGCheck {

  private CFGCheck() {}

  /**
   * Run all checks on every node of the given flow.
   *
   * @param pGraph graph the flow belongs to
   * @param pFlow flow of a function or modifier
   * @return true if all checks succeed
   * @throws VerifyException if not all checks succeed
   */
  public static boolean check(ControlFlowGraph pGraph, FunctionFlow pFlow)
      throws VerifyException {
    for (CFGNode node : pGraph.nodesOf(pFlow.getDefinition())) {
      verify(
          node.getSubprogram() == pFlow.getDefinition(),
          "Node %s is not from the same subprogram as %s",
          debugFormat(node),
          pFlow);
      verify(node.getBlock().isSealed(), "Block of node %s is not sealed", debugFormat(node));
      isConsistentAsGraphNode(pGraph, node);
      hasConsistentReturn(pFlow, node);
    }
    hasAnchorShape(pFlow);
    if (pFlow instanceof ModifierFlow) {
      for (PlaceholderCut cut : ((ModifierFlow) pFlow).getPlaceholders()) {
        verify(
            !cut.getNodeBefore().hasEdgeTo(cut.getNodeAfter())
                && !cut.getNodeAfter().hasEdgeTo(cut.getNodeBefore()),
            "Placeholder %s is bridged by an edge",
            cut);
      }
    }
    return true;
  }

  /** Check every registered flow and the edges of every node in the arena. */
  public static boolean checkFull(ControlFlowGraph pGraph) throws VerifyException {
    for (FunctionFlow flow : pGraph.getFunctionFlows().values()) {
      check(pGraph, flow);
    }
    for (ModifierFlow flow : pGraph.getModifierFlows().values()) {
      check(pGraph, flow);
    }
    for (CFGNode node : pGraph.getNodes()) {
      verify(
          pGraph.getNode(node.getNodeNumber()) == node,
          "Node %s is stored under a different number",
          debugFormat(node));
      isConsistentAsGraphNode(pGraph, node);
    }
    return true;
  }

  /**
   * This method returns a lazy object where {@link Object#toString} can be called. In most cases we
   * do not need to build the String.
   */
  private static Object debugFormat(CFGNode pNode) {
    return new Object() {
      @Override
      public String toString() {
        return pNode.getSubprogram().getName()
            + ":"
            + pNode
            + " ("
            + pNode.getSubprogram().getFileLocation()
            + ") with entries ["
            + Joiner.on(", ").join(pNode.getEntries())
            + "] and exits ["
            + Joiner.on(", ").join(pNode.getExits())
            + "]";
      }
    };
  }

  private static void hasAnchorShape(FunctionFlow pFlow) {
    CFGNode entry = pFlow.getEntry();
    verify(
        entry.getNumEnteringEdges() == 0, "Entry node %s has entering edges", debugFormat(entry));
    verify(
        entry.getNumLeavingEdges() == 1,
        "Entry node %s does not have exactly one leaving edge",
        debugFormat(entry));

    CFGNode exit = pFlow.getExit();
    verify(exit.getNumLeavingEdges() == 0, "Exit node %s is not a dead end", debugFormat(exit));
    verify(exit.getBlock().isEmpty(), "Exit node %s has a non-empty block", debugFormat(exit));

    CFGNode exception = pFlow.getException();
    verify(
        exception.getNumLeavingEdges() == 0,
        "Exception node %s is not a dead end",
        debugFormat(exception));
    verify(
        exception.getBlock().isEmpty(),
        "Exception node %s has a non-empty block",
        debugFormat(exception));
  }

  private static void hasConsistentReturn(FunctionFlow pFlow, CFGNode pNode) {
    if (pNode.getBlock().getReturnStatement().isPresent()) {
      verify(
          CFGUtils.successorsOf(pNode).allMatch(s -> s == pFlow.getExit()),
          "Node %s ends with a return statement but does not only lead to the exit node",
          debugFormat(pNode));
    }
  }

  /**
   * Check all entering and leaving edges for corresponding leaving/entering edges at
   * predecessor/successor nodes, and that there are no duplicates.
   */
  private static void isConsistentAsGraphNode(ControlFlowGraph pGraph, CFGNode pNode) {
    verify(pNode.belongsTo(pGraph), "Node %s is not part of the graph", pNode);
    Set<CFGNode> seenNodes = new HashSet<>();

    for (CFGNode successor : CFGUtils.successorsOf(pNode)) {
      verify(
          seenNodes.add(successor),
          "Duplicate successor %s for node %s",
          successor,
          debugFormat(pNode));
      verify(
          successor.getSubprogram() == pNode.getSubprogram(),
          "Edge from %s leaves its subprogram to %s",
          debugFormat(pNode),
          debugFormat(successor));
      verify(
          successor.getEntries().contains(pNode),
          "Node %s has successor %s, but %s does not have it as predecessor",
          debugFormat(pNode),
          successor,
          debugFormat(successor));
    }

    seenNodes.clear();

    for (CFGNode predecessor : CFGUtils.predecessorsOf(pNode)) {
      verify(
          seenNodes.add(predecessor),
          "Duplicate predecessor %s for node %s",
          predecessor,
          debugFormat(pNode));
      verify(
          predecessor.getExits().contains(pNode),
          "Node %s has predecessor %s, but %s does not have it as successor",
          debugFormat(pNode),
          predecessor,
          debugFormat(predecessor));
    }
  }
}
