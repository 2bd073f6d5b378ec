// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.solidity_cfa.ast.Declaration;

/**
 * Node of the control-flow graph.
 *
 * <p>Nodes live in the arena of their {@link ControlFlowGraph} and refer to their neighbours by
 * node number. Edges only come into existence through {@link ControlFlowGraph#addEdge}, which
 * updates both ends, so every leaving edge of a node is an entering edge of its successor.
 */
public final class CFGNode implements Comparable<CFGNode> {

  private final int nodeNumber;
  private final ControlFlowGraph graph;
  private final Declaration subprogram;
  private final ControlFlowBlock block = new ControlFlowBlock();

  private final List<Integer> entries = new ArrayList<>(1);
  private final List<Integer> exits = new ArrayList<>(2);

  CFGNode(int pNodeNumber, ControlFlowGraph pGraph, Declaration pSubprogram) {
    nodeNumber = pNodeNumber;
    graph = checkNotNull(pGraph);
    subprogram = checkNotNull(pSubprogram);
  }

  /** Index of this node in the arena of its graph. */
  public int getNodeNumber() {
    return nodeNumber;
  }

  /** The function or modifier definition this node was created for. */
  public Declaration getSubprogram() {
    return subprogram;
  }

  public ControlFlowBlock getBlock() {
    return block;
  }

  public int getNumEnteringEdges() {
    return entries.size();
  }

  public CFGNode getEnteringNode(int pIndex) {
    return graph.getNode(entries.get(pIndex));
  }

  public int getNumLeavingEdges() {
    return exits.size();
  }

  public CFGNode getLeavingNode(int pIndex) {
    return graph.getNode(exits.get(pIndex));
  }

  /** All nodes from which control may move into this node, in the order the edges were added. */
  public ImmutableList<CFGNode> getEntries() {
    return resolve(entries);
  }

  /** All nodes to which control may continue after this node. */
  public ImmutableList<CFGNode> getExits() {
    return resolve(exits);
  }

  private ImmutableList<CFGNode> resolve(List<Integer> pNodeNumbers) {
    ImmutableList.Builder<CFGNode> result =
        ImmutableList.builderWithExpectedSize(pNodeNumbers.size());
    for (int number : pNodeNumbers) {
      result.add(graph.getNode(number));
    }
    return result.build();
  }

  public boolean hasEdgeTo(CFGNode pOther) {
    return pOther.graph == graph && exits.contains(pOther.nodeNumber);
  }

  boolean belongsTo(ControlFlowGraph pGraph) {
    return graph == pGraph;
  }

  void addLeavingEdge(CFGNode pSuccessor) {
    exits.add(pSuccessor.nodeNumber);
  }

  void addEnteringEdge(CFGNode pPredecessor) {
    entries.add(pPredecessor.nodeNumber);
  }

  @Override
  public int compareTo(CFGNode pOther) {
    return Integer.compare(nodeNumber, pOther.nodeNumber);
  }

  @Override
  public String toString() {
    return "N" + nodeNumber;
  }
}
