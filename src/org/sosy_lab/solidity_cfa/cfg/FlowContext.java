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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.solidity_cfa.ast.Declaration;

/**
 * Mutable traversal state while the body of one function or modifier is visited.
 *
 * <p>A node is live if control can flow into it: it has an entering edge, it is the entry node, or
 * it follows a placeholder whose preceding node is live. Code after a return, break, continue or
 * revert is recorded into fresh nodes that are not live, and no edges leave such nodes.
 */
final class FlowContext {

  private final Declaration subprogram;
  private final CFGNode entry;
  private final CFGNode exit;
  private final CFGNode exception;

  private CFGNode currentNode;

  private final Deque<CFGNode> breakJumps = new ArrayDeque<>();
  private final Deque<CFGNode> continueJumps = new ArrayDeque<>();

  // null for functions
  private final @Nullable List<PlaceholderCut> placeholders;
  private final Set<CFGNode> liveSpliceTargets = new HashSet<>();

  FlowContext(
      Declaration pSubprogram,
      CFGNode pEntry,
      CFGNode pExit,
      CFGNode pException,
      boolean pIsModifier) {
    subprogram = checkNotNull(pSubprogram);
    entry = checkNotNull(pEntry);
    exit = checkNotNull(pExit);
    exception = checkNotNull(pException);
    currentNode = entry;
    placeholders = pIsModifier ? new ArrayList<>() : null;
  }

  Declaration getSubprogram() {
    return subprogram;
  }

  CFGNode getEntry() {
    return entry;
  }

  /** Target of return statements. */
  CFGNode getReturnJump() {
    return exit;
  }

  /** Target of reverts and failing calls. */
  CFGNode getExceptionJump() {
    return exception;
  }

  CFGNode getCurrentNode() {
    return currentNode;
  }

  void setCurrentNode(CFGNode pNode) {
    currentNode = checkNotNull(pNode);
  }

  boolean isLive(CFGNode pNode) {
    return pNode == entry || pNode.getNumEnteringEdges() > 0 || liveSpliceTargets.contains(pNode);
  }

  void enterLoop(CFGNode pBreakTarget, CFGNode pContinueTarget) {
    breakJumps.push(pBreakTarget);
    continueJumps.push(pContinueTarget);
  }

  void leaveLoop() {
    checkState(!breakJumps.isEmpty() && !continueJumps.isEmpty(), "not inside a loop");
    breakJumps.pop();
    continueJumps.pop();
  }

  Optional<CFGNode> getBreakTarget() {
    return Optional.ofNullable(breakJumps.peek());
  }

  Optional<CFGNode> getContinueTarget() {
    return Optional.ofNullable(continueJumps.peek());
  }

  boolean isModifier() {
    return placeholders != null;
  }

  void addPlaceholder(PlaceholderCut pCut) {
    checkState(placeholders != null, "placeholder outside of modifier");
    placeholders.add(pCut);
    if (isLive(pCut.getNodeBefore())) {
      liveSpliceTargets.add(pCut.getNodeAfter());
    }
  }

  ImmutableList<PlaceholderCut> getPlaceholders() {
    checkState(placeholders != null, "functions have no placeholders");
    return ImmutableList.copyOf(placeholders);
  }
}
