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

/**
 * Location of a placeholder statement in the control flow of a modifier: the node before the
 * placeholder and the node after it, which are not connected.
 *
 * <p>When a function is composed with its modifiers, the linking phase connects {@link
 * #getNodeBefore()} to the entry of the wrapped flow and the exit of the wrapped flow to {@link
 * #getNodeAfter()}.
 */
public final class PlaceholderCut {

  private final CFGNode before;
  private final CFGNode after;

  PlaceholderCut(CFGNode pBefore, CFGNode pAfter) {
    before = checkNotNull(pBefore);
    after = checkNotNull(pAfter);
    checkArgument(before != after, "placeholder cut of %s with itself", before);
  }

  public CFGNode getNodeBefore() {
    return before;
  }

  public CFGNode getNodeAfter() {
    return after;
  }

  @Override
  public String toString() {
    return "placeholder " + before + " -/-> " + after;
  }
}
