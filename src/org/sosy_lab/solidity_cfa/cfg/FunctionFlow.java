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

import com.google.common.collect.ImmutableList;
import org.sosy_lab.solidity_cfa.ast.Declaration;

/**
 * Describes the control flow of a function by its three anchor nodes.
 *
 * <ul>
 *   <li>The entry node has no entering edges and exactly one leaving edge. It holds the
 *       declarations of the parameters and return parameters.
 *   <li>The exit node has no leaving edges, its entering edges come from every return statement
 *       and from the end of the body.
 *   <li>The exception node has no leaving edges, its entering edges come from every revert, throw
 *       and every call that may fail.
 * </ul>
 */
public class FunctionFlow {

  private final Declaration definition;
  private final CFGNode entry;
  private final CFGNode exit;
  private final CFGNode exception;

  FunctionFlow(Declaration pDefinition, CFGNode pEntry, CFGNode pExit, CFGNode pException) {
    definition = checkNotNull(pDefinition);
    entry = checkNotNull(pEntry);
    exit = checkNotNull(pExit);
    exception = checkNotNull(pException);
    checkArgument(
        entry != exit && entry != exception && exit != exception, "anchors must be distinct");
  }

  /** The function or modifier definition this flow belongs to. */
  public Declaration getDefinition() {
    return definition;
  }

  public String getName() {
    return definition.getName();
  }

  public CFGNode getEntry() {
    return entry;
  }

  public CFGNode getExit() {
    return exit;
  }

  public CFGNode getException() {
    return exception;
  }

  public ImmutableList<CFGNode> getAnchors() {
    return ImmutableList.of(entry, exit, exception);
  }

  @Override
  public String toString() {
    return "flow of "
        + getName()
        + " (entry "
        + entry
        + ", exit "
        + exit
        + ", exception "
        + exception
        + ")";
  }
}
