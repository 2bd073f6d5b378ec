// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.sosy_lab.solidity_cfa.ast.ModifierDefinition;

/**
 * Describes the control flow of a modifier. In addition to the anchors of a {@link FunctionFlow}
 * it lists the placeholder cuts in source order.
 *
 * <p>E.g. the control flow of a function with a single modifier is the control flow of the
 * modifier in which the first node of each placeholder is connected to the function's entry node
 * and the function's exit node is connected to the second node of each placeholder.
 */
public final class ModifierFlow extends FunctionFlow {

  private final ImmutableList<PlaceholderCut> placeholders;

  ModifierFlow(
      ModifierDefinition pDefinition,
      CFGNode pEntry,
      CFGNode pExit,
      CFGNode pException,
      List<PlaceholderCut> pPlaceholders) {
    super(pDefinition, pEntry, pExit, pException);
    placeholders = ImmutableList.copyOf(pPlaceholders);
  }

  @Override
  public ModifierDefinition getDefinition() {
    return (ModifierDefinition) super.getDefinition();
  }

  public ImmutableList<PlaceholderCut> getPlaceholders() {
    return placeholders;
  }

  @Override
  public String toString() {
    return super.toString() + " with " + placeholders;
  }
}
