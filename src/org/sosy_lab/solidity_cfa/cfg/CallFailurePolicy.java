// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import com.google.common.collect.Sets;
import java.util.Set;
import org.sosy_lab.solidity_cfa.ast.FunctionCall;
import org.sosy_lab.solidity_cfa.ast.FunctionCall.CallKind;

/**
 * Decides which calls may abort the execution of the current transaction. The node of such a
 * call gets an additional edge to the exception node of its function or modifier.
 */
@FunctionalInterface
public interface CallFailurePolicy {

  boolean mayFail(FunctionCall pCall);

  /** Policy under which exactly the calls of the given kinds may fail. */
  static CallFailurePolicy forKinds(Set<CallKind> pKinds) {
    Set<CallKind> kinds = Sets.immutableEnumSet(pKinds);
    return call -> kinds.contains(call.getKind());
  }
}
