// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.cfg;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.solidity_cfa.ast.FunctionCall.CallKind;
import org.sosy_lab.solidity_cfa.errors.Severity;

@Options(prefix = "cfg")
public final class CFGBuilderOptions {

  @Option(
      secure = true,
      description =
          "Kinds of calls that may abort the current execution. A node containing such a call "
              + "gets an additional edge to the exception node of its function or modifier. "
              + "Calls of kind REVERT always lead to the exception node.")
  private Set<CallKind> failingCalls =
      ImmutableSet.of(
          CallKind.ASSERT,
          CallKind.REQUIRE,
          CallKind.EXTERNAL,
          CallKind.CREATION,
          CallKind.TRANSFER);

  @Option(
      secure = true,
      description =
          "Severity of the diagnostic for statements without control-flow rule "
              + "(currently try statements). With ERROR, construction reports failure.")
  private Severity unsupportedConstructSeverity = Severity.WARNING;

  @Option(
      secure = true,
      description =
          "Verify the structure of every function and modifier CFG directly after its "
              + "construction. Mostly useful for debugging.")
  private boolean checkConsistency = false;

  public CFGBuilderOptions(Configuration pConfig) throws InvalidConfigurationException {
    pConfig.inject(this, CFGBuilderOptions.class);
    if (failingCalls.contains(CallKind.EVENT)) {
      throw new InvalidConfigurationException(
          "Events cannot fail, remove EVENT from option cfg.failingCalls");
    }
  }

  public ImmutableSet<CallKind> getFailingCalls() {
    return ImmutableSet.copyOf(failingCalls);
  }

  public Severity getUnsupportedConstructSeverity() {
    return unsupportedConstructSeverity;
  }

  public boolean checkConsistency() {
    return checkConsistency;
  }
}
