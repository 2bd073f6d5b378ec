// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.errors;

import org.sosy_lab.solidity_cfa.ast.FileLocation;

/**
 * Receives the problems found while processing an AST. Reporting never interrupts the caller, so
 * implementations must not throw.
 */
public interface ErrorReporter {

  void report(Severity pSeverity, FileLocation pLocation, String pMessage);

  default void error(FileLocation pLocation, String pMessage) {
    report(Severity.ERROR, pLocation, pMessage);
  }

  default void warning(FileLocation pLocation, String pMessage) {
    report(Severity.WARNING, pLocation, pMessage);
  }
}
