// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.errors;

import java.util.logging.Level;

public enum Severity {
  INFO(Level.INFO),
  WARNING(Level.WARNING),
  ERROR(Level.SEVERE);

  private final Level logLevel;

  Severity(Level pLogLevel) {
    logLevel = pLogLevel;
  }

  /** The level at which a diagnostic of this severity is logged. */
  public Level getLogLevel() {
    return logLevel;
  }

  public boolean isError() {
    return this == ERROR;
  }
}
