// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.errors;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.sosy_lab.solidity_cfa.ast.FileLocation;

/** A reported problem together with its location. */
public final class Diagnostic {

  private final Severity severity;
  private final FileLocation location;
  private final String message;

  public Diagnostic(Severity pSeverity, FileLocation pLocation, String pMessage) {
    severity = checkNotNull(pSeverity);
    location = checkNotNull(pLocation);
    message = checkNotNull(pMessage);
  }

  public Severity getSeverity() {
    return severity;
  }

  public FileLocation getLocation() {
    return location;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic other = (Diagnostic) pObj;
    return severity == other.severity
        && location.equals(other.location)
        && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(severity, location, message);
  }

  @Override
  public String toString() {
    return location + ": " + severity + ": " + message;
  }
}
