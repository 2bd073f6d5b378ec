// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.errors;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.solidity_cfa.ast.FileLocation;

/** {@link ErrorReporter} that logs every diagnostic and keeps it for later inspection. */
public class CollectingErrorReporter implements ErrorReporter {

  private final LogManager logger;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public CollectingErrorReporter(LogManager pLogger) {
    logger = pLogger.withComponentName(CollectingErrorReporter.class.getSimpleName());
  }

  @Override
  public void report(Severity pSeverity, FileLocation pLocation, String pMessage) {
    Diagnostic diagnostic = new Diagnostic(pSeverity, pLocation, pMessage);
    diagnostics.add(diagnostic);
    logger.log(pSeverity.getLogLevel(), diagnostic);
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public ImmutableList<Diagnostic> getErrors() {
    return FluentIterable.from(diagnostics).filter(d -> d.getSeverity().isError()).toList();
  }

  public boolean hasErrors() {
    return FluentIterable.from(diagnostics).anyMatch(d -> d.getSeverity().isError());
  }

  public void clear() {
    diagnostics.clear();
  }
}
