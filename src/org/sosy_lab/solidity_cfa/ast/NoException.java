// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

/**
 * Exception type parameter for visitors that do not throw checked exceptions. It can never be
 * instantiated.
 */
public final class NoException extends RuntimeException {

  private static final long serialVersionUID = -4214453738436717025L;

  private NoException() {}
}
