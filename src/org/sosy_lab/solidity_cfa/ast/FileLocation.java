// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.Objects;

/** Position of an AST node in a source file. */
public final class FileLocation implements Serializable {

  private static final long serialVersionUID = 6652099907084949014L;

  public static final FileLocation DUMMY = new FileLocation("<none>", 0, 0, 0);

  private final String fileName;
  private final int startingLine;
  private final int nodeOffset;
  private final int totalLength;

  public FileLocation(String pFileName, int pStartingLine, int pOffset, int pLength) {
    checkArgument(pStartingLine >= 0, "negative line number %s", pStartingLine);
    checkArgument(pOffset >= 0 && pLength >= 0);
    fileName = checkNotNull(pFileName);
    startingLine = pStartingLine;
    nodeOffset = pOffset;
    totalLength = pLength;
  }

  public String getFileName() {
    return fileName;
  }

  public int getStartingLineNumber() {
    return startingLine;
  }

  public int getNodeOffset() {
    return nodeOffset;
  }

  public int getNodeLength() {
    return totalLength;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof FileLocation)) {
      return false;
    }
    FileLocation other = (FileLocation) pObj;
    return startingLine == other.startingLine
        && nodeOffset == other.nodeOffset
        && totalLength == other.totalLength
        && fileName.equals(other.fileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fileName, startingLine, nodeOffset, totalLength);
  }

  @Override
  public String toString() {
    if (this.equals(DUMMY)) {
      return "none";
    }
    return fileName + ":" + startingLine;
  }
}
