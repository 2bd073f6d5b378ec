// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class of all nodes of the resolved Solidity AST.
 *
 * <p>Nodes are immutable. They deliberately do not override {@link Object#equals(Object)}, so two
 * structurally equal nodes at different places of the tree stay distinct keys of a map.
 */
public abstract class AstNode {

  private final FileLocation fileLocation;

  protected AstNode(FileLocation pFileLocation) {
    fileLocation = checkNotNull(pFileLocation);
  }

  public FileLocation getFileLocation() {
    return fileLocation;
  }

  /** Source-like representation of this node, mostly for debugging and graph labels. */
  public abstract String toASTString();

  public abstract <R, X extends Exception> R accept(AstNodeVisitor<R, X> pVisitor) throws X;

  @Override
  public String toString() {
    return toASTString();
  }
}
