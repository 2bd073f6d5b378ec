// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.solidity_cfa.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Use of a modifier in the header of a function, e.g. {@code onlyOwner} or {@code costs(10)}. */
public final class ModifierInvocation extends AstNode {

  private final String modifierName;
  private final ImmutableList<Expression> arguments;

  public ModifierInvocation(
      FileLocation pFileLocation, String pModifierName, List<? extends Expression> pArguments) {
    super(pFileLocation);
    modifierName = checkNotNull(pModifierName);
    arguments = ImmutableList.copyOf(pArguments);
  }

  public String getModifierName() {
    return modifierName;
  }

  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  @Override
  public String toASTString() {
    if (arguments.isEmpty()) {
      return modifierName;
    }
    return modifierName
        + "("
        + FluentIterable.from(arguments).transform(Expression::toASTString).join(Joiner.on(", "))
        + ")";
  }

  @Override
  public <R, X extends Exception> R accept(AstNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }
}
