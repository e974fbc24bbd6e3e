// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.Expression;
import org.sosy_lab.decompiler.logic.BitvectorVariable;
import org.sosy_lab.decompiler.logic.BooleanVariable;
import org.sosy_lab.decompiler.logic.Formulas;

/**
 * Remembers which native expression an opaque variable of the condition algebra stands for.
 *
 * <p>Variables are named after the rendering and the width of the expression. Expressions that
 * render alike but differ (e.g., a register named like a temporary) get a numbered suffix, so every
 * variable stands for exactly one expression and the same expression always gets the same variable.
 * One mapping is shared by all regions of one structuring run.
 */
public final class ConditionVariableMapping {

  private final BiMap<String, Expression> booleanVariables = HashBiMap.create();
  private final BiMap<String, Expression> bitvectorVariables = HashBiMap.create();

  BooleanVariable booleanVariableFor(Expression pExpression) {
    return Formulas.makeVariable(
        nameFor(booleanVariables, "cond:" + signature(pExpression), pExpression));
  }

  BitvectorVariable bitvectorVariableFor(Expression pExpression) {
    return Formulas.makeBitvectorVariable(
        nameFor(bitvectorVariables, signature(pExpression), pExpression), pExpression.getBits());
  }

  private static String nameFor(
      BiMap<String, Expression> pVariables, String pSignature, Expression pExpression) {
    String name = pVariables.inverse().get(pExpression);
    if (name != null) {
      return name;
    }
    name = pSignature;
    for (int i = 1; pVariables.containsKey(name); i++) {
      name = pSignature + "#" + i;
    }
    pVariables.put(name, pExpression);
    return name;
  }

  /** The expression a variable stands for, or null if the variable is not known. */
  public @Nullable Expression getExpression(String pVariableName) {
    Expression expression = booleanVariables.get(pVariableName);
    return expression != null ? expression : bitvectorVariables.get(pVariableName);
  }

  public int size() {
    return booleanVariables.size() + bitvectorVariables.size();
  }

  private static String signature(Expression pExpression) {
    return pExpression + ":" + pExpression.getBits();
  }
}
