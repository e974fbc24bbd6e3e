// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.sosy_lab.decompiler.logic.AndFormula;
import org.sosy_lab.decompiler.logic.BooleanConstant;
import org.sosy_lab.decompiler.logic.BooleanFormula;
import org.sosy_lab.decompiler.logic.FormulaSimplifier;
import org.sosy_lab.decompiler.logic.Formulas;
import org.sosy_lab.decompiler.logic.OrFormula;
import org.sosy_lab.decompiler.logic.SatisfiabilityChecker;

/**
 * Simplifies reaching conditions and optionally undoes the disjunctions that compilers produce for
 * short-circuit evaluation.
 */
final class ConditionSimplifier {

  private final boolean revertShortCircuitConditions;

  ConditionSimplifier(boolean pRevertShortCircuitConditions) {
    revertShortCircuitConditions = pRevertShortCircuitConditions;
  }

  BooleanFormula simplify(BooleanFormula pFormula) {
    BooleanFormula simplified = FormulaSimplifier.simplify(pFormula);
    if (simplified instanceof BooleanConstant || !revertShortCircuitConditions) {
      return simplified;
    }
    return revertShortCircuitLogic(simplified);
  }

  /**
   * Rewrites {@code !A || (A && !B)} into {@code !(A && B)}. Only the first two operands of a
   * disjunction are inspected, further operands are kept as they are.
   */
  static BooleanFormula revertShortCircuitLogic(BooleanFormula pFormula) {
    if (!(pFormula instanceof OrFormula)) {
      return pFormula;
    }
    List<BooleanFormula> operands = ((OrFormula) pFormula).getOperands();
    BooleanFormula first = operands.get(0);
    BooleanFormula second = operands.get(1);

    BooleanFormula notA;
    AndFormula conjunction;
    if (second instanceof AndFormula) {
      notA = first;
      conjunction = (AndFormula) second;
    } else if (first instanceof AndFormula) {
      notA = second;
      conjunction = (AndFormula) first;
    } else {
      return pFormula;
    }
    if (conjunction.getOperands().size() != 2) {
      return pFormula;
    }
    BooleanFormula a = conjunction.getOperands().get(0);
    BooleanFormula notB = conjunction.getOperands().get(1);

    if (!Formulas.extractVariableNames(notA).equals(Formulas.extractVariableNames(a))
        || !SatisfiabilityChecker.isComplement(notA, a)) {
      return pFormula;
    }

    BooleanFormula rewritten =
        Formulas.not(
            Formulas.and(
                FormulaSimplifier.simplify(Formulas.not(notA)),
                FormulaSimplifier.simplify(Formulas.not(notB))));
    if (operands.size() == 2) {
      return rewritten;
    }
    return Formulas.or(
        ImmutableList.<BooleanFormula>builder()
            .add(rewritten)
            .addAll(operands.subList(2, operands.size()))
            .build());
  }
}
