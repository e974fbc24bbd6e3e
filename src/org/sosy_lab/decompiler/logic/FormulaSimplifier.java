// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical simplification of formulas.
 *
 * <p>The result is equivalent to the input. It folds constants, removes double negations, pushes
 * negations into comparisons, flattens and deduplicates conjunctions and disjunctions, detects
 * complementary operands, applies absorption, and factors conjuncts shared by all operands of a
 * disjunction.
 */
public final class FormulaSimplifier {

  private static final Simplifier SIMPLIFIER = new Simplifier();

  private FormulaSimplifier() {}

  public static BooleanFormula simplify(BooleanFormula pFormula) {
    return pFormula.accept(SIMPLIFIER);
  }

  public static BitvectorFormula simplify(BitvectorFormula pFormula) {
    return pFormula.accept(SIMPLIFIER);
  }

  /**
   * Negation of an already simplified formula, keeping the result simplified at the top level.
   */
  static BooleanFormula negate(BooleanFormula pFormula) {
    if (pFormula instanceof BooleanConstant) {
      return Formulas.makeBoolean(!((BooleanConstant) pFormula).getValue());
    } else if (pFormula instanceof NotFormula) {
      return ((NotFormula) pFormula).getOperand();
    } else if (pFormula instanceof ComparisonFormula) {
      ComparisonFormula comparison = (ComparisonFormula) pFormula;
      return Formulas.compare(
          comparison.getOperator().negate(), comparison.getLeft(), comparison.getRight());
    }
    return Formulas.not(pFormula);
  }

  private static ImmutableSet<BooleanFormula> conjuncts(BooleanFormula pFormula) {
    return pFormula instanceof AndFormula
        ? ImmutableSet.copyOf(((AndFormula) pFormula).getOperands())
        : ImmutableSet.of(pFormula);
  }

  private static ImmutableSet<BooleanFormula> disjuncts(BooleanFormula pFormula) {
    return pFormula instanceof OrFormula
        ? ImmutableSet.copyOf(((OrFormula) pFormula).getOperands())
        : ImmutableSet.of(pFormula);
  }

  private static final class Simplifier
      implements FormulaVisitor<BooleanFormula, RuntimeException>,
          BitvectorFormulaVisitor<BitvectorFormula, RuntimeException> {

    @Override
    public BooleanFormula visit(BooleanConstant pConstant) {
      return pConstant;
    }

    @Override
    public BooleanFormula visit(BooleanVariable pVariable) {
      return pVariable;
    }

    @Override
    public BooleanFormula visit(NotFormula pNot) {
      return negate(pNot.getOperand().accept(this));
    }

    @Override
    public BooleanFormula visit(ComparisonFormula pComparison) {
      ComparisonOperator op = pComparison.getOperator();
      BitvectorFormula left = pComparison.getLeft().accept(this);
      BitvectorFormula right = pComparison.getRight().accept(this);

      if (left instanceof BitvectorConstant && right instanceof BitvectorConstant) {
        return Formulas.makeBoolean(
            op.evaluate(
                ((BitvectorConstant) left).getValue(),
                ((BitvectorConstant) right).getValue(),
                Math.max(left.getBits(), right.getBits())));
      }
      if (left.equals(right)) {
        return Formulas.makeBoolean(op.isReflexive());
      }
      if (left instanceof BitvectorConstant) {
        // constants go to the right
        return Formulas.compare(op.swap(), right, left);
      }
      return Formulas.compare(op, left, right);
    }

    @Override
    public BooleanFormula visit(AndFormula pAnd) {
      Set<BooleanFormula> operands = new LinkedHashSet<>();
      for (BooleanFormula operand : flatten(pAnd.getOperands(), true)) {
        if (Formulas.isFalse(operand)) {
          return Formulas.makeFalse();
        } else if (!Formulas.isTrue(operand)) {
          operands.add(operand);
        }
      }
      for (BooleanFormula operand : operands) {
        if (operands.contains(negate(operand))) {
          return Formulas.makeFalse();
        }
      }
      // a && (a || b) == a
      List<BooleanFormula> result = new ArrayList<>(operands.size());
      for (BooleanFormula operand : operands) {
        if (!(operand instanceof OrFormula)
            || Sets.intersection(disjuncts(operand), operands).isEmpty()) {
          result.add(operand);
        }
      }
      return Formulas.and(result);
    }

    @Override
    public BooleanFormula visit(OrFormula pOr) {
      Set<BooleanFormula> operands = new LinkedHashSet<>();
      for (BooleanFormula operand : flatten(pOr.getOperands(), false)) {
        if (Formulas.isTrue(operand)) {
          return Formulas.makeTrue();
        } else if (!Formulas.isFalse(operand)) {
          operands.add(operand);
        }
      }
      for (BooleanFormula operand : operands) {
        if (operands.contains(negate(operand))) {
          return Formulas.makeTrue();
        }
      }
      // a || (a && b) == a
      List<BooleanFormula> result = new ArrayList<>(operands.size());
      for (BooleanFormula operand : operands) {
        if (!(operand instanceof AndFormula)
            || Sets.intersection(conjuncts(operand), operands).isEmpty()) {
          result.add(operand);
        }
      }
      if (result.size() < 2) {
        return Formulas.or(result);
      }

      // (a && b) || (a && c) == a && (b || c)
      Set<BooleanFormula> common = new LinkedHashSet<>(conjuncts(result.get(0)));
      for (BooleanFormula operand : result) {
        common.retainAll(conjuncts(operand));
      }
      if (common.isEmpty()) {
        return Formulas.or(result);
      }
      List<BooleanFormula> rests = new ArrayList<>(result.size());
      for (BooleanFormula operand : result) {
        rests.add(Formulas.and(Sets.difference(conjuncts(operand), common)));
      }
      List<BooleanFormula> factored = new ArrayList<>(common);
      factored.add(Formulas.or(rests));
      return Formulas.and(factored).accept(this);
    }

    /** Simplify operands and inline nested operands of the same connective. */
    private List<BooleanFormula> flatten(
        ImmutableList<BooleanFormula> pOperands, boolean pConjunction) {
      List<BooleanFormula> result = new ArrayList<>();
      for (BooleanFormula operand : pOperands) {
        BooleanFormula simplified = operand.accept(this);
        if (pConjunction && simplified instanceof AndFormula) {
          result.addAll(((AndFormula) simplified).getOperands());
        } else if (!pConjunction && simplified instanceof OrFormula) {
          result.addAll(((OrFormula) simplified).getOperands());
        } else {
          result.add(simplified);
        }
      }
      return result;
    }

    @Override
    public BitvectorFormula visit(BitvectorConstant pConstant) {
      return pConstant;
    }

    @Override
    public BitvectorFormula visit(BitvectorVariable pVariable) {
      return pVariable;
    }

    @Override
    public BitvectorFormula visit(BitvectorOperation pOperation) {
      BitvectorOperator op = pOperation.getOperator();
      BitvectorFormula left = pOperation.getLeft().accept(this);
      BitvectorFormula right = pOperation.getRight().accept(this);
      int bits = pOperation.getBits();

      if (left instanceof BitvectorConstant && right instanceof BitvectorConstant) {
        return Formulas.makeBitvector(
            op.evaluate(
                ((BitvectorConstant) left).getValue(),
                ((BitvectorConstant) right).getValue(),
                bits),
            bits);
      }
      if (isZero(right)) {
        switch (op) {
          case ADD:
          case SUBTRACT:
          case XOR:
          case LOGICAL_SHIFT_RIGHT:
            return left;
          case AND:
            return Formulas.makeBitvector(0, bits);
          default:
            break;
        }
      }
      if (isZero(left)) {
        switch (op) {
          case ADD:
          case XOR:
            return right;
          case AND:
          case LOGICAL_SHIFT_RIGHT:
            return Formulas.makeBitvector(0, bits);
          default:
            break;
        }
      }
      return Formulas.makeOperation(op, left, right);
    }

    private static boolean isZero(BitvectorFormula pFormula) {
      return pFormula instanceof BitvectorConstant
          && ((BitvectorConstant) pFormula).getValue() == 0;
    }
  }
}
