// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import com.google.common.collect.FluentIterable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides satisfiability of formulas by case splitting over their atoms.
 *
 * <p>Atoms are boolean variables and comparisons. Comparisons are normalized to equalities and
 * (signed or unsigned) less-or-equal relations, so that e.g. {@code a < b} and {@code b <= a} are
 * recognized as the same atom with opposite polarity. Beyond that, bit-vector terms are treated as
 * uninterpreted, so the check may report satisfiable for formulas that are unsatisfiable in
 * bit-vector arithmetic. Equivalence checks are therefore conservative.
 */
public final class SatisfiabilityChecker {

  private SatisfiabilityChecker() {}

  public static boolean isSatisfiable(BooleanFormula pFormula) {
    return solve(FormulaSimplifier.simplify(pFormula));
  }

  public static boolean isUnsatisfiable(BooleanFormula pFormula) {
    return !isSatisfiable(pFormula);
  }

  /** Whether the two formulas provably have the same truth value under every assignment. */
  public static boolean isEquivalent(BooleanFormula pFirst, BooleanFormula pSecond) {
    BooleanFormula first = FormulaSimplifier.simplify(pFirst);
    BooleanFormula second = FormulaSimplifier.simplify(pSecond);
    if (first.equals(second)) {
      return true;
    }
    return isUnsatisfiable(
        Formulas.or(
            Formulas.and(first, Formulas.not(second)), Formulas.and(Formulas.not(first), second)));
  }

  /** Whether the two formulas provably have opposite truth values under every assignment. */
  public static boolean isComplement(BooleanFormula pFirst, BooleanFormula pSecond) {
    return isEquivalent(Formulas.not(pFirst), pSecond);
  }

  private static boolean solve(BooleanFormula pFormula) {
    if (pFormula instanceof BooleanConstant) {
      return ((BooleanConstant) pFormula).getValue();
    }
    BooleanFormula atom = pFormula.accept(AtomFinder.INSTANCE);
    if (atom == null) {
      throw new AssertionError("non-constant formula without atoms: " + pFormula);
    }
    return solve(FormulaSimplifier.simplify(pFormula.accept(new Assignment(atom, true))))
        || solve(FormulaSimplifier.simplify(pFormula.accept(new Assignment(atom, false))));
  }

  /** An atom together with the polarity it occurs with. */
  private static final class Literal {
    private final BooleanFormula atom;
    private final boolean positive;

    private Literal(BooleanFormula pAtom, boolean pPositive) {
      atom = pAtom;
      positive = pPositive;
    }
  }

  private static Literal toLiteral(ComparisonFormula pComparison) {
    BitvectorFormula left = pComparison.getLeft();
    BitvectorFormula right = pComparison.getRight();
    switch (pComparison.getOperator()) {
      case EQUAL:
        return new Literal(equality(left, right), true);
      case NOT_EQUAL:
        return new Literal(equality(left, right), false);
      case SIGNED_LESS_EQUAL:
        return lessEqual(ComparisonOperator.SIGNED_LESS_EQUAL, left, right, true);
      case SIGNED_GREATER_THAN:
        return lessEqual(ComparisonOperator.SIGNED_LESS_EQUAL, left, right, false);
      case SIGNED_GREATER_EQUAL:
        return lessEqual(ComparisonOperator.SIGNED_LESS_EQUAL, right, left, true);
      case SIGNED_LESS_THAN:
        return lessEqual(ComparisonOperator.SIGNED_LESS_EQUAL, right, left, false);
      case UNSIGNED_LESS_EQUAL:
        return lessEqual(ComparisonOperator.UNSIGNED_LESS_EQUAL, left, right, true);
      case UNSIGNED_GREATER_THAN:
        return lessEqual(ComparisonOperator.UNSIGNED_LESS_EQUAL, left, right, false);
      case UNSIGNED_GREATER_EQUAL:
        return lessEqual(ComparisonOperator.UNSIGNED_LESS_EQUAL, right, left, true);
      case UNSIGNED_LESS_THAN:
        return lessEqual(ComparisonOperator.UNSIGNED_LESS_EQUAL, right, left, false);
      default:
        throw new AssertionError("unhandled operator " + pComparison.getOperator());
    }
  }

  private static BooleanFormula equality(BitvectorFormula pLeft, BitvectorFormula pRight) {
    // equality is symmetric, order operands by their rendering
    if (pLeft.toString().compareTo(pRight.toString()) > 0) {
      return Formulas.compare(ComparisonOperator.EQUAL, pRight, pLeft);
    }
    return Formulas.compare(ComparisonOperator.EQUAL, pLeft, pRight);
  }

  private static Literal lessEqual(
      ComparisonOperator pOperator,
      BitvectorFormula pLeft,
      BitvectorFormula pRight,
      boolean pPositive) {
    return new Literal(Formulas.compare(pOperator, pLeft, pRight), pPositive);
  }

  /** Finds the first atom of a formula, or null for constants. */
  private enum AtomFinder implements FormulaVisitor<@Nullable BooleanFormula, RuntimeException> {
    INSTANCE;

    @Override
    public @Nullable BooleanFormula visit(BooleanConstant pConstant) {
      return null;
    }

    @Override
    public BooleanFormula visit(BooleanVariable pVariable) {
      return pVariable;
    }

    @Override
    public @Nullable BooleanFormula visit(NotFormula pNot) {
      return pNot.getOperand().accept(this);
    }

    @Override
    public @Nullable BooleanFormula visit(AndFormula pAnd) {
      return FluentIterable.from(pAnd.getOperands())
          .transform(op -> op.accept(this))
          .firstMatch(atom -> atom != null)
          .orNull();
    }

    @Override
    public @Nullable BooleanFormula visit(OrFormula pOr) {
      return FluentIterable.from(pOr.getOperands())
          .transform(op -> op.accept(this))
          .firstMatch(atom -> atom != null)
          .orNull();
    }

    @Override
    public BooleanFormula visit(ComparisonFormula pComparison) {
      return toLiteral(pComparison).atom;
    }
  }

  /** Replaces every occurrence of one atom by a truth value. */
  private static final class Assignment
      implements FormulaVisitor<BooleanFormula, RuntimeException> {

    private final BooleanFormula atom;
    private final boolean value;

    private Assignment(BooleanFormula pAtom, boolean pValue) {
      atom = pAtom;
      value = pValue;
    }

    @Override
    public BooleanFormula visit(BooleanConstant pConstant) {
      return pConstant;
    }

    @Override
    public BooleanFormula visit(BooleanVariable pVariable) {
      return pVariable.equals(atom) ? Formulas.makeBoolean(value) : pVariable;
    }

    @Override
    public BooleanFormula visit(NotFormula pNot) {
      return Formulas.not(pNot.getOperand().accept(this));
    }

    @Override
    public BooleanFormula visit(AndFormula pAnd) {
      return Formulas.and(FluentIterable.from(pAnd.getOperands()).transform(op -> op.accept(this)));
    }

    @Override
    public BooleanFormula visit(OrFormula pOr) {
      return Formulas.or(FluentIterable.from(pOr.getOperands()).transform(op -> op.accept(this)));
    }

    @Override
    public BooleanFormula visit(ComparisonFormula pComparison) {
      Literal literal = toLiteral(pComparison);
      if (literal.atom.equals(atom)) {
        return Formulas.makeBoolean(value == literal.positive);
      }
      return pComparison;
    }
  }
}
