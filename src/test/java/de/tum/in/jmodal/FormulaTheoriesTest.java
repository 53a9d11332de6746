/*
 * This file is part of JModal.
 * Copyright (c) 2026 The JModal authors.
 *
 * JModal is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JModal is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JModal. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jmodal;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks that the rewriting passes preserve the meaning of random formulas on random Kripke models.
 */
@SuppressWarnings({"checkstyle:javadoc", "NewClassNamingConvention"})
public class FormulaTheoriesTest {
    private static final Logger logger = Logger.getLogger(FormulaTheoriesTest.class.getName());

    private static final List<String> ATOMS = List.of("p", "q", "r");
    private static final List<Integer> MODALITIES = List.of(1, 2);
    private static final int FORMULA_COUNT = 150;
    private static final int FORMULA_DEPTH = 5;
    private static final int MODEL_COUNT = 8;
    private static final int WORLDS = 6;

    private static final List<KripkeModel> kModels;
    private static final List<KripkeModel> s5Models;

    static {
        Random random = new Random(0L);
        kModels = new ArrayList<>();
        s5Models = new ArrayList<>();
        for (int i = 0; i < MODEL_COUNT; i++) {
            kModels.add(KripkeModel.random(random, WORLDS, MODALITIES, ATOMS));
            s5Models.add(KripkeModel.randomEquivalence(random, WORLDS, List.of(1), ATOMS));
        }
        logger.log(Level.FINE, "Created {0} K and {0} S5 models", MODEL_COUNT);
    }

    static Stream<Formula> kFormulas() {
        RandomFormulas random = new RandomFormulas(1L, ATOMS, MODALITIES, false);
        List<Formula> formulas = new ArrayList<>();
        for (int i = 0; i < FORMULA_COUNT; i++) {
            formulas.add(random.next(FORMULA_DEPTH));
        }
        ModalCnfGenerator generator = new ModalCnfGenerator(ImmutableModalCnfParameters.builder()
                .modalities(2)
                .atoms(3)
                .seed(1L)
                .build());
        formulas.addAll(generator.generate(20));
        return formulas.stream();
    }

    static Stream<Formula> s5Formulas() {
        RandomFormulas random = new RandomFormulas(2L, ATOMS, List.of(1), true);
        List<Formula> formulas = new ArrayList<>();
        for (int i = 0; i < FORMULA_COUNT; i++) {
            formulas.add(random.next(FORMULA_DEPTH));
        }
        return formulas.stream();
    }

    private static void assertEquivalent(List<KripkeModel> models, Formula expected, Formula actual) {
        for (KripkeModel model : models) {
            assertThat(actual + " vs. " + expected, model.evaluate(actual), is(model.evaluate(expected)));
        }
    }

    private static boolean isNegatedNormalForm(Formula formula) {
        if (formula instanceof Not) {
            return ((Not) formula).getOperand() instanceof Atom;
        }
        if (formula instanceof BinaryFormula) {
            BinaryFormula binary = (BinaryFormula) formula;
            return isNegatedNormalForm(binary.getLeft()) && isNegatedNormalForm(binary.getRight());
        }
        if (formula instanceof ModalFormula) {
            return isNegatedNormalForm(((ModalFormula) formula).getSubformula());
        }
        return true;
    }

    private static boolean isCanonical(Formula formula) {
        if (formula instanceof ModalFormula) {
            ModalFormula modal = (ModalFormula) formula;
            Formula child = modal.getSubformula();
            if (modal.getPower() < 1) {
                return false;
            }
            if (child.getType() == modal.getType() && ((ModalFormula) child).getModality() == modal.getModality()) {
                return false;
            }
            return isCanonical(child);
        }
        if (formula instanceof Not) {
            return isCanonical(((Not) formula).getOperand());
        }
        if (formula instanceof BinaryFormula) {
            BinaryFormula binary = (BinaryFormula) formula;
            return isCanonical(binary.getLeft()) && isCanonical(binary.getRight());
        }
        return true;
    }

    @ParameterizedTest
    @MethodSource("kFormulas")
    public void testNegatedNormalForm(Formula formula) {
        Formula normalForm = formula.negatedNormalForm();
        assertThat(isNegatedNormalForm(normalForm), is(true));
        assertThat(isCanonical(normalForm), is(true));
        assertEquivalent(kModels, formula, normalForm);
    }

    @ParameterizedTest
    @MethodSource("kFormulas")
    public void testNegate(Formula formula) {
        Formula negation = formula.negate();
        for (KripkeModel model : kModels) {
            BitSet complement = model.evaluate(formula);
            complement.flip(0, model.worlds());
            assertThat(model.evaluate(negation), is(complement));
        }
        assertEquivalent(kModels, formula, negation.negate());
    }

    @ParameterizedTest
    @MethodSource("kFormulas")
    public void testSimplify(Formula formula) {
        Formula simplified = formula.simplify();
        assertThat(isCanonical(simplified), is(true));
        assertEquivalent(kModels, formula, simplified);
    }

    @ParameterizedTest
    @MethodSource("kFormulas")
    public void testModalFlatten(Formula formula) {
        Formula flattened = formula.modalFlatten();
        assertThat(flattened, is(formula));
        assertEquivalent(kModels, formula, flattened);
    }

    @ParameterizedTest
    @MethodSource("kFormulas")
    public void testDeepCopy(Formula formula) {
        Formula copy = formula.deepCopy();
        assertThat(copy, is(formula));
        assertThat(copy.hashCode(), is(formula.hashCode()));
        assertThat(copy.toString(), is(formula.toString()));
        assertThat(copy.simplify(), is(formula.simplify()));
    }

    @ParameterizedTest
    @MethodSource("kFormulas")
    public void testAxiomSimplifyKeepsCanonicalForm(Formula formula) {
        for (ModalAxiom axiom : ModalAxiom.values()) {
            assertThat(isCanonical(formula.axiomSimplify(axiom, 0)), is(true));
        }
    }

    @ParameterizedTest
    @MethodSource("s5Formulas")
    public void testSimplifyS5(Formula formula) {
        Formula simplified = formula.simplify();
        assertThat(isCanonical(simplified), is(true));
        assertEquivalent(s5Models, formula, simplified);
    }

    @ParameterizedTest
    @MethodSource("s5Formulas")
    public void testNegatedNormalFormS5(Formula formula) {
        assertEquivalent(s5Models, formula, formula.negatedNormalForm());
        assertEquivalent(s5Models, formula.negatedNormalForm().simplify(), formula.simplify());
    }
}
