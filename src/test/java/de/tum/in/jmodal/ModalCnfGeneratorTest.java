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
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.in;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ModalCnfGeneratorTest {
    private static final Set<String> ATOMS = Set.of("A1", "A2", "A3", "A4");

    @Test
    public void testDeterministic() {
        ModalCnfParameters parameters = ImmutableModalCnfParameters.builder().seed(42L).modalities(3).build();
        List<Formula> first = new ModalCnfGenerator(parameters).generate(5);
        List<Formula> second = new ModalCnfGenerator(parameters).generate(5);
        assertThat(first, is(second));
    }

    @Test
    public void testDefaultShape() {
        ModalCnfGenerator generator = new ModalCnfGenerator(ImmutableModalCnfParameters.builder().build());
        for (Formula formula : generator.generate(20)) {
            ModalMetrics metrics = ModalMetrics.of(formula);
            assertThat(metrics.modalDepth(), is(2));
            assertThat(metrics.clauseCount(), is(4));
            assertThat(metrics.modalities(), everyItem(is(1)));
            assertThat(metrics.atoms(), everyItem(is(in(ATOMS))));
        }
    }

    @Test
    public void testParameters() {
        ModalCnfParameters parameters = ImmutableModalCnfParameters.builder()
                .depth(1)
                .modalities(2)
                .clauses(6)
                .atoms(3)
                .seed(3L)
                .s5Mode(true)
                .build();
        ModalCnfGenerator generator = new ModalCnfGenerator(parameters);
        for (Formula formula : generator.generate(20)) {
            ModalMetrics metrics = ModalMetrics.of(formula);
            assertThat(metrics.modalDepth(), lessThanOrEqualTo(1));
            assertThat(metrics.clauseCount(), lessThanOrEqualTo(6));
            assertThat(metrics.modalities(), everyItem(is(in(Set.of(1, 2)))));
            assertThat(metrics.atoms(), everyItem(is(in(Set.of("A1", "A2", "A3")))));
            assertThat(allBoxesInS5(formula), is(true));
        }
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableModalCnfParameters.builder().depth(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableModalCnfParameters.builder().atoms(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableModalCnfParameters.builder().addClauseLengthDistribution(List.of(1, -2)).build());
    }

    private static boolean allBoxesInS5(Formula formula) {
        if (formula instanceof Box) {
            Box box = (Box) formula;
            return box.isS5Mode() && allBoxesInS5(box.getSubformula());
        }
        if (formula instanceof Not) {
            return allBoxesInS5(((Not) formula).getOperand());
        }
        if (formula instanceof BinaryFormula) {
            BinaryFormula binary = (BinaryFormula) formula;
            return allBoxesInS5(binary.getLeft()) && allBoxesInS5(binary.getRight());
        }
        return true;
    }
}
