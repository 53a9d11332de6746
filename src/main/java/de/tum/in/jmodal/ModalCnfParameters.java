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

import static de.tum.in.jmodal.Util.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.immutables.value.Value;

/**
 * Parameters of the {@link ModalCnfGenerator}. The distributions are indexed by the remaining modal
 * depth of the clause being generated; an empty distribution selects the default one.
 */
@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class ModalCnfParameters {
    public static final List<List<Integer>> DEFAULT_CLAUSE_LENGTHS = ImmutableList.of(
            ImmutableList.of(0, 2, 2),
            ImmutableList.of(2, 4),
            ImmutableList.of(6));
    public static final List<List<List<Integer>>> DEFAULT_PROPOSITIONAL_RATES = ImmutableList.of(
            ImmutableList.of(ImmutableList.<Integer>of(), ImmutableList.of(0, 2, 0), ImmutableList.of(0, 2, 0, 0)),
            ImmutableList.of(ImmutableList.of(2, 0), ImmutableList.of(0, 4, 0)));

    /** The modal depth d. */
    @Value.Default
    public int depth() {
        return 2;
    }

    /** The number m of distinct modality indices, numbered from one. */
    @Value.Default
    public int modalities() {
        return 1;
    }

    /** The number L of distinct clauses. */
    @Value.Default
    public int clauses() {
        return 4;
    }

    /** The number N of propositional atoms {@code A1} to {@code AN}. */
    @Value.Default
    public int atoms() {
        return 4;
    }

    @Value.Default
    public long seed() {
        return 0L;
    }

    /** Whether the generated boxes are in S5 mode. */
    @Value.Default
    public boolean s5Mode() {
        return false;
    }

    /**
     * Weights of the clause lengths: the {@code i}-th entry of the {@code d}-th list is the weight of
     * a clause of length {@code i + 1} at remaining depth {@code d}.
     */
    public abstract List<List<Integer>> clauseLengthDistribution();

    /**
     * Weights of the number of propositional literals: the {@code i}-th entry of the {@code (k -
     * 1)}-th list at index {@code d} is the weight of {@code i} propositional literals in a clause of
     * length {@code k} at remaining depth {@code d}.
     */
    public abstract List<List<List<Integer>>> propositionalDistribution();

    List<List<Integer>> effectiveClauseLengths() {
        return clauseLengthDistribution().isEmpty() ? DEFAULT_CLAUSE_LENGTHS : clauseLengthDistribution();
    }

    List<List<List<Integer>>> effectivePropositionalRates() {
        return propositionalDistribution().isEmpty() ? DEFAULT_PROPOSITIONAL_RATES : propositionalDistribution();
    }

    @Value.Check
    protected void check() {
        checkArgument(depth() >= 0, "Depth must be non-negative, got %d", depth());
        checkArgument(modalities() >= 1, "At least one modality is required, got %d", modalities());
        checkArgument(clauses() >= 1, "At least one clause is required, got %d", clauses());
        checkArgument(atoms() >= 1, "At least one atom is required, got %d", atoms());
        for (List<Integer> weights : clauseLengthDistribution()) {
            checkWeights(weights);
        }
        for (List<List<Integer>> byLength : propositionalDistribution()) {
            for (List<Integer> weights : byLength) {
                checkWeights(weights);
            }
        }
    }

    private static void checkWeights(List<Integer> weights) {
        for (int weight : weights) {
            checkArgument(weight >= 0, "Negative weight in %s", weights);
        }
    }
}
