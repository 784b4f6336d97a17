/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable weighted sum of variables.
 *
 * @author PowSyBl Open Microgrid team
 */
public final class LinearExpression {

    public record Term(MilpVariable variable, double coefficient) {

        public Term {
            Objects.requireNonNull(variable);
        }
    }

    private final List<Term> terms;

    private LinearExpression(List<Term> terms) {
        this.terms = List.copyOf(terms);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static LinearExpression of(MilpVariable variable) {
        return newBuilder().addTerm(variable, 1.0).build();
    }

    public List<Term> getTerms() {
        return terms;
    }

    public double evaluate(double[] values) {
        double sum = 0;
        for (Term term : terms) {
            sum += term.coefficient() * values[term.variable().index()];
        }
        return sum;
    }

    public static final class Builder {

        private final List<Term> terms = new ArrayList<>();

        private Builder() {
        }

        public Builder addTerm(MilpVariable variable, double coefficient) {
            if (coefficient != 0) {
                terms.add(new Term(variable, coefficient));
            }
            return this;
        }

        public LinearExpression build() {
            return new LinearExpression(terms);
        }
    }
}
