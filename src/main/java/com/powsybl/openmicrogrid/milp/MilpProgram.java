/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Backend neutral mixed integer linear program: bounded variables, some of them integer, linear
 * constraints and a linear objective to minimize.
 *
 * @author PowSyBl Open Microgrid team
 */
public class MilpProgram {

    private final String name;

    private final List<MilpVariable> variables = new ArrayList<>();

    private final List<MilpConstraint> constraints = new ArrayList<>();

    private LinearExpression objective = LinearExpression.newBuilder().build();

    public MilpProgram(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public String getName() {
        return name;
    }

    public MilpVariable newContinuousVariable(String name, double lowerBound, double upperBound) {
        return addVariable(name, lowerBound, upperBound, false);
    }

    public MilpVariable newBinaryVariable(String name) {
        return addVariable(name, 0, 1, true);
    }

    private MilpVariable addVariable(String name, double lowerBound, double upperBound, boolean integer) {
        MilpVariable variable = new MilpVariable(variables.size(), name, lowerBound, upperBound, integer);
        variables.add(variable);
        return variable;
    }

    public MilpConstraint addEquality(String name, LinearExpression expression, double rightHandSide) {
        return addConstraint(new MilpConstraint(name, expression, ConstraintSense.EQUAL, rightHandSide));
    }

    public MilpConstraint addLessOrEqual(String name, LinearExpression expression, double rightHandSide) {
        return addConstraint(new MilpConstraint(name, expression, ConstraintSense.LESS_OR_EQUAL, rightHandSide));
    }

    public MilpConstraint addGreaterOrEqual(String name, LinearExpression expression, double rightHandSide) {
        return addConstraint(new MilpConstraint(name, expression, ConstraintSense.GREATER_OR_EQUAL, rightHandSide));
    }

    private MilpConstraint addConstraint(MilpConstraint constraint) {
        for (LinearExpression.Term term : constraint.expression().getTerms()) {
            checkOwned(term.variable());
        }
        constraints.add(constraint);
        return constraint;
    }

    public void minimize(LinearExpression objective) {
        for (LinearExpression.Term term : objective.getTerms()) {
            checkOwned(term.variable());
        }
        this.objective = objective;
    }

    private void checkOwned(MilpVariable variable) {
        int index = variable.index();
        if (index >= variables.size() || variables.get(index) != variable) {
            throw new IllegalArgumentException("Variable '" + variable.name() + "' does not belong to program '" + name + "'");
        }
    }

    public List<MilpVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<MilpConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public LinearExpression getObjective() {
        return objective;
    }

    public long getIntegerVariableCount() {
        return variables.stream().filter(MilpVariable::integer).count();
    }
}
