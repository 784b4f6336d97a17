/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import com.google.common.base.Stopwatch;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link MilpBackend} on top of the OR-Tools linear solver wrapper ({@link MPSolver}), for solvers such as
 * CBC that the model builder does not expose.
 *
 * @author PowSyBl Open Microgrid team
 */
public class OrToolsLinearSolverMilpBackend implements MilpBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrToolsLinearSolverMilpBackend.class);

    private final String name;

    private final String solverId;

    public OrToolsLinearSolverMilpBackend(String name, String solverId) {
        this.name = Objects.requireNonNull(name);
        this.solverId = Objects.requireNonNull(solverId);
    }

    @Override
    public String getName() {
        return name;
    }

    public String getSolverId() {
        return solverId;
    }

    private MPSolver createSolver() {
        return OrToolsMilpBackend.loadNativeLibraries() ? MPSolver.createSolver(solverId) : null;
    }

    @Override
    public boolean isAvailable() {
        MPSolver solver = createSolver();
        if (solver == null) {
            return false;
        }
        solver.delete();
        return true;
    }

    private static double toSolverBound(double bound) {
        if (bound == Double.POSITIVE_INFINITY) {
            return MPSolver.infinity();
        }
        return bound == Double.NEGATIVE_INFINITY ? -MPSolver.infinity() : bound;
    }

    private static void fill(MPSolver solver, MilpProgram program, List<MPVariable> variables) {
        for (MilpVariable v : program.getVariables()) {
            double lb = toSolverBound(v.lowerBound());
            double ub = toSolverBound(v.upperBound());
            variables.add(v.integer() ? solver.makeIntVar(lb, ub, v.name()) : solver.makeNumVar(lb, ub, v.name()));
        }
        for (MilpConstraint c : program.getConstraints()) {
            double rhs = c.rightHandSide();
            MPConstraint constraint = switch (c.sense()) {
                case EQUAL -> solver.makeConstraint(rhs, rhs, c.name());
                case LESS_OR_EQUAL -> solver.makeConstraint(-MPSolver.infinity(), rhs, c.name());
                case GREATER_OR_EQUAL -> solver.makeConstraint(rhs, MPSolver.infinity(), c.name());
            };
            for (LinearExpression.Term term : c.expression().getTerms()) {
                constraint.setCoefficient(variables.get(term.variable().index()), term.coefficient());
            }
        }
        MPObjective objective = solver.objective();
        for (LinearExpression.Term term : program.getObjective().getTerms()) {
            objective.setCoefficient(variables.get(term.variable().index()), term.coefficient());
        }
        objective.setMinimization();
    }

    @Override
    public MilpSolution solve(MilpProgram program, Duration timeLimit) {
        Objects.requireNonNull(program);
        Objects.requireNonNull(timeLimit);
        MPSolver solver = createSolver();
        if (solver == null) {
            throw new MilpBackendException(name, "solver '" + solverId + "' is not supported by this OR-Tools build");
        }
        try {
            List<MPVariable> variables = new ArrayList<>(program.getVariables().size());
            fill(solver, program, variables);
            solver.setTimeLimit(timeLimit.toMillis());

            Stopwatch stopwatch = Stopwatch.createStarted();
            MPSolver.ResultStatus status = solver.solve();
            stopwatch.stop();
            LOGGER.debug("Program '{}' solved by {} with status {} in {} ms", program.getName(), name, status,
                    stopwatch.elapsed(TimeUnit.MILLISECONDS));

            return switch (status) {
                case OPTIMAL -> {
                    double[] values = new double[variables.size()];
                    for (int i = 0; i < values.length; i++) {
                        values[i] = variables.get(i).solutionValue();
                    }
                    yield MilpSolution.optimal(name, solver.objective().value(), values);
                }
                case INFEASIBLE -> MilpSolution.infeasible(name);
                case UNBOUNDED -> MilpSolution.unbounded(name);
                // FEASIBLE means the time limit stopped the search before optimality was proven
                default -> throw new MilpBackendException(name, "solver terminated with status " + status);
            };
        } finally {
            solver.delete();
        }
    }

    @Override
    public String toString() {
        return name + "(" + solverId + ")";
    }
}
