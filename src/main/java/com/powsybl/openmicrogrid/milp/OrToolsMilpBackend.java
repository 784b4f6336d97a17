/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import com.google.common.base.Stopwatch;
import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.ModelSolver;
import com.google.ortools.modelbuilder.SolveStatus;
import com.google.ortools.modelbuilder.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link MilpBackend} on top of the OR-Tools model builder. The same translation is used for every
 * underlying solver, only the solver id passed to {@link ModelSolver} differs.
 *
 * @author PowSyBl Open Microgrid team
 */
public class OrToolsMilpBackend implements MilpBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrToolsMilpBackend.class);

    private static Boolean nativeLibrariesLoaded;

    private final String name;

    private final String solverId;

    public OrToolsMilpBackend(String name, String solverId) {
        this.name = Objects.requireNonNull(name);
        this.solverId = Objects.requireNonNull(solverId);
    }

    static synchronized boolean loadNativeLibraries() {
        if (nativeLibrariesLoaded == null) {
            try {
                Loader.loadNativeLibraries();
                nativeLibrariesLoaded = Boolean.TRUE;
            } catch (RuntimeException | LinkageError e) {
                LOGGER.warn("OR-Tools native libraries cannot be loaded: {}", e.getMessage());
                nativeLibrariesLoaded = Boolean.FALSE;
            }
        }
        return nativeLibrariesLoaded;
    }

    @Override
    public String getName() {
        return name;
    }

    public String getSolverId() {
        return solverId;
    }

    @Override
    public boolean isAvailable() {
        return loadNativeLibraries() && new ModelSolver(solverId).solverIsSupported();
    }

    private static LinearExpr toLinearExpr(LinearExpression expression, List<Variable> variables) {
        var exprBuilder = LinearExpr.newBuilder();
        for (LinearExpression.Term term : expression.getTerms()) {
            exprBuilder.addTerm(variables.get(term.variable().index()), term.coefficient());
        }
        return exprBuilder.build();
    }

    private static ModelBuilder createModelBuilder(MilpProgram program, List<Variable> variables) {
        ModelBuilder modelBuilder = new ModelBuilder();
        for (MilpVariable v : program.getVariables()) {
            variables.add(v.integer()
                    ? modelBuilder.newIntVar(v.lowerBound(), v.upperBound(), v.name())
                    : modelBuilder.newNumVar(v.lowerBound(), v.upperBound(), v.name()));
        }
        for (MilpConstraint c : program.getConstraints()) {
            LinearExpr expr = toLinearExpr(c.expression(), variables);
            switch (c.sense()) {
                case EQUAL -> modelBuilder.addEquality(expr, c.rightHandSide());
                case LESS_OR_EQUAL -> modelBuilder.addLessOrEqual(expr, c.rightHandSide());
                case GREATER_OR_EQUAL -> modelBuilder.addGreaterOrEqual(expr, c.rightHandSide());
            }
        }
        modelBuilder.minimize(toLinearExpr(program.getObjective(), variables));
        return modelBuilder;
    }

    @Override
    public MilpSolution solve(MilpProgram program, Duration timeLimit) {
        Objects.requireNonNull(program);
        Objects.requireNonNull(timeLimit);
        if (!loadNativeLibraries()) {
            throw new MilpBackendException(name, "OR-Tools native libraries not loaded");
        }

        List<Variable> variables = new ArrayList<>(program.getVariables().size());
        ModelBuilder modelBuilder = createModelBuilder(program, variables);
        LOGGER.debug("Program '{}' built with {} variables ({} integer) and {} constraints",
                program.getName(), variables.size(), program.getIntegerVariableCount(), program.getConstraints().size());

        ModelSolver solver = new ModelSolver(solverId);
        if (!solver.solverIsSupported()) {
            throw new MilpBackendException(name, "solver '" + solverId + "' is not supported by this OR-Tools build");
        }
        solver.setTimeLimit(timeLimit);
        Stopwatch stopwatch = Stopwatch.createStarted();
        SolveStatus status = solver.solve(modelBuilder);
        stopwatch.stop();
        LOGGER.debug("Program '{}' solved by {} with status {} in {} ms", program.getName(), name, status,
                stopwatch.elapsed(TimeUnit.MILLISECONDS));

        return switch (status) {
            case OPTIMAL -> {
                double[] values = new double[variables.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = solver.getValue(variables.get(i));
                }
                yield MilpSolution.optimal(name, solver.getObjectiveValue(), values);
            }
            case INFEASIBLE -> MilpSolution.infeasible(name);
            case UNBOUNDED -> MilpSolution.unbounded(name);
            default -> throw new MilpBackendException(name, "solver terminated with status " + status);
        };
    }

    @Override
    public String toString() {
        return name + "(" + solverId + ")";
    }
}
