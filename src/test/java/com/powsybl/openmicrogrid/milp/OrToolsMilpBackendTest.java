/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * @author PowSyBl Open Microgrid team
 */
class OrToolsMilpBackendTest {

    private static final Duration TIME_LIMIT = Duration.ofSeconds(30);

    @ParameterizedTest
    @ValueSource(strings = {"SCIP", "HIGHS", "CBC"})
    void testSmallMilp(String backendName) {
        MilpBackend backend = MilpBackendFactory.find(backendName).create();
        assumeTrue(backend.isAvailable(), backendName + " not available");

        // min -x - y, x + y <= 1.5, x binary, y in [0, 1]
        MilpProgram program = new MilpProgram("small");
        MilpVariable x = program.newBinaryVariable("x");
        MilpVariable y = program.newContinuousVariable("y", 0, 1);
        program.addLessOrEqual("c", LinearExpression.newBuilder().addTerm(x, 1).addTerm(y, 1).build(), 1.5);
        program.minimize(LinearExpression.newBuilder().addTerm(x, -1).addTerm(y, -1).build());

        MilpSolution solution = backend.solve(program, TIME_LIMIT);
        assertEquals(MilpStatus.OPTIMAL, solution.getStatus());
        assertEquals(backendName, solution.getBackendName());
        assertEquals(-1.5, solution.getObjectiveValue(), 1E-6);
        assertEquals(1, solution.getValue(x), 1E-6);
        assertEquals(0.5, solution.getValue(y), 1E-6);
    }

    @ParameterizedTest
    @ValueSource(strings = {"SCIP", "CBC"})
    void testInfeasible(String backendName) {
        MilpBackend backend = MilpBackendFactory.find(backendName).create();
        assumeTrue(backend.isAvailable(), backendName + " not available");

        MilpProgram program = new MilpProgram("infeasible");
        MilpVariable x = program.newContinuousVariable("x", 0, 1);
        MilpVariable u = program.newBinaryVariable("u");
        program.addGreaterOrEqual("c", LinearExpression.newBuilder().addTerm(x, 1).addTerm(u, 1).build(), 3);
        program.minimize(LinearExpression.of(x));

        assertEquals(MilpStatus.INFEASIBLE, backend.solve(program, TIME_LIMIT).getStatus());
    }

    @Test
    void testCbcShippedWithOrTools() {
        MilpBackend backend = MilpBackendFactory.find(CbcMilpBackendFactory.NAME).create();
        assumeTrue(OrToolsMilpBackend.loadNativeLibraries(), "OR-Tools native libraries not available");
        assertTrue(backend.isAvailable());
    }

    @Test
    void testInfiniteUpperBounds() {
        MilpBackend backend = MilpBackendFactory.find(CbcMilpBackendFactory.NAME).create();
        assumeTrue(backend.isAvailable(), "CBC not available");

        // min 2x + y, x >= 1, no upper bounds
        MilpProgram program = new MilpProgram("bounds");
        MilpVariable x = program.newContinuousVariable("x", 0, Double.POSITIVE_INFINITY);
        MilpVariable y = program.newContinuousVariable("y", 0, Double.POSITIVE_INFINITY);
        program.addGreaterOrEqual("c", LinearExpression.of(x), 1);
        program.minimize(LinearExpression.newBuilder().addTerm(x, 2).addTerm(y, 1).build());

        MilpSolution solution = backend.solve(program, TIME_LIMIT);
        assertEquals(MilpStatus.OPTIMAL, solution.getStatus());
        assertEquals(2, solution.getValue(x) * 2 + solution.getValue(y), 1E-6);
        assertEquals(2, solution.getObjectiveValue(), 1E-6);
    }
}
