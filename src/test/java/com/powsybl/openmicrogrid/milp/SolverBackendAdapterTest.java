/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import com.powsybl.openmicrogrid.SolverUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author PowSyBl Open Microgrid team
 */
class SolverBackendAdapterTest {

    private static final Duration TIME_LIMIT = Duration.ofSeconds(10);

    private MilpProgram program;

    @BeforeEach
    void setUp() {
        program = new MilpProgram("test");
        MilpVariable x = program.newContinuousVariable("x", 1, 2);
        program.minimize(LinearExpression.of(x));
    }

    private static MilpBackend unavailableBackend(String name) {
        MilpBackend backend = mock(MilpBackend.class);
        when(backend.getName()).thenReturn(name);
        when(backend.isAvailable()).thenReturn(false);
        return backend;
    }

    private static MilpBackend failingBackend(String name) {
        MilpBackend backend = mock(MilpBackend.class);
        when(backend.getName()).thenReturn(name);
        when(backend.isAvailable()).thenReturn(true);
        when(backend.solve(any(), any())).thenThrow(new MilpBackendException(name, "time limit reached"));
        return backend;
    }

    private static MilpBackend solvingBackend(String name, MilpSolution solution) {
        MilpBackend backend = mock(MilpBackend.class);
        when(backend.getName()).thenReturn(name);
        when(backend.isAvailable()).thenReturn(true);
        when(backend.solve(any(), any())).thenReturn(solution);
        return backend;
    }

    @Test
    void testFirstBackendWins() {
        MilpBackend first = solvingBackend("A", MilpSolution.optimal("A", 1, new double[] {1}));
        MilpBackend second = solvingBackend("B", MilpSolution.optimal("B", 1, new double[] {1}));
        MilpSolution solution = new SolverBackendAdapter(List.of(first, second), TIME_LIMIT).solve(program);
        assertEquals("A", solution.getBackendName());
        verify(first).solve(program, TIME_LIMIT);
        verify(second, never()).solve(any(), any());
    }

    @Test
    void testFallback() {
        MilpBackend unavailable = unavailableBackend("A");
        MilpBackend failing = failingBackend("B");
        MilpBackend working = solvingBackend("C", MilpSolution.optimal("C", 1, new double[] {1}));
        MilpSolution solution = new SolverBackendAdapter(List.of(unavailable, failing, working), TIME_LIMIT).solve(program);
        assertEquals("C", solution.getBackendName());
        assertEquals(MilpStatus.OPTIMAL, solution.getStatus());
        verify(unavailable, never()).solve(any(), any());
        verify(failing, times(1)).solve(any(), any());
        verify(working, times(1)).solve(any(), any());
    }

    @Test
    void testInfeasibleDoesNotFallBack() {
        MilpBackend first = solvingBackend("A", MilpSolution.infeasible("A"));
        MilpBackend second = solvingBackend("B", MilpSolution.optimal("B", 1, new double[] {1}));
        MilpSolution solution = new SolverBackendAdapter(List.of(first, second), TIME_LIMIT).solve(program);
        assertEquals(MilpStatus.INFEASIBLE, solution.getStatus());
        assertThrows(IllegalStateException.class, () -> solution.getValue(program.getVariables().get(0)));
        verify(second, never()).solve(any(), any());
    }

    @Test
    void testAllBackendsFail() {
        SolverBackendAdapter adapter = new SolverBackendAdapter(List.of(unavailableBackend("A"), failingBackend("B")), TIME_LIMIT);
        SolverUnavailableException e = assertThrows(SolverUnavailableException.class, () -> adapter.solve(program));
        assertEquals(List.of("A", "B"), e.getAttemptedBackends());
        assertInstanceOf(MilpBackendException.class, e.getCause());
    }

    @Test
    void testInvalidConfiguration() {
        List<MilpBackend> noBackend = List.of();
        assertThrows(IllegalArgumentException.class, () -> new SolverBackendAdapter(noBackend, TIME_LIMIT));
        List<MilpBackend> backends = List.of(unavailableBackend("A"));
        assertThrows(IllegalArgumentException.class, () -> new SolverBackendAdapter(backends, Duration.ZERO));
    }
}
