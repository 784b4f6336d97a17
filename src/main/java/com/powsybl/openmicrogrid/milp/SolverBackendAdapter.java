/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import com.powsybl.openmicrogrid.SolverUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Solves a {@link MilpProgram} with the first backend of a ranked list that succeeds. Each backend is
 * tried once. An unavailable backend, an exception or a non terminal status (time limit for instance)
 * moves on to the next backend; infeasible and unbounded outcomes are properties of the program and
 * are returned as is.
 *
 * @author PowSyBl Open Microgrid team
 */
public class SolverBackendAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SolverBackendAdapter.class);

    private final List<MilpBackend> backends;

    private final Duration timeLimit;

    public SolverBackendAdapter(List<MilpBackend> backends, Duration timeLimit) {
        this.backends = List.copyOf(Objects.requireNonNull(backends));
        if (this.backends.isEmpty()) {
            throw new IllegalArgumentException("At least one MILP backend is required");
        }
        this.timeLimit = Objects.requireNonNull(timeLimit);
        if (timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("Invalid solver time limit: " + timeLimit);
        }
    }

    public static SolverBackendAdapter create(List<String> backendNames, Duration timeLimit) {
        Objects.requireNonNull(backendNames);
        List<MilpBackend> backends = backendNames.stream()
                .map(name -> MilpBackendFactory.find(name).create())
                .toList();
        return new SolverBackendAdapter(backends, timeLimit);
    }

    public List<MilpBackend> getBackends() {
        return backends;
    }

    public Duration getTimeLimit() {
        return timeLimit;
    }

    public MilpSolution solve(MilpProgram program) {
        Objects.requireNonNull(program);
        List<String> attemptedBackends = new ArrayList<>(backends.size());
        RuntimeException lastFailure = null;
        for (MilpBackend backend : backends) {
            attemptedBackends.add(backend.getName());
            try {
                if (!backend.isAvailable()) {
                    LOGGER.debug("MILP backend '{}' is not available, falling back to next one", backend.getName());
                    continue;
                }
                MilpSolution solution = backend.solve(program, timeLimit);
                LOGGER.debug("Program '{}' solved by backend '{}' with status {}", program.getName(), backend.getName(), solution.getStatus());
                return solution;
            } catch (RuntimeException e) {
                LOGGER.warn("MILP backend '{}' failed on program '{}', falling back to next one: {}",
                        backend.getName(), program.getName(), e.getMessage());
                lastFailure = e;
            }
        }
        throw new SolverUnavailableException(attemptedBackends, lastFailure);
    }
}
