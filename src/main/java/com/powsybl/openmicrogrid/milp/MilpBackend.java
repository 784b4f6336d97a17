/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import java.time.Duration;

/**
 * @author PowSyBl Open Microgrid team
 */
public interface MilpBackend {

    String getName();

    /**
     * @return false when the backend cannot be used in this runtime (missing native library, solver
     * not compiled in, ...)
     */
    boolean isAvailable();

    /**
     * Solve the program to optimality.
     *
     * @return an optimal, infeasible or unbounded solution
     * @throws MilpBackendException on any other termination, including an expired time limit
     */
    MilpSolution solve(MilpProgram program, Duration timeLimit);
}
