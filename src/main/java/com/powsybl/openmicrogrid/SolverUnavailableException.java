/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid;

import java.util.List;
import java.util.Objects;

/**
 * Every configured MILP backend was unavailable or failed on the same program.
 *
 * @author PowSyBl Open Microgrid team
 */
public class SolverUnavailableException extends OpenMicrogridException {

    private final List<String> attemptedBackends;

    public SolverUnavailableException(List<String> attemptedBackends, Throwable lastFailure) {
        super("No MILP backend could solve the program, tried " + attemptedBackends, lastFailure);
        this.attemptedBackends = List.copyOf(Objects.requireNonNull(attemptedBackends));
    }

    public List<String> getAttemptedBackends() {
        return attemptedBackends;
    }
}
