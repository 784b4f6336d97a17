/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import java.util.Objects;

/**
 * A decision variable of a {@link MilpProgram}. The index is the position of the variable in the
 * program and is used to read back its value from a {@link MilpSolution}.
 *
 * @author PowSyBl Open Microgrid team
 */
public record MilpVariable(int index, String name, double lowerBound, double upperBound, boolean integer) {

    public MilpVariable {
        Objects.requireNonNull(name);
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException("Variable '" + name + "' has inconsistent bounds [" + lowerBound + ", " + upperBound + "]");
        }
    }
}
