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
 * @author PowSyBl Open Microgrid team
 */
public final class MilpSolution {

    private final String backendName;

    private final MilpStatus status;

    private final double objectiveValue;

    private final double[] values;

    private MilpSolution(String backendName, MilpStatus status, double objectiveValue, double[] values) {
        this.backendName = Objects.requireNonNull(backendName);
        this.status = Objects.requireNonNull(status);
        this.objectiveValue = objectiveValue;
        this.values = values;
    }

    public static MilpSolution optimal(String backendName, double objectiveValue, double[] values) {
        return new MilpSolution(backendName, MilpStatus.OPTIMAL, objectiveValue, Objects.requireNonNull(values).clone());
    }

    public static MilpSolution infeasible(String backendName) {
        return new MilpSolution(backendName, MilpStatus.INFEASIBLE, Double.NaN, null);
    }

    public static MilpSolution unbounded(String backendName) {
        return new MilpSolution(backendName, MilpStatus.UNBOUNDED, Double.NaN, null);
    }

    public String getBackendName() {
        return backendName;
    }

    public MilpStatus getStatus() {
        return status;
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public double getValue(MilpVariable variable) {
        if (status != MilpStatus.OPTIMAL) {
            throw new IllegalStateException("No value available, solution status is " + status);
        }
        return values[variable.index()];
    }
}
