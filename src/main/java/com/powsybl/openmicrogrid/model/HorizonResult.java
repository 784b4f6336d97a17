/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.model;

import java.util.List;
import java.util.Objects;

/**
 * Optimal dispatch of every hour of one horizon.
 *
 * @author PowSyBl Open Microgrid team
 */
public final class HorizonResult {

    private final int firstHour;

    private final List<DispatchDecision> decisions;

    private final double objectiveValue;

    private final String backendName;

    public HorizonResult(int firstHour, List<DispatchDecision> decisions, double objectiveValue, String backendName) {
        this.firstHour = firstHour;
        this.decisions = List.copyOf(Objects.requireNonNull(decisions));
        if (this.decisions.isEmpty()) {
            throw new IllegalArgumentException("A horizon result needs at least one hour");
        }
        this.objectiveValue = objectiveValue;
        this.backendName = Objects.requireNonNull(backendName);
    }

    public int getFirstHour() {
        return firstHour;
    }

    public int getHourCount() {
        return decisions.size();
    }

    public List<DispatchDecision> getDecisions() {
        return decisions;
    }

    public DispatchDecision getDecision(int t) {
        return decisions.get(t);
    }

    public DispatchDecision getFirstDecision() {
        return decisions.get(0);
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public String getBackendName() {
        return backendName;
    }
}
