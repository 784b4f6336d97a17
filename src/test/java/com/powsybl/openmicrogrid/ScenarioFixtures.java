/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid;

import com.powsybl.openmicrogrid.horizon.HorizonOptimizer;
import com.powsybl.openmicrogrid.model.DispatchDecision;
import com.powsybl.openmicrogrid.model.HorizonResult;
import com.powsybl.openmicrogrid.scenario.InMemoryScenarioTable;

import java.util.ArrayList;
import java.util.List;

/**
 * @author PowSyBl Open Microgrid team
 */
public final class ScenarioFixtures {

    public static final double DELTA_POWER = 1E-5;
    public static final double DELTA_COST = 1E-4;

    private ScenarioFixtures() {
    }

    /**
     * Synthetic day: solar bell between 6h and 18h, evening peak load, cheap night import.
     */
    public static InMemoryScenarioTable createDailyTable(int hourCount) {
        InMemoryScenarioTable.Builder builder = InMemoryScenarioTable.builder();
        for (int hour = 0; hour < hourCount; hour++) {
            int h = hour % 24;
            double pv = h >= 6 && h <= 18 ? 12 * Math.sin(Math.PI * (h - 6) / 12) : 0;
            double wind = 1.5 + Math.cos(hour / 5.0);
            double load = 4 + (h >= 17 && h <= 21 ? 3 : 0) + (h >= 7 && h <= 9 ? 1 : 0);
            double importPrice = h < 6 || h >= 22 ? 60 : (h >= 17 && h <= 21 ? 250 : 120);
            double exportPrice = 40;
            builder.addHour(load, pv, wind, importPrice, exportPrice);
        }
        return builder.build();
    }

    public static DispatchDecision decision(double importPower, double soc) {
        return new DispatchDecision(importPower, 0, 0, 0, 0, 0, soc, false, false, false, importPower > 0, false);
    }

    /**
     * Optimizer charging the storage by a fixed amount per hour, no solver involved.
     */
    public static HorizonOptimizer chargingOptimizer(double socIncrement) {
        return (window, socInit, reportNode) -> {
            List<DispatchDecision> decisions = new ArrayList<>();
            double soc = socInit;
            for (int t = 0; t < window.getHourCount(); t++) {
                soc += socIncrement;
                decisions.add(decision(window.getLoad(t), soc));
            }
            return new HorizonResult(window.getFirstHour(), decisions, 100.0 * window.getFirstHour(), "FAKE");
        };
    }
}
