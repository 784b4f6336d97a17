/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.mpc;

import com.powsybl.openmicrogrid.OpenMicrogridParameters;
import com.powsybl.openmicrogrid.scenario.InMemoryScenarioTable;
import com.powsybl.openmicrogrid.scenario.ScenarioTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One independent run of a scenario batch.
 *
 * @param fuelPrice diesel fuel price in currency per MWh thermal
 * @param loadScale factor applied to the forecast load
 *
 * @author PowSyBl Open Microgrid team
 */
public record ScenarioVariant(String id, double fuelPrice, double loadScale) {

    public ScenarioVariant {
        Objects.requireNonNull(id);
        if (Double.isNaN(fuelPrice) || fuelPrice < 0) {
            throw new IllegalArgumentException("Invalid fuel price for variant '" + id + "': " + fuelPrice);
        }
        if (Double.isNaN(loadScale) || loadScale < 0) {
            throw new IllegalArgumentException("Invalid load scale for variant '" + id + "': " + loadScale);
        }
    }

    /**
     * One variant per fuel price given in currency per kWh, load unchanged. Ids are built like
     * {@code cf045} for 0.45.
     */
    public static List<ScenarioVariant> fuelPricesPerKwh(double... pricesPerKwh) {
        List<ScenarioVariant> variants = new ArrayList<>(pricesPerKwh.length);
        for (double price : pricesPerKwh) {
            String id = "cf" + String.format(Locale.ROOT, "%.2f", price).replace(".", "");
            variants.add(new ScenarioVariant(id, price * 1000, 1.0));
        }
        return variants;
    }

    public OpenMicrogridParameters applyTo(OpenMicrogridParameters parameters) {
        return parameters.copy().setFuelPrice(fuelPrice);
    }

    public InMemoryScenarioTable applyTo(ScenarioTable table) {
        return InMemoryScenarioTable.copyOf(table).withLoadScale(loadScale);
    }
}
