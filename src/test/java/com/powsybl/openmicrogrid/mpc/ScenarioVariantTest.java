/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.mpc;

import com.powsybl.openmicrogrid.OpenMicrogridParameters;
import com.powsybl.openmicrogrid.ScenarioFixtures;
import com.powsybl.openmicrogrid.scenario.InMemoryScenarioTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl Open Microgrid team
 */
class ScenarioVariantTest {

    @Test
    void testFuelPricesPerKwh() {
        List<ScenarioVariant> variants = ScenarioVariant.fuelPricesPerKwh(0.45, 0.6);
        assertEquals(2, variants.size());
        assertEquals("cf045", variants.get(0).id());
        assertEquals(450, variants.get(0).fuelPrice(), 1E-9);
        assertEquals("cf060", variants.get(1).id());
        assertEquals(600, variants.get(1).fuelPrice(), 1E-9);
        assertEquals(1, variants.get(1).loadScale());
    }

    @Test
    void testApply() {
        ScenarioVariant variant = new ScenarioVariant("v", 500, 2);
        OpenMicrogridParameters parameters = new OpenMicrogridParameters();
        assertEquals(500, variant.applyTo(parameters).getFuelPrice());
        assertEquals(OpenMicrogridParameters.FUEL_PRICE_DEFAULT_VALUE, parameters.getFuelPrice());

        InMemoryScenarioTable table = ScenarioFixtures.createDailyTable(4);
        InMemoryScenarioTable scaled = variant.applyTo(table);
        assertEquals(2 * table.getLoad(3), scaled.getLoad(3), 1E-12);
        assertEquals(table.getPv(3), scaled.getPv(3));
    }

    @Test
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new ScenarioVariant("v", -1, 1));
        assertThrows(IllegalArgumentException.class, () -> new ScenarioVariant("v", 1, Double.NaN));
        assertThrows(NullPointerException.class, () -> new ScenarioVariant(null, 1, 1));
    }
}
