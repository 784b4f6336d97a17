/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.scenario;

import com.powsybl.openmicrogrid.InputShapeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl Open Microgrid team
 */
class InMemoryScenarioTableTest {

    @Test
    void testBuilder() {
        InMemoryScenarioTable table = InMemoryScenarioTable.builder()
                .setFirstHour(3)
                .addHour(5, 1, 2, 100, 50)
                .addHour(6, 3, 4, 110, 55)
                .build();
        assertEquals(3, table.getFirstHour());
        assertEquals(4, table.getLastHour());
        assertEquals(2, table.getHourCount());
        assertEquals(6, table.getLoad(4));
        assertEquals(3, table.getPv(4));
        assertEquals(2, table.getWind(3));
        assertEquals(110, table.getImportPrice(4));
        assertEquals(50, table.getExportPrice(3));
        InputShapeException e = assertThrows(InputShapeException.class, () -> table.getLoad(5));
        assertEquals("Hour 5 is outside of the table [3, 4]", e.getMessage());
    }

    @Test
    void testArraysAreCopied() {
        double[] load = {1, 2};
        double[] zeros = {0, 0};
        InMemoryScenarioTable table = new InMemoryScenarioTable(0, load, zeros, zeros, zeros, zeros);
        load[0] = 100;
        assertEquals(1, table.getLoad(0));
    }

    @Test
    void testLoadScale() {
        InMemoryScenarioTable table = InMemoryScenarioTable.builder()
                .addHour(5, 1, 2, 100, 50)
                .addHour(6, 3, 4, 110, 55)
                .build();
        InMemoryScenarioTable scaled = table.withLoadScale(1.5);
        assertEquals(7.5, scaled.getLoad(0));
        assertEquals(9, scaled.getLoad(1));
        assertEquals(3, scaled.getPv(1));
        assertEquals(5, table.getLoad(0));
        assertThrows(IllegalArgumentException.class, () -> table.withLoadScale(-1));
    }

    @Test
    void testCopyOf() {
        ScenarioTable view = new ScenarioTable() {
            @Override
            public int getFirstHour() {
                return 1;
            }

            @Override
            public int getLastHour() {
                return 3;
            }

            @Override
            public double getLoad(int hour) {
                return hour * 2.0;
            }

            @Override
            public double getPv(int hour) {
                return 0;
            }

            @Override
            public double getWind(int hour) {
                return 1;
            }

            @Override
            public double getImportPrice(int hour) {
                return 100;
            }

            @Override
            public double getExportPrice(int hour) {
                return 50;
            }
        };
        InMemoryScenarioTable copy = InMemoryScenarioTable.copyOf(view);
        assertEquals(1, copy.getFirstHour());
        assertEquals(3, copy.getLastHour());
        assertEquals(6, copy.getLoad(3));
        assertSame(copy, InMemoryScenarioTable.copyOf(copy));
    }
}
