/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.scenario;

/**
 * Hourly forecasts and prices over a contiguous range of hours, as produced by the input loaders.
 * Powers are in MW, prices in currency per MWh.
 *
 * @author PowSyBl Open Microgrid team
 */
public interface ScenarioTable {

    int getFirstHour();

    int getLastHour();

    default int getHourCount() {
        return getLastHour() - getFirstHour() + 1;
    }

    double getLoad(int hour);

    double getPv(int hour);

    double getWind(int hour);

    double getImportPrice(int hour);

    double getExportPrice(int hour);
}
