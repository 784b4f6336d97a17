/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.scenario;

import com.powsybl.openmicrogrid.InputShapeException;
import com.powsybl.openmicrogrid.OpenMicrogridParameters;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable slice of a {@link ScenarioTable} over the hours of one optimization horizon, together with
 * the microgrid parameters the horizon is solved with. Indexes of the getters are relative to the
 * first hour of the window.
 *
 * @author PowSyBl Open Microgrid team
 */
public final class ScenarioWindow {

    private final int firstHour;

    private final double[] load;

    private final double[] pv;

    private final double[] wind;

    private final double[] importPrice;

    private final double[] exportPrice;

    private final OpenMicrogridParameters parameters;

    public ScenarioWindow(int firstHour, double[] load, double[] pv, double[] wind, double[] importPrice, double[] exportPrice,
                          OpenMicrogridParameters parameters) {
        Objects.requireNonNull(load);
        Objects.requireNonNull(pv);
        Objects.requireNonNull(wind);
        Objects.requireNonNull(importPrice);
        Objects.requireNonNull(exportPrice);
        checkSeriesLengths(load.length, pv.length, wind.length, importPrice.length, exportPrice.length);
        this.firstHour = firstHour;
        this.load = load.clone();
        this.pv = pv.clone();
        this.wind = wind.clone();
        this.importPrice = importPrice.clone();
        this.exportPrice = exportPrice.clone();
        this.parameters = Objects.requireNonNull(parameters).copy();
    }

    static void checkSeriesLengths(int loadLength, int pvLength, int windLength, int importPriceLength, int exportPriceLength) {
        if (pvLength != loadLength || windLength != loadLength || importPriceLength != loadLength || exportPriceLength != loadLength) {
            throw new InputShapeException("Inconsistent series lengths: load=" + loadLength + ", pv=" + pvLength + ", wind=" + windLength
                    + ", importPrice=" + importPriceLength + ", exportPrice=" + exportPriceLength);
        }
        if (loadLength < 1) {
            throw new InputShapeException("At least one hour is required");
        }
    }

    /**
     * Copy the hours [firstHour, firstHour + hourCount - 1] of the table.
     */
    public static ScenarioWindow slice(ScenarioTable table, int firstHour, int hourCount, OpenMicrogridParameters parameters) {
        Objects.requireNonNull(table);
        if (hourCount < 1) {
            throw new InputShapeException("Invalid horizon length: " + hourCount);
        }
        int lastHour = firstHour + hourCount - 1;
        if (firstHour < table.getFirstHour() || lastHour > table.getLastHour()) {
            throw new InputShapeException("Window [" + firstHour + ", " + lastHour + "] extends outside of available hours ["
                    + table.getFirstHour() + ", " + table.getLastHour() + "]");
        }
        double[] load = new double[hourCount];
        double[] pv = new double[hourCount];
        double[] wind = new double[hourCount];
        double[] importPrice = new double[hourCount];
        double[] exportPrice = new double[hourCount];
        for (int t = 0; t < hourCount; t++) {
            int hour = firstHour + t;
            load[t] = table.getLoad(hour);
            pv[t] = table.getPv(hour);
            wind[t] = table.getWind(hour);
            importPrice[t] = table.getImportPrice(hour);
            exportPrice[t] = table.getExportPrice(hour);
        }
        return new ScenarioWindow(firstHour, load, pv, wind, importPrice, exportPrice, parameters);
    }

    public int getFirstHour() {
        return firstHour;
    }

    public int getHourCount() {
        return load.length;
    }

    public double getLoad(int t) {
        return load[t];
    }

    public double getPv(int t) {
        return pv[t];
    }

    public double getWind(int t) {
        return wind[t];
    }

    public double getImportPrice(int t) {
        return importPrice[t];
    }

    public double getExportPrice(int t) {
        return exportPrice[t];
    }

    public double getMaxLoad() {
        return Arrays.stream(load).max().orElse(0);
    }

    public OpenMicrogridParameters getParameters() {
        return parameters.copy();
    }

    public double getTimestepHours() {
        return parameters.getTimestepHours();
    }
}
