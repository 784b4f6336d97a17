/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.scenario;

import com.powsybl.openmicrogrid.InputShapeException;
import gnu.trove.list.array.TDoubleArrayList;

import java.util.Objects;

/**
 * @author PowSyBl Open Microgrid team
 */
public class InMemoryScenarioTable implements ScenarioTable {

    private final int firstHour;

    private final double[] load;

    private final double[] pv;

    private final double[] wind;

    private final double[] importPrice;

    private final double[] exportPrice;

    public InMemoryScenarioTable(int firstHour, double[] load, double[] pv, double[] wind, double[] importPrice, double[] exportPrice) {
        if (firstHour < 0) {
            throw new InputShapeException("First hour must be non negative: " + firstHour);
        }
        this.firstHour = firstHour;
        this.load = Objects.requireNonNull(load).clone();
        this.pv = Objects.requireNonNull(pv).clone();
        this.wind = Objects.requireNonNull(wind).clone();
        this.importPrice = Objects.requireNonNull(importPrice).clone();
        this.exportPrice = Objects.requireNonNull(exportPrice).clone();
        ScenarioWindow.checkSeriesLengths(load.length, pv.length, wind.length, importPrice.length, exportPrice.length);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Same table with the load forecast multiplied by the given factor, prices and renewables unchanged.
     */
    public InMemoryScenarioTable withLoadScale(double loadScale) {
        if (loadScale < 0 || !Double.isFinite(loadScale)) {
            throw new IllegalArgumentException("Invalid load scale: " + loadScale);
        }
        double[] scaledLoad = new double[load.length];
        for (int i = 0; i < load.length; i++) {
            scaledLoad[i] = load[i] * loadScale;
        }
        return new InMemoryScenarioTable(firstHour, scaledLoad, pv, wind, importPrice, exportPrice);
    }

    public static InMemoryScenarioTable copyOf(ScenarioTable table) {
        if (table instanceof InMemoryScenarioTable inMemoryTable) {
            return inMemoryTable;
        }
        Builder builder = builder().setFirstHour(table.getFirstHour());
        for (int hour = table.getFirstHour(); hour <= table.getLastHour(); hour++) {
            builder.addHour(table.getLoad(hour), table.getPv(hour), table.getWind(hour), table.getImportPrice(hour), table.getExportPrice(hour));
        }
        return builder.build();
    }

    private int index(int hour) {
        int i = hour - firstHour;
        if (i < 0 || i >= load.length) {
            throw new InputShapeException("Hour " + hour + " is outside of the table [" + firstHour + ", " + getLastHour() + "]");
        }
        return i;
    }

    @Override
    public int getFirstHour() {
        return firstHour;
    }

    @Override
    public int getLastHour() {
        return firstHour + load.length - 1;
    }

    @Override
    public double getLoad(int hour) {
        return load[index(hour)];
    }

    @Override
    public double getPv(int hour) {
        return pv[index(hour)];
    }

    @Override
    public double getWind(int hour) {
        return wind[index(hour)];
    }

    @Override
    public double getImportPrice(int hour) {
        return importPrice[index(hour)];
    }

    @Override
    public double getExportPrice(int hour) {
        return exportPrice[index(hour)];
    }

    public static class Builder {

        private int firstHour = 0;

        private final TDoubleArrayList load = new TDoubleArrayList();

        private final TDoubleArrayList pv = new TDoubleArrayList();

        private final TDoubleArrayList wind = new TDoubleArrayList();

        private final TDoubleArrayList importPrice = new TDoubleArrayList();

        private final TDoubleArrayList exportPrice = new TDoubleArrayList();

        public Builder setFirstHour(int firstHour) {
            this.firstHour = firstHour;
            return this;
        }

        public Builder addHour(double load, double pv, double wind, double importPrice, double exportPrice) {
            this.load.add(load);
            this.pv.add(pv);
            this.wind.add(wind);
            this.importPrice.add(importPrice);
            this.exportPrice.add(exportPrice);
            return this;
        }

        public InMemoryScenarioTable build() {
            return new InMemoryScenarioTable(firstHour, load.toArray(), pv.toArray(), wind.toArray(), importPrice.toArray(), exportPrice.toArray());
        }
    }
}
