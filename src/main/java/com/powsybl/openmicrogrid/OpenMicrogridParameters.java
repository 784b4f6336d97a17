/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.commons.parameters.Parameter;
import com.powsybl.commons.parameters.ParameterScope;
import com.powsybl.commons.parameters.ParameterType;
import com.powsybl.openmicrogrid.milp.CbcMilpBackendFactory;
import com.powsybl.openmicrogrid.milp.HighsMilpBackendFactory;
import com.powsybl.openmicrogrid.milp.ScipMilpBackendFactory;
import de.vandermeer.asciitable.AsciiTable;
import de.vandermeer.asciitable.CWC_LongestWord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Technical and economic parameters of the microgrid plus the settings of the receding horizon
 * controller. Powers are in MW, energies in MWh and prices in currency per MWh.
 *
 * @author PowSyBl Open Microgrid team
 */
public class OpenMicrogridParameters {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenMicrogridParameters.class);

    public static final String MODULE_NAME = "open-microgrid-default-parameters";

    public static final double TIMESTEP_HOURS_DEFAULT_VALUE = 1.0;
    public static final int HORIZON_HOURS_DEFAULT_VALUE = 24;
    public static final int START_HOUR_DEFAULT_VALUE = 0;
    public static final double INITIAL_SOC_DEFAULT_VALUE = 0.0;
    public static final double IMPORT_MAX_POWER_DEFAULT_VALUE = 1000.0;
    public static final double EXPORT_MAX_POWER_DEFAULT_VALUE = 1000.0;
    public static final double ELECTROLYZER_NOMINAL_POWER_DEFAULT_VALUE = 5.0;
    public static final double ELECTROLYZER_MIN_POWER_DEFAULT_VALUE = 0.5;
    public static final double FUEL_CELL_NOMINAL_POWER_DEFAULT_VALUE = 3.0;
    public static final double FUEL_CELL_MIN_POWER_DEFAULT_VALUE = 0.3;
    public static final double DIESEL_NOMINAL_POWER_DEFAULT_VALUE = 5.0;
    public static final double DIESEL_MIN_POWER_DEFAULT_VALUE = 1.0;
    public static final double ELECTROLYZER_EFFICIENCY_DEFAULT_VALUE = 0.7;
    public static final double FUEL_CELL_EFFICIENCY_DEFAULT_VALUE = 0.5;
    public static final double DIESEL_EFFICIENCY_DEFAULT_VALUE = 0.6;
    public static final double STORAGE_CAPACITY_DEFAULT_VALUE = 12.0;

    /**
     * Thermal fuel price in currency per MWh (0.45 per kWh).
     */
    public static final double FUEL_PRICE_DEFAULT_VALUE = 450.0;

    /**
     * Small enough to never change an economic decision, only used to prefer using renewable energy
     * over wasting it when costs are otherwise equal.
     */
    public static final double CURTAILMENT_PENALTY_DEFAULT_VALUE = 1.0;

    public static final boolean IMPORT_EXPORT_EXCLUSION_DEFAULT_VALUE = true;
    public static final List<String> SOLVER_BACKENDS_DEFAULT_VALUE = List.of(ScipMilpBackendFactory.NAME, HighsMilpBackendFactory.NAME, CbcMilpBackendFactory.NAME);
    public static final double SOLVE_TIME_LIMIT_SECONDS_DEFAULT_VALUE = 60.0;
    public static final double ENERGY_BALANCE_TOLERANCE_DEFAULT_VALUE = 1E-6;

    public static final String TIMESTEP_HOURS_PARAM_NAME = "timestepHours";
    public static final String HORIZON_HOURS_PARAM_NAME = "horizonHours";
    public static final String START_HOUR_PARAM_NAME = "startHour";
    public static final String INITIAL_SOC_PARAM_NAME = "initialSoc";
    public static final String IMPORT_MAX_POWER_PARAM_NAME = "importMaxPower";
    public static final String EXPORT_MAX_POWER_PARAM_NAME = "exportMaxPower";
    public static final String ELECTROLYZER_NOMINAL_POWER_PARAM_NAME = "electrolyzerNominalPower";
    public static final String ELECTROLYZER_MIN_POWER_PARAM_NAME = "electrolyzerMinPower";
    public static final String FUEL_CELL_NOMINAL_POWER_PARAM_NAME = "fuelCellNominalPower";
    public static final String FUEL_CELL_MIN_POWER_PARAM_NAME = "fuelCellMinPower";
    public static final String DIESEL_NOMINAL_POWER_PARAM_NAME = "dieselNominalPower";
    public static final String DIESEL_MIN_POWER_PARAM_NAME = "dieselMinPower";
    public static final String ELECTROLYZER_EFFICIENCY_PARAM_NAME = "electrolyzerEfficiency";
    public static final String FUEL_CELL_EFFICIENCY_PARAM_NAME = "fuelCellEfficiency";
    public static final String DIESEL_EFFICIENCY_PARAM_NAME = "dieselEfficiency";
    public static final String STORAGE_CAPACITY_PARAM_NAME = "storageCapacity";
    public static final String FUEL_PRICE_PARAM_NAME = "fuelPrice";
    public static final String CURTAILMENT_PENALTY_PARAM_NAME = "curtailmentPenalty";
    public static final String IMPORT_EXPORT_EXCLUSION_PARAM_NAME = "importExportExclusion";
    public static final String SOLVER_BACKENDS_PARAM_NAME = "solverBackends";
    public static final String SOLVE_TIME_LIMIT_SECONDS_PARAM_NAME = "solveTimeLimitSeconds";
    public static final String ENERGY_BALANCE_TOLERANCE_PARAM_NAME = "energyBalanceTolerance";

    private static final String CONTROLLER_CATEGORY_KEY = "Controller";
    private static final String GRID_CATEGORY_KEY = "Grid";
    private static final String UNITS_CATEGORY_KEY = "Units";
    private static final String STORAGE_CATEGORY_KEY = "Storage";
    private static final String ECONOMICS_CATEGORY_KEY = "Economics";
    private static final String SOLVER_CATEGORY_KEY = "Solver";

    public static final List<Parameter> SPECIFIC_PARAMETERS = List.of(
        new Parameter(TIMESTEP_HOURS_PARAM_NAME, ParameterType.DOUBLE, "Length of a time step in hours", TIMESTEP_HOURS_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, CONTROLLER_CATEGORY_KEY),
        new Parameter(HORIZON_HOURS_PARAM_NAME, ParameterType.INTEGER, "Number of steps of one optimization horizon", HORIZON_HOURS_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, CONTROLLER_CATEGORY_KEY),
        new Parameter(START_HOUR_PARAM_NAME, ParameterType.INTEGER, "First simulated hour", START_HOUR_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, CONTROLLER_CATEGORY_KEY),
        new Parameter(INITIAL_SOC_PARAM_NAME, ParameterType.DOUBLE, "Hydrogen storage level at the first simulated hour (MWh)", INITIAL_SOC_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, STORAGE_CATEGORY_KEY),
        new Parameter(IMPORT_MAX_POWER_PARAM_NAME, ParameterType.DOUBLE, "Maximum grid import (MW)", IMPORT_MAX_POWER_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, GRID_CATEGORY_KEY),
        new Parameter(EXPORT_MAX_POWER_PARAM_NAME, ParameterType.DOUBLE, "Maximum grid export (MW)", EXPORT_MAX_POWER_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, GRID_CATEGORY_KEY),
        new Parameter(IMPORT_EXPORT_EXCLUSION_PARAM_NAME, ParameterType.BOOLEAN, "Forbid simultaneous grid import and export", IMPORT_EXPORT_EXCLUSION_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, GRID_CATEGORY_KEY),
        new Parameter(ELECTROLYZER_NOMINAL_POWER_PARAM_NAME, ParameterType.DOUBLE, "Electrolyzer nominal power (MW)", ELECTROLYZER_NOMINAL_POWER_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, UNITS_CATEGORY_KEY),
        new Parameter(ELECTROLYZER_MIN_POWER_PARAM_NAME, ParameterType.DOUBLE, "Electrolyzer minimum technical power (MW)", ELECTROLYZER_MIN_POWER_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, UNITS_CATEGORY_KEY),
        new Parameter(FUEL_CELL_NOMINAL_POWER_PARAM_NAME, ParameterType.DOUBLE, "Fuel cell nominal power (MW)", FUEL_CELL_NOMINAL_POWER_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, UNITS_CATEGORY_KEY),
        new Parameter(FUEL_CELL_MIN_POWER_PARAM_NAME, ParameterType.DOUBLE, "Fuel cell minimum technical power (MW)", FUEL_CELL_MIN_POWER_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, UNITS_CATEGORY_KEY),
        new Parameter(DIESEL_NOMINAL_POWER_PARAM_NAME, ParameterType.DOUBLE, "Diesel generator nominal power (MW)", DIESEL_NOMINAL_POWER_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, UNITS_CATEGORY_KEY),
        new Parameter(DIESEL_MIN_POWER_PARAM_NAME, ParameterType.DOUBLE, "Diesel generator minimum technical power (MW)", DIESEL_MIN_POWER_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, UNITS_CATEGORY_KEY),
        new Parameter(ELECTROLYZER_EFFICIENCY_PARAM_NAME, ParameterType.DOUBLE, "Electrolyzer efficiency", ELECTROLYZER_EFFICIENCY_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, STORAGE_CATEGORY_KEY),
        new Parameter(FUEL_CELL_EFFICIENCY_PARAM_NAME, ParameterType.DOUBLE, "Fuel cell efficiency", FUEL_CELL_EFFICIENCY_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, STORAGE_CATEGORY_KEY),
        new Parameter(DIESEL_EFFICIENCY_PARAM_NAME, ParameterType.DOUBLE, "Diesel generator efficiency", DIESEL_EFFICIENCY_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, UNITS_CATEGORY_KEY),
        new Parameter(STORAGE_CAPACITY_PARAM_NAME, ParameterType.DOUBLE, "Hydrogen storage capacity (MWh)", STORAGE_CAPACITY_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, STORAGE_CATEGORY_KEY),
        new Parameter(FUEL_PRICE_PARAM_NAME, ParameterType.DOUBLE, "Diesel fuel price (per thermal MWh)", FUEL_PRICE_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, ECONOMICS_CATEGORY_KEY),
        new Parameter(CURTAILMENT_PENALTY_PARAM_NAME, ParameterType.DOUBLE, "Penalty on curtailed renewable energy (per MWh)", CURTAILMENT_PENALTY_DEFAULT_VALUE, ParameterScope.FUNCTIONAL, ECONOMICS_CATEGORY_KEY),
        new Parameter(SOLVER_BACKENDS_PARAM_NAME, ParameterType.STRING_LIST, "MILP backends in order of preference", SOLVER_BACKENDS_DEFAULT_VALUE, ParameterScope.TECHNICAL, SOLVER_CATEGORY_KEY),
        new Parameter(SOLVE_TIME_LIMIT_SECONDS_PARAM_NAME, ParameterType.DOUBLE, "Time limit of a single horizon solve in seconds", SOLVE_TIME_LIMIT_SECONDS_DEFAULT_VALUE, ParameterScope.TECHNICAL, SOLVER_CATEGORY_KEY),
        new Parameter(ENERGY_BALANCE_TOLERANCE_PARAM_NAME, ParameterType.DOUBLE, "Relative energy balance residual above which a warning is issued", ENERGY_BALANCE_TOLERANCE_DEFAULT_VALUE, ParameterScope.TECHNICAL, SOLVER_CATEGORY_KEY)
    );

    private double timestepHours = TIMESTEP_HOURS_DEFAULT_VALUE;

    private int horizonHours = HORIZON_HOURS_DEFAULT_VALUE;

    private int startHour = START_HOUR_DEFAULT_VALUE;

    private double initialSoc = INITIAL_SOC_DEFAULT_VALUE;

    private double importMaxPower = IMPORT_MAX_POWER_DEFAULT_VALUE;

    private double exportMaxPower = EXPORT_MAX_POWER_DEFAULT_VALUE;

    private boolean importExportExclusion = IMPORT_EXPORT_EXCLUSION_DEFAULT_VALUE;

    private double electrolyzerNominalPower = ELECTROLYZER_NOMINAL_POWER_DEFAULT_VALUE;

    private double electrolyzerMinPower = ELECTROLYZER_MIN_POWER_DEFAULT_VALUE;

    private double fuelCellNominalPower = FUEL_CELL_NOMINAL_POWER_DEFAULT_VALUE;

    private double fuelCellMinPower = FUEL_CELL_MIN_POWER_DEFAULT_VALUE;

    private double dieselNominalPower = DIESEL_NOMINAL_POWER_DEFAULT_VALUE;

    private double dieselMinPower = DIESEL_MIN_POWER_DEFAULT_VALUE;

    private double electrolyzerEfficiency = ELECTROLYZER_EFFICIENCY_DEFAULT_VALUE;

    private double fuelCellEfficiency = FUEL_CELL_EFFICIENCY_DEFAULT_VALUE;

    private double dieselEfficiency = DIESEL_EFFICIENCY_DEFAULT_VALUE;

    private double storageCapacity = STORAGE_CAPACITY_DEFAULT_VALUE;

    private double fuelPrice = FUEL_PRICE_DEFAULT_VALUE;

    private double curtailmentPenalty = CURTAILMENT_PENALTY_DEFAULT_VALUE;

    private List<String> solverBackends = SOLVER_BACKENDS_DEFAULT_VALUE;

    private double solveTimeLimitSeconds = SOLVE_TIME_LIMIT_SECONDS_DEFAULT_VALUE;

    private double energyBalanceTolerance = ENERGY_BALANCE_TOLERANCE_DEFAULT_VALUE;

    public static double checkParameterValue(double parameterValue, boolean condition, String parameterName) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": " + parameterValue);
        }
        return parameterValue;
    }

    public static int checkParameterValue(int parameterValue, boolean condition, String parameterName) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": " + parameterValue);
        }
        return parameterValue;
    }

    private static double checkNonNegative(double value, String parameterName) {
        return checkParameterValue(value, value >= 0 && Double.isFinite(value), parameterName);
    }

    private static double checkEfficiency(double value, String parameterName) {
        return checkParameterValue(value, value > 0 && value <= 1, parameterName);
    }

    public double getTimestepHours() {
        return timestepHours;
    }

    public OpenMicrogridParameters setTimestepHours(double timestepHours) {
        this.timestepHours = checkParameterValue(timestepHours, timestepHours > 0, TIMESTEP_HOURS_PARAM_NAME);
        return this;
    }

    public int getHorizonHours() {
        return horizonHours;
    }

    public OpenMicrogridParameters setHorizonHours(int horizonHours) {
        this.horizonHours = checkParameterValue(horizonHours, horizonHours >= 1, HORIZON_HOURS_PARAM_NAME);
        return this;
    }

    public int getStartHour() {
        return startHour;
    }

    public OpenMicrogridParameters setStartHour(int startHour) {
        this.startHour = checkParameterValue(startHour, startHour >= 0, START_HOUR_PARAM_NAME);
        return this;
    }

    public double getInitialSoc() {
        return initialSoc;
    }

    public OpenMicrogridParameters setInitialSoc(double initialSoc) {
        this.initialSoc = checkNonNegative(initialSoc, INITIAL_SOC_PARAM_NAME);
        return this;
    }

    public double getImportMaxPower() {
        return importMaxPower;
    }

    public OpenMicrogridParameters setImportMaxPower(double importMaxPower) {
        this.importMaxPower = checkNonNegative(importMaxPower, IMPORT_MAX_POWER_PARAM_NAME);
        return this;
    }

    public double getExportMaxPower() {
        return exportMaxPower;
    }

    public OpenMicrogridParameters setExportMaxPower(double exportMaxPower) {
        this.exportMaxPower = checkNonNegative(exportMaxPower, EXPORT_MAX_POWER_PARAM_NAME);
        return this;
    }

    public boolean isImportExportExclusion() {
        return importExportExclusion;
    }

    public OpenMicrogridParameters setImportExportExclusion(boolean importExportExclusion) {
        this.importExportExclusion = importExportExclusion;
        return this;
    }

    public double getElectrolyzerNominalPower() {
        return electrolyzerNominalPower;
    }

    public OpenMicrogridParameters setElectrolyzerNominalPower(double electrolyzerNominalPower) {
        this.electrolyzerNominalPower = checkNonNegative(electrolyzerNominalPower, ELECTROLYZER_NOMINAL_POWER_PARAM_NAME);
        return this;
    }

    public double getElectrolyzerMinPower() {
        return electrolyzerMinPower;
    }

    public OpenMicrogridParameters setElectrolyzerMinPower(double electrolyzerMinPower) {
        this.electrolyzerMinPower = checkNonNegative(electrolyzerMinPower, ELECTROLYZER_MIN_POWER_PARAM_NAME);
        return this;
    }

    public double getFuelCellNominalPower() {
        return fuelCellNominalPower;
    }

    public OpenMicrogridParameters setFuelCellNominalPower(double fuelCellNominalPower) {
        this.fuelCellNominalPower = checkNonNegative(fuelCellNominalPower, FUEL_CELL_NOMINAL_POWER_PARAM_NAME);
        return this;
    }

    public double getFuelCellMinPower() {
        return fuelCellMinPower;
    }

    public OpenMicrogridParameters setFuelCellMinPower(double fuelCellMinPower) {
        this.fuelCellMinPower = checkNonNegative(fuelCellMinPower, FUEL_CELL_MIN_POWER_PARAM_NAME);
        return this;
    }

    public double getDieselNominalPower() {
        return dieselNominalPower;
    }

    public OpenMicrogridParameters setDieselNominalPower(double dieselNominalPower) {
        this.dieselNominalPower = checkNonNegative(dieselNominalPower, DIESEL_NOMINAL_POWER_PARAM_NAME);
        return this;
    }

    public double getDieselMinPower() {
        return dieselMinPower;
    }

    public OpenMicrogridParameters setDieselMinPower(double dieselMinPower) {
        this.dieselMinPower = checkNonNegative(dieselMinPower, DIESEL_MIN_POWER_PARAM_NAME);
        return this;
    }

    public double getElectrolyzerEfficiency() {
        return electrolyzerEfficiency;
    }

    public OpenMicrogridParameters setElectrolyzerEfficiency(double electrolyzerEfficiency) {
        this.electrolyzerEfficiency = checkEfficiency(electrolyzerEfficiency, ELECTROLYZER_EFFICIENCY_PARAM_NAME);
        return this;
    }

    public double getFuelCellEfficiency() {
        return fuelCellEfficiency;
    }

    public OpenMicrogridParameters setFuelCellEfficiency(double fuelCellEfficiency) {
        this.fuelCellEfficiency = checkEfficiency(fuelCellEfficiency, FUEL_CELL_EFFICIENCY_PARAM_NAME);
        return this;
    }

    public double getDieselEfficiency() {
        return dieselEfficiency;
    }

    public OpenMicrogridParameters setDieselEfficiency(double dieselEfficiency) {
        this.dieselEfficiency = checkEfficiency(dieselEfficiency, DIESEL_EFFICIENCY_PARAM_NAME);
        return this;
    }

    public double getStorageCapacity() {
        return storageCapacity;
    }

    public OpenMicrogridParameters setStorageCapacity(double storageCapacity) {
        this.storageCapacity = checkNonNegative(storageCapacity, STORAGE_CAPACITY_PARAM_NAME);
        return this;
    }

    public double getFuelPrice() {
        return fuelPrice;
    }

    public OpenMicrogridParameters setFuelPrice(double fuelPrice) {
        this.fuelPrice = checkNonNegative(fuelPrice, FUEL_PRICE_PARAM_NAME);
        return this;
    }

    public double getCurtailmentPenalty() {
        return curtailmentPenalty;
    }

    public OpenMicrogridParameters setCurtailmentPenalty(double curtailmentPenalty) {
        this.curtailmentPenalty = checkNonNegative(curtailmentPenalty, CURTAILMENT_PENALTY_PARAM_NAME);
        return this;
    }

    public List<String> getSolverBackends() {
        return solverBackends;
    }

    public OpenMicrogridParameters setSolverBackends(List<String> solverBackends) {
        Objects.requireNonNull(solverBackends);
        if (solverBackends.isEmpty()) {
            throw new IllegalArgumentException("Invalid value for parameter " + SOLVER_BACKENDS_PARAM_NAME + ": empty list");
        }
        this.solverBackends = List.copyOf(solverBackends);
        return this;
    }

    public double getSolveTimeLimitSeconds() {
        return solveTimeLimitSeconds;
    }

    public OpenMicrogridParameters setSolveTimeLimitSeconds(double solveTimeLimitSeconds) {
        this.solveTimeLimitSeconds = checkParameterValue(solveTimeLimitSeconds, solveTimeLimitSeconds > 0, SOLVE_TIME_LIMIT_SECONDS_PARAM_NAME);
        return this;
    }

    public double getEnergyBalanceTolerance() {
        return energyBalanceTolerance;
    }

    public OpenMicrogridParameters setEnergyBalanceTolerance(double energyBalanceTolerance) {
        this.energyBalanceTolerance = checkParameterValue(energyBalanceTolerance, energyBalanceTolerance > 0, ENERGY_BALANCE_TOLERANCE_PARAM_NAME);
        return this;
    }

    /**
     * Minimum powers larger than nominal powers leave only the off state to the solver, which is
     * accepted but most likely a configuration mistake.
     */
    public void checkConsistency() {
        checkMinBelowNominal(electrolyzerMinPower, electrolyzerNominalPower, ELECTROLYZER_MIN_POWER_PARAM_NAME);
        checkMinBelowNominal(fuelCellMinPower, fuelCellNominalPower, FUEL_CELL_MIN_POWER_PARAM_NAME);
        checkMinBelowNominal(dieselMinPower, dieselNominalPower, DIESEL_MIN_POWER_PARAM_NAME);
        if (initialSoc > storageCapacity) {
            throw new IllegalArgumentException("Initial storage level " + initialSoc + " MWh exceeds storage capacity " + storageCapacity + " MWh");
        }
    }

    private static void checkMinBelowNominal(double minPower, double nominalPower, String parameterName) {
        if (minPower > nominalPower) {
            LOGGER.warn("Parameter {} ({} MW) is above the nominal power ({} MW), unit can only stay off",
                    parameterName, minPower, nominalPower);
        }
    }

    public OpenMicrogridParameters copy() {
        return new OpenMicrogridParameters().update(this);
    }

    private OpenMicrogridParameters update(OpenMicrogridParameters other) {
        timestepHours = other.timestepHours;
        horizonHours = other.horizonHours;
        startHour = other.startHour;
        initialSoc = other.initialSoc;
        importMaxPower = other.importMaxPower;
        exportMaxPower = other.exportMaxPower;
        importExportExclusion = other.importExportExclusion;
        electrolyzerNominalPower = other.electrolyzerNominalPower;
        electrolyzerMinPower = other.electrolyzerMinPower;
        fuelCellNominalPower = other.fuelCellNominalPower;
        fuelCellMinPower = other.fuelCellMinPower;
        dieselNominalPower = other.dieselNominalPower;
        dieselMinPower = other.dieselMinPower;
        electrolyzerEfficiency = other.electrolyzerEfficiency;
        fuelCellEfficiency = other.fuelCellEfficiency;
        dieselEfficiency = other.dieselEfficiency;
        storageCapacity = other.storageCapacity;
        fuelPrice = other.fuelPrice;
        curtailmentPenalty = other.curtailmentPenalty;
        solverBackends = other.solverBackends;
        solveTimeLimitSeconds = other.solveTimeLimitSeconds;
        energyBalanceTolerance = other.energyBalanceTolerance;
        return this;
    }

    public static OpenMicrogridParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OpenMicrogridParameters load(PlatformConfig platformConfig) {
        OpenMicrogridParameters parameters = new OpenMicrogridParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setTimestepHours(config.getDoubleProperty(TIMESTEP_HOURS_PARAM_NAME, TIMESTEP_HOURS_DEFAULT_VALUE))
                .setHorizonHours(config.getIntProperty(HORIZON_HOURS_PARAM_NAME, HORIZON_HOURS_DEFAULT_VALUE))
                .setStartHour(config.getIntProperty(START_HOUR_PARAM_NAME, START_HOUR_DEFAULT_VALUE))
                .setInitialSoc(config.getDoubleProperty(INITIAL_SOC_PARAM_NAME, INITIAL_SOC_DEFAULT_VALUE))
                .setImportMaxPower(config.getDoubleProperty(IMPORT_MAX_POWER_PARAM_NAME, IMPORT_MAX_POWER_DEFAULT_VALUE))
                .setExportMaxPower(config.getDoubleProperty(EXPORT_MAX_POWER_PARAM_NAME, EXPORT_MAX_POWER_DEFAULT_VALUE))
                .setImportExportExclusion(config.getBooleanProperty(IMPORT_EXPORT_EXCLUSION_PARAM_NAME, IMPORT_EXPORT_EXCLUSION_DEFAULT_VALUE))
                .setElectrolyzerNominalPower(config.getDoubleProperty(ELECTROLYZER_NOMINAL_POWER_PARAM_NAME, ELECTROLYZER_NOMINAL_POWER_DEFAULT_VALUE))
                .setElectrolyzerMinPower(config.getDoubleProperty(ELECTROLYZER_MIN_POWER_PARAM_NAME, ELECTROLYZER_MIN_POWER_DEFAULT_VALUE))
                .setFuelCellNominalPower(config.getDoubleProperty(FUEL_CELL_NOMINAL_POWER_PARAM_NAME, FUEL_CELL_NOMINAL_POWER_DEFAULT_VALUE))
                .setFuelCellMinPower(config.getDoubleProperty(FUEL_CELL_MIN_POWER_PARAM_NAME, FUEL_CELL_MIN_POWER_DEFAULT_VALUE))
                .setDieselNominalPower(config.getDoubleProperty(DIESEL_NOMINAL_POWER_PARAM_NAME, DIESEL_NOMINAL_POWER_DEFAULT_VALUE))
                .setDieselMinPower(config.getDoubleProperty(DIESEL_MIN_POWER_PARAM_NAME, DIESEL_MIN_POWER_DEFAULT_VALUE))
                .setElectrolyzerEfficiency(config.getDoubleProperty(ELECTROLYZER_EFFICIENCY_PARAM_NAME, ELECTROLYZER_EFFICIENCY_DEFAULT_VALUE))
                .setFuelCellEfficiency(config.getDoubleProperty(FUEL_CELL_EFFICIENCY_PARAM_NAME, FUEL_CELL_EFFICIENCY_DEFAULT_VALUE))
                .setDieselEfficiency(config.getDoubleProperty(DIESEL_EFFICIENCY_PARAM_NAME, DIESEL_EFFICIENCY_DEFAULT_VALUE))
                .setStorageCapacity(config.getDoubleProperty(STORAGE_CAPACITY_PARAM_NAME, STORAGE_CAPACITY_DEFAULT_VALUE))
                .setFuelPrice(config.getDoubleProperty(FUEL_PRICE_PARAM_NAME, FUEL_PRICE_DEFAULT_VALUE))
                .setCurtailmentPenalty(config.getDoubleProperty(CURTAILMENT_PENALTY_PARAM_NAME, CURTAILMENT_PENALTY_DEFAULT_VALUE))
                .setSolverBackends(config.getStringListProperty(SOLVER_BACKENDS_PARAM_NAME, SOLVER_BACKENDS_DEFAULT_VALUE))
                .setSolveTimeLimitSeconds(config.getDoubleProperty(SOLVE_TIME_LIMIT_SECONDS_PARAM_NAME, SOLVE_TIME_LIMIT_SECONDS_DEFAULT_VALUE))
                .setEnergyBalanceTolerance(config.getDoubleProperty(ENERGY_BALANCE_TOLERANCE_PARAM_NAME, ENERGY_BALANCE_TOLERANCE_DEFAULT_VALUE)));
        return parameters;
    }

    public static OpenMicrogridParameters load(Map<String, String> properties) {
        return new OpenMicrogridParameters().update(properties);
    }

    private static List<String> parseStringListProp(String prop) {
        if (prop.trim().isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(prop.split("[:,]"));
    }

    public OpenMicrogridParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(TIMESTEP_HOURS_PARAM_NAME))
                .ifPresent(prop -> this.setTimestepHours(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(HORIZON_HOURS_PARAM_NAME))
                .ifPresent(prop -> this.setHorizonHours(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(START_HOUR_PARAM_NAME))
                .ifPresent(prop -> this.setStartHour(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(INITIAL_SOC_PARAM_NAME))
                .ifPresent(prop -> this.setInitialSoc(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(IMPORT_MAX_POWER_PARAM_NAME))
                .ifPresent(prop -> this.setImportMaxPower(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(EXPORT_MAX_POWER_PARAM_NAME))
                .ifPresent(prop -> this.setExportMaxPower(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(IMPORT_EXPORT_EXCLUSION_PARAM_NAME))
                .ifPresent(prop -> this.setImportExportExclusion(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(ELECTROLYZER_NOMINAL_POWER_PARAM_NAME))
                .ifPresent(prop -> this.setElectrolyzerNominalPower(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(ELECTROLYZER_MIN_POWER_PARAM_NAME))
                .ifPresent(prop -> this.setElectrolyzerMinPower(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(FUEL_CELL_NOMINAL_POWER_PARAM_NAME))
                .ifPresent(prop -> this.setFuelCellNominalPower(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(FUEL_CELL_MIN_POWER_PARAM_NAME))
                .ifPresent(prop -> this.setFuelCellMinPower(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(DIESEL_NOMINAL_POWER_PARAM_NAME))
                .ifPresent(prop -> this.setDieselNominalPower(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(DIESEL_MIN_POWER_PARAM_NAME))
                .ifPresent(prop -> this.setDieselMinPower(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(ELECTROLYZER_EFFICIENCY_PARAM_NAME))
                .ifPresent(prop -> this.setElectrolyzerEfficiency(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(FUEL_CELL_EFFICIENCY_PARAM_NAME))
                .ifPresent(prop -> this.setFuelCellEfficiency(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(DIESEL_EFFICIENCY_PARAM_NAME))
                .ifPresent(prop -> this.setDieselEfficiency(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(STORAGE_CAPACITY_PARAM_NAME))
                .ifPresent(prop -> this.setStorageCapacity(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(FUEL_PRICE_PARAM_NAME))
                .ifPresent(prop -> this.setFuelPrice(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(CURTAILMENT_PENALTY_PARAM_NAME))
                .ifPresent(prop -> this.setCurtailmentPenalty(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SOLVER_BACKENDS_PARAM_NAME))
                .ifPresent(prop -> this.setSolverBackends(parseStringListProp(prop)));
        Optional.ofNullable(properties.get(SOLVE_TIME_LIMIT_SECONDS_PARAM_NAME))
                .ifPresent(prop -> this.setSolveTimeLimitSeconds(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(ENERGY_BALANCE_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setEnergyBalanceTolerance(Double.parseDouble(prop)));
        return this;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(SPECIFIC_PARAMETERS.size());
        map.put(TIMESTEP_HOURS_PARAM_NAME, timestepHours);
        map.put(HORIZON_HOURS_PARAM_NAME, horizonHours);
        map.put(START_HOUR_PARAM_NAME, startHour);
        map.put(INITIAL_SOC_PARAM_NAME, initialSoc);
        map.put(IMPORT_MAX_POWER_PARAM_NAME, importMaxPower);
        map.put(EXPORT_MAX_POWER_PARAM_NAME, exportMaxPower);
        map.put(IMPORT_EXPORT_EXCLUSION_PARAM_NAME, importExportExclusion);
        map.put(ELECTROLYZER_NOMINAL_POWER_PARAM_NAME, electrolyzerNominalPower);
        map.put(ELECTROLYZER_MIN_POWER_PARAM_NAME, electrolyzerMinPower);
        map.put(FUEL_CELL_NOMINAL_POWER_PARAM_NAME, fuelCellNominalPower);
        map.put(FUEL_CELL_MIN_POWER_PARAM_NAME, fuelCellMinPower);
        map.put(DIESEL_NOMINAL_POWER_PARAM_NAME, dieselNominalPower);
        map.put(DIESEL_MIN_POWER_PARAM_NAME, dieselMinPower);
        map.put(ELECTROLYZER_EFFICIENCY_PARAM_NAME, electrolyzerEfficiency);
        map.put(FUEL_CELL_EFFICIENCY_PARAM_NAME, fuelCellEfficiency);
        map.put(DIESEL_EFFICIENCY_PARAM_NAME, dieselEfficiency);
        map.put(STORAGE_CAPACITY_PARAM_NAME, storageCapacity);
        map.put(FUEL_PRICE_PARAM_NAME, fuelPrice);
        map.put(CURTAILMENT_PENALTY_PARAM_NAME, curtailmentPenalty);
        map.put(SOLVER_BACKENDS_PARAM_NAME, solverBackends);
        map.put(SOLVE_TIME_LIMIT_SECONDS_PARAM_NAME, solveTimeLimitSeconds);
        map.put(ENERGY_BALANCE_TOLERANCE_PARAM_NAME, energyBalanceTolerance);
        return map;
    }

    @Override
    public String toString() {
        return "OpenMicrogridParameters(" + toMap().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ")";
    }

    public static void log(OpenMicrogridParameters parameters) {
        if (LOGGER.isInfoEnabled()) {
            Map<String, String> categoryByParameterName = new HashMap<>();
            for (Parameter parameter : SPECIFIC_PARAMETERS) {
                categoryByParameterName.put(parameter.getName(), parameter.getCategoryKey());
            }

            record CategorizedParameter(String category, String name, Object value) implements Comparable<CategorizedParameter> {
                @Override
                public int compareTo(CategorizedParameter o) {
                    int c = category.compareTo(o.category);
                    if (c == 0) {
                        c = name.compareTo(o.name);
                    }
                    return c;
                }
            }
            Set<CategorizedParameter> categorizedParameters = parameters.toMap().entrySet()
                    .stream()
                    .map(e -> new CategorizedParameter(categoryByParameterName.getOrDefault(e.getKey(), "None"), e.getKey(), e.getValue()))
                    .collect(Collectors.toCollection(TreeSet::new));

            AsciiTable at = new AsciiTable();
            at.addRule();
            at.addRow("Category", "Name", "Value");
            at.addRule();
            String previousCategory = null;
            for (var p : categorizedParameters) {
                String category = p.category.equals(previousCategory) ? "" : p.category; // to not repeat in the table for each row
                previousCategory = p.category;
                at.addRow(category, p.name, Objects.toString(p.value, ""));
            }
            at.addRule();
            at.getRenderer().setCWC(new CWC_LongestWord());
            at.setPaddingLeftRight(1, 1);
            LOGGER.info("Parameters:\n{}", at.render());
        }
    }
}
