/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.report;

import com.powsybl.commons.io.table.Column;
import com.powsybl.commons.io.table.CsvTableFormatter;
import com.powsybl.commons.io.table.TableFormatter;
import com.powsybl.commons.io.table.TableFormatterConfig;
import com.powsybl.openmicrogrid.model.CommittedHour;
import com.powsybl.openmicrogrid.model.CommittedSchedule;
import com.powsybl.openmicrogrid.model.DispatchDecision;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes a committed schedule as CSV, one row per hour, powers in MW, SOC in MWh and the cost of the
 * horizon each decision comes from.
 *
 * @author PowSyBl Open Microgrid team
 */
public final class ScheduleCsvWriter {

    public static final String[] COLUMNS = {
        "hour", "p_import_mw", "p_export_mw", "p_ely_mw", "p_fc_mw", "p_dg_mw", "p_curt_mw", "soc_mwh", "objective_eur"
    };

    private static final char SEPARATOR = ',';

    private ScheduleCsvWriter() {
    }

    public static void write(CommittedSchedule schedule, Path file) {
        Objects.requireNonNull(file);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(schedule, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(CommittedSchedule schedule, Writer writer) {
        Objects.requireNonNull(schedule);
        Objects.requireNonNull(writer);
        TableFormatterConfig config = new TableFormatterConfig(Locale.ROOT, SEPARATOR, "", true, false);
        Column[] columns = new Column[COLUMNS.length];
        for (int i = 0; i < COLUMNS.length; i++) {
            columns[i] = new Column(COLUMNS[i]);
        }
        try (TableFormatter formatter = new CsvTableFormatter(writer, "schedule", config, columns)) {
            for (CommittedHour hour : schedule.getHours()) {
                DispatchDecision d = hour.decision();
                formatter.writeCell(hour.hour())
                        .writeCell(format(d.importPower()))
                        .writeCell(format(d.exportPower()))
                        .writeCell(format(d.electrolyzerPower()))
                        .writeCell(format(d.fuelCellPower()))
                        .writeCell(format(d.dieselPower()))
                        .writeCell(format(d.curtailment()))
                        .writeCell(format(d.soc()))
                        .writeCell(format(hour.objectiveValue()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String format(double value) {
        return Double.toString(value);
    }
}
