/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.report;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.openmicrogrid.model.CommittedSchedule;
import com.powsybl.openmicrogrid.model.DispatchDecision;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl Open Microgrid team
 */
class ScheduleCsvWriterTest {

    private static CommittedSchedule createSchedule() {
        CommittedSchedule schedule = new CommittedSchedule();
        schedule.commit(5, new DispatchDecision(1.5, 0, 2, 0, 0, 0.25, 1.4, false, true, false, true, false), 321.5);
        schedule.commit(6, new DispatchDecision(0, 3, 0, 1, 2, 0, 0.6, true, false, true, false, true), 100);
        return schedule;
    }

    private static List<String> nonEmptyLines(String csv) {
        return csv.lines().filter(l -> !l.isBlank()).toList();
    }

    @Test
    void testWrite() {
        StringWriter writer = new StringWriter();
        ScheduleCsvWriter.write(createSchedule(), writer);
        List<String> lines = nonEmptyLines(writer.toString());

        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("hour,p_import_mw,p_export_mw,p_ely_mw,p_fc_mw,p_dg_mw,p_curt_mw,soc_mwh,objective_eur"));
        String[] row1 = lines.get(1).split(",");
        assertEquals("5", row1[0]);
        assertEquals(1.5, Double.parseDouble(row1[1]));
        assertEquals(2, Double.parseDouble(row1[3]));
        assertEquals(0.25, Double.parseDouble(row1[6]));
        assertEquals(1.4, Double.parseDouble(row1[7]));
        assertEquals(321.5, Double.parseDouble(row1[8]));
        String[] row2 = lines.get(2).split(",");
        assertEquals("6", row2[0]);
        assertEquals(3, Double.parseDouble(row2[2]));
        assertEquals(2, Double.parseDouble(row2[5]));
    }

    @Test
    void testWriteFile() throws IOException {
        try (FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix())) {
            Path file = fileSystem.getPath("/schedule.csv");
            ScheduleCsvWriter.write(createSchedule(), file);
            List<String> lines = nonEmptyLines(Files.readString(file, StandardCharsets.UTF_8));
            assertEquals(3, lines.size());
            assertTrue(lines.get(2).startsWith("6,"));
        }
    }
}
