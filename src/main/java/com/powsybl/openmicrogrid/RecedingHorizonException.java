/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid;

import com.powsybl.openmicrogrid.model.CommittedSchedule;

import java.util.Objects;

/**
 * Receding horizon run stopped by a failed horizon solve. The hours committed before the failure are
 * kept in {@link #getPartialSchedule()} and the run can be resumed from there.
 *
 * @author PowSyBl Open Microgrid team
 */
public class RecedingHorizonException extends OpenMicrogridException {

    private final int failedHour;

    private final transient CommittedSchedule partialSchedule;

    public RecedingHorizonException(int failedHour, CommittedSchedule partialSchedule, Throwable cause) {
        super("Receding horizon stopped at hour " + failedHour + " after " + partialSchedule.size()
                + " committed hours: " + cause.getMessage(), cause);
        this.failedHour = failedHour;
        this.partialSchedule = Objects.requireNonNull(partialSchedule);
    }

    public int getFailedHour() {
        return failedHour;
    }

    public CommittedSchedule getPartialSchedule() {
        return partialSchedule;
    }
}
