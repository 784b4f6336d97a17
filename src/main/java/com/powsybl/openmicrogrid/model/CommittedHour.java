/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.model;

import java.util.Objects;

/**
 * @param objectiveValue cost of the whole horizon the decision was taken from
 *
 * @author PowSyBl Open Microgrid team
 */
public record CommittedHour(int hour, DispatchDecision decision, double objectiveValue) {

    public CommittedHour {
        Objects.requireNonNull(decision);
    }
}
