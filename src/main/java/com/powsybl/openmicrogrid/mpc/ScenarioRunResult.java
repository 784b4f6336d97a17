/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.mpc;

import com.powsybl.openmicrogrid.model.CommittedSchedule;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one variant of a batch. On failure the schedule holds the hours committed before it.
 *
 * @author PowSyBl Open Microgrid team
 */
public final class ScenarioRunResult {

    private final ScenarioVariant variant;

    private final CommittedSchedule schedule;

    private final RuntimeException failure;

    private ScenarioRunResult(ScenarioVariant variant, CommittedSchedule schedule, RuntimeException failure) {
        this.variant = Objects.requireNonNull(variant);
        this.schedule = Objects.requireNonNull(schedule);
        this.failure = failure;
    }

    public static ScenarioRunResult success(ScenarioVariant variant, CommittedSchedule schedule) {
        return new ScenarioRunResult(variant, schedule, null);
    }

    public static ScenarioRunResult failure(ScenarioVariant variant, CommittedSchedule partialSchedule, RuntimeException failure) {
        return new ScenarioRunResult(variant, partialSchedule, Objects.requireNonNull(failure));
    }

    public ScenarioVariant getVariant() {
        return variant;
    }

    public CommittedSchedule getSchedule() {
        return schedule;
    }

    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isOk() {
        return failure == null;
    }
}
