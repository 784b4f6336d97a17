/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Decisions actually applied by the receding horizon controller, one per simulated hour. Rows can only
 * be appended, for the hour following the last committed one, and are never modified afterwards.
 * Single writer, not thread safe.
 *
 * @author PowSyBl Open Microgrid team
 */
public class CommittedSchedule {

    private final List<CommittedHour> hours = new ArrayList<>();

    public CommittedHour commit(int hour, DispatchDecision decision, double objectiveValue) {
        Objects.requireNonNull(decision);
        if (!hours.isEmpty()) {
            int expectedHour = hours.get(hours.size() - 1).hour() + 1;
            if (hour != expectedHour) {
                throw new IllegalStateException("Cannot commit hour " + hour + ", next hour to commit is " + expectedHour);
            }
        }
        CommittedHour committedHour = new CommittedHour(hour, decision, objectiveValue);
        hours.add(committedHour);
        return committedHour;
    }

    public List<CommittedHour> getHours() {
        return Collections.unmodifiableList(hours);
    }

    public int size() {
        return hours.size();
    }

    public boolean isEmpty() {
        return hours.isEmpty();
    }

    public OptionalInt getFirstHour() {
        return hours.isEmpty() ? OptionalInt.empty() : OptionalInt.of(hours.get(0).hour());
    }

    public OptionalInt getLastCommittedHour() {
        return hours.isEmpty() ? OptionalInt.empty() : OptionalInt.of(hours.get(hours.size() - 1).hour());
    }

    /**
     * Storage level at the end of the last committed hour.
     */
    public OptionalDouble getFinalSoc() {
        return hours.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(hours.get(hours.size() - 1).decision().soc());
    }

    public CommittedHour getHour(int hour) {
        int first = getFirstHour().orElseThrow(() -> new IllegalArgumentException("Schedule is empty"));
        int i = hour - first;
        if (i < 0 || i >= hours.size()) {
            throw new IllegalArgumentException("Hour " + hour + " has not been committed");
        }
        return hours.get(i);
    }
}
