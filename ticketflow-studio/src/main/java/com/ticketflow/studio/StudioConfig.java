/*
 *   Copyright Ticketflow Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.ticketflow.studio;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

import com.ticketflow.wf.ids.StepIdGenerator;
import com.ticketflow.wf.ids.TimestampStepIdGenerator;

/**
 * Container for configuration data used by the workflow studio components.
 */
public class StudioConfig {

    public static final int DEFAULT_UNDO_HISTORY_LIMIT = 50;

    private Clock clock = Clock.systemUTC();
    private ZoneId zoneId = ZoneOffset.UTC;
    private StepIdGenerator idGenerator;
    private int undoHistoryLimit = DEFAULT_UNDO_HISTORY_LIMIT;
    private boolean autoRepairBranchJoins = true;

    public Clock getClock() {
        return clock;
    }

    /**
     * Overrides the clock used for export timestamps, generated ids and "today" in date rules.
     * Defaults to the system UTC clock.
     */
    public void setClock(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock may not be null.");
        }
        this.clock = clock;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    /**
     * The time zone that decides which calendar day "today" is for date validation. Defaults to UTC.
     */
    public void setZoneId(ZoneId zoneId) {
        if (zoneId == null) {
            throw new IllegalArgumentException("zoneId may not be null.");
        }
        this.zoneId = zoneId;
    }

    /**
     * Returns the configured id generator, or a timestamp-based generator using the configured clock
     * if none was set.
     */
    public StepIdGenerator getIdGenerator() {
        if (idGenerator == null) {
            idGenerator = new TimestampStepIdGenerator(clock);
        }
        return idGenerator;
    }

    public void setIdGenerator(StepIdGenerator idGenerator) {
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator may not be null.");
        }
        this.idGenerator = idGenerator;
    }

    public int getUndoHistoryLimit() {
        return undoHistoryLimit;
    }

    /**
     * How many edits an editor session remembers for undo. Zero disables undo.
     */
    public void setUndoHistoryLimit(Integer undoHistoryLimit) {
        if (undoHistoryLimit == null) {
            throw new IllegalArgumentException("undoHistoryLimit may not be null.");
        }
        if (undoHistoryLimit < 0) {
            throw new IllegalArgumentException("undoHistoryLimit may not be negative.");
        }
        this.undoHistoryLimit = undoHistoryLimit;
    }

    public boolean isAutoRepairBranchJoins() {
        return autoRepairBranchJoins;
    }

    /**
     * If enabled (the default), saving a session first connects the last step of every fork branch to its join.
     */
    public void setAutoRepairBranchJoins(Boolean autoRepairBranchJoins) {
        if (autoRepairBranchJoins == null) {
            throw new IllegalArgumentException("autoRepairBranchJoins may not be null.");
        }
        this.autoRepairBranchJoins = autoRepairBranchJoins;
    }
}
