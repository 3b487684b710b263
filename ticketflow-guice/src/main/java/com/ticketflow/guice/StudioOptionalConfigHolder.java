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

package com.ticketflow.guice;

import java.time.Clock;
import java.time.ZoneId;

import com.google.inject.Inject;

/**
 * For internal use only - allows certain configurations to be optionally provided by users,
 * with default behavior if they're not provided.
 */
public class StudioOptionalConfigHolder {

    private Clock clock = null;
    private ZoneId zoneId = null;
    private Integer undoHistoryLimit = null;
    private Boolean autoRepairBranchJoins = null;

    public Clock getClock() {
        return clock;
    }

    @Inject(optional = true)
    public void setClock(@StudioClock Clock clock) {
        this.clock = clock;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    @Inject(optional = true)
    public void setZoneId(@StudioZone ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public Integer getUndoHistoryLimit() {
        return undoHistoryLimit;
    }

    @Inject(optional = true)
    public void setUndoHistoryLimit(@UndoHistoryLimit Integer undoHistoryLimit) {
        this.undoHistoryLimit = undoHistoryLimit;
    }

    public Boolean getAutoRepairBranchJoins() {
        return autoRepairBranchJoins;
    }

    @Inject(optional = true)
    public void setAutoRepairBranchJoins(@AutoRepairBranchJoins Boolean autoRepairBranchJoins) {
        this.autoRepairBranchJoins = autoRepairBranchJoins;
    }
}
