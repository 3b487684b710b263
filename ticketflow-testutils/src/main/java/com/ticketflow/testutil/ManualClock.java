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

package com.ticketflow.testutil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A clock that only moves when told to, for tests that depend on "today".
 */
public class ManualClock extends Clock {

    private Instant curTime;
    private final ZoneId zone;

    public ManualClock() {
        this(Instant.now());
    }

    public ManualClock(Instant startTime) {
        this(startTime, ZoneOffset.UTC);
    }

    public ManualClock(Instant startTime, ZoneId zone) {
        this.curTime = startTime;
        this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns this clock; the zone only affects how callers interpret the instant.
     */
    @Override
    public Clock withZone(ZoneId newZone) {
        return this;
    }

    @Override
    public Instant instant() {
        return curTime;
    }

    @Override
    public long millis() {
        return curTime.toEpochMilli();
    }

    public Instant forward(Duration amount) {
        curTime = curTime.plus(amount);
        return curTime;
    }

    public Instant rewind(Duration amount) {
        curTime = curTime.minus(amount);
        return curTime;
    }
}
