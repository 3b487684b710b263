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

package com.ticketflow.wf.ids;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates ids of the form "step_&lt;millis&gt;_&lt;n&gt;", so they sort roughly by creation time
 * and stay unique when several are created within the same millisecond.
 */
public class TimestampStepIdGenerator implements StepIdGenerator {

    private final Clock clock;
    private final AtomicLong counter = new AtomicLong();

    public TimestampStepIdGenerator(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock may not be null.");
        }
        this.clock = clock;
    }

    @Override
    public String nextStepId() {
        return next("step");
    }

    @Override
    public String nextTransitionId() {
        return next("t");
    }

    @Override
    public String nextBranchId() {
        return next("branch");
    }

    private String next(String prefix) {
        return prefix + "_" + clock.millis() + "_" + counter.incrementAndGet();
    }
}
