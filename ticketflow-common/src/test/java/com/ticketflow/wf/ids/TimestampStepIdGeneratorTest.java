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
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TimestampStepIdGeneratorTest {

    @Test
    public void idsAreUniqueEvenWithinTheSameMillisecond() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1700000000000L), ZoneOffset.UTC);
        TimestampStepIdGenerator ids = new TimestampStepIdGenerator(clock);
        Assertions.assertEquals("step_1700000000000_1", ids.nextStepId());
        Assertions.assertEquals("step_1700000000000_2", ids.nextStepId());
        Assertions.assertEquals("t_1700000000000_3", ids.nextTransitionId());
        Assertions.assertEquals("branch_1700000000000_4", ids.nextBranchId());
    }

    @Test
    public void rejectsNullClock() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TimestampStepIdGenerator(null));
    }
}
