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

import java.util.concurrent.atomic.AtomicInteger;

import com.ticketflow.wf.ids.StepIdGenerator;

/**
 * Hands out predictable ids ("step_1", "step_2", "t_1", ...) so tests can refer to newly created elements.
 */
public class SequentialIdGenerator implements StepIdGenerator {

    private final AtomicInteger stepCounter = new AtomicInteger();
    private final AtomicInteger transitionCounter = new AtomicInteger();
    private final AtomicInteger branchCounter = new AtomicInteger();

    @Override
    public String nextStepId() {
        return "step_" + stepCounter.incrementAndGet();
    }

    @Override
    public String nextTransitionId() {
        return "t_" + transitionCounter.incrementAndGet();
    }

    @Override
    public String nextBranchId() {
        return "branch_" + branchCounter.incrementAndGet();
    }
}
