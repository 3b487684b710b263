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

package com.ticketflow.wf.model;

import java.util.Objects;

public final class JoinConfig implements StepConfig {

    private final String sourceForkStepId;
    private final JoinMode joinMode;
    private final Integer timeoutMinutes;

    public JoinConfig(String sourceForkStepId, JoinMode joinMode, Integer timeoutMinutes) {
        this.sourceForkStepId = (sourceForkStepId == null || sourceForkStepId.isEmpty() ? null : sourceForkStepId);
        this.joinMode = (joinMode == null ? JoinMode.ALL : joinMode);
        this.timeoutMinutes = timeoutMinutes;
    }

    public JoinConfig(String sourceForkStepId) {
        this(sourceForkStepId, JoinMode.ALL, null);
    }

    @Override
    public StepType getStepType() {
        return StepType.JOIN;
    }

    /**
     * The fork whose branches this join waits for, or null if none has been chosen yet.
     */
    public String getSourceForkStepId() {
        return sourceForkStepId;
    }

    public JoinMode getJoinMode() {
        return joinMode;
    }

    public Integer getTimeoutMinutes() {
        return timeoutMinutes;
    }

    public JoinConfig withSourceForkStepId(String forkStepId) {
        return new JoinConfig(forkStepId, joinMode, timeoutMinutes);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof JoinConfig)) {
            return false;
        }
        JoinConfig that = (JoinConfig) other;
        return Objects.equals(sourceForkStepId, that.sourceForkStepId)
               && joinMode == that.joinMode
               && Objects.equals(timeoutMinutes, that.timeoutMinutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceForkStepId, joinMode, timeoutMinutes);
    }
}
