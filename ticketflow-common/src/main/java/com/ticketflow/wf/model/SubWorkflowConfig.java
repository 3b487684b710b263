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

/**
 * Embeds a specific published version of another workflow.
 */
public final class SubWorkflowConfig implements StepConfig {

    private final String subWorkflowId;
    private final Integer subWorkflowVersion;
    private final String subWorkflowName;

    public SubWorkflowConfig(String subWorkflowId, Integer subWorkflowVersion, String subWorkflowName) {
        this.subWorkflowId = subWorkflowId;
        this.subWorkflowVersion = subWorkflowVersion;
        this.subWorkflowName = subWorkflowName;
    }

    @Override
    public StepType getStepType() {
        return StepType.SUB_WORKFLOW;
    }

    public String getSubWorkflowId() {
        return subWorkflowId;
    }

    public Integer getSubWorkflowVersion() {
        return subWorkflowVersion;
    }

    public String getSubWorkflowName() {
        return subWorkflowName;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SubWorkflowConfig)) {
            return false;
        }
        SubWorkflowConfig that = (SubWorkflowConfig) other;
        return Objects.equals(subWorkflowId, that.subWorkflowId)
               && Objects.equals(subWorkflowVersion, that.subWorkflowVersion)
               && Objects.equals(subWorkflowName, that.subWorkflowName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subWorkflowId, subWorkflowVersion, subWorkflowName);
    }
}
