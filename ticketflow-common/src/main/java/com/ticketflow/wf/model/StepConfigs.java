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

/**
 * Default configurations for newly created steps.
 */
public final class StepConfigs {

    private StepConfigs() {}

    public static StepConfig defaultFor(StepType type) {
        if (type == null) {
            throw new IllegalArgumentException("type may not be null.");
        }
        switch (type) {
            case FORM:
                return new FormConfig(null);
            case APPROVAL:
                return ApprovalConfig.requesterManager();
            case TASK:
                return new TaskConfig("");
            case NOTIFY:
                return new NotifyConfig(null, null);
            case FORK:
                return new ForkConfig(null, BranchFailurePolicy.FAIL_ALL);
            case JOIN:
                return new JoinConfig(null, JoinMode.ALL, null);
            case SUB_WORKFLOW:
                return new SubWorkflowConfig(null, null, null);
            default:
                throw new IllegalStateException("No default configuration for step type " + type);
        }
    }
}
