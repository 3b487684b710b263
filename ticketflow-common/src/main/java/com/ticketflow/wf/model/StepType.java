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
 * The kinds of steps a workflow definition can contain.
 */
public enum StepType {
    FORM("FORM_STEP", "Form"),
    APPROVAL("APPROVAL_STEP", "Approval"),
    TASK("TASK_STEP", "Task"),
    NOTIFY("NOTIFY_STEP", "Notification"),
    FORK("FORK_STEP", "Parallel Fork"),
    JOIN("JOIN_STEP", "Join"),
    SUB_WORKFLOW("SUB_WORKFLOW_STEP", "Sub-Workflow");

    private final String wireName;
    private final String label;

    StepType(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    /**
     * The name used for this type in stored workflow documents.
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * Human-readable label, used to name newly created steps.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Looks up a step type by its document name. Both "FORM_STEP" and "FORM" are accepted.
     * Returns null if the name is not recognized.
     */
    public static StepType fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (StepType type : values()) {
            if (type.wireName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return null;
    }
}
