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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.ticketflow.wf.model.form.FormField;

public final class TaskConfig implements StepConfig {

    private final String instructions;
    private final boolean executionNotesRequired;
    private final List<FormField> fields;

    public TaskConfig(String instructions, boolean executionNotesRequired, List<FormField> fields) {
        this.instructions = (instructions == null ? "" : instructions);
        this.executionNotesRequired = executionNotesRequired;
        this.fields = (fields == null ? Collections.emptyList() : List.copyOf(fields));
    }

    public TaskConfig(String instructions) {
        this(instructions, false, null);
    }

    @Override
    public StepType getStepType() {
        return StepType.TASK;
    }

    public String getInstructions() {
        return instructions;
    }

    public boolean isExecutionNotesRequired() {
        return executionNotesRequired;
    }

    /**
     * Fields the assigned agent fills in while completing the task.
     */
    public List<FormField> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TaskConfig)) {
            return false;
        }
        TaskConfig that = (TaskConfig) other;
        return executionNotesRequired == that.executionNotesRequired
               && instructions.equals(that.instructions)
               && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instructions, executionNotesRequired, fields);
    }
}
