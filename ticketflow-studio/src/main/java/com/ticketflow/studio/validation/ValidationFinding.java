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

package com.ticketflow.studio.validation;

import java.util.Objects;

/**
 * One problem found in a workflow definition.
 */
public final class ValidationFinding {

    private final FindingType type;
    private final String message;
    private final String stepId;
    private final String path;

    public ValidationFinding(FindingType type, String message, String stepId, String path) {
        if (type == null) {
            throw new IllegalArgumentException("type may not be null.");
        }
        this.type = type;
        this.message = message;
        this.stepId = stepId;
        this.path = path;
    }

    public ValidationFinding(FindingType type, String message, String stepId) {
        this(type, message, stepId, null);
    }

    public FindingType getType() {
        return type;
    }

    public Severity getSeverity() {
        return type.getSeverity();
    }

    public String getMessage() {
        return message;
    }

    /**
     * The step the finding is about, or null for findings about the workflow as a whole.
     */
    public String getStepId() {
        return stepId;
    }

    /**
     * Location within the document, e.g. "steps[2].source_fork_step_id". Only set by publish checks.
     */
    public String getPath() {
        return path;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ValidationFinding that = (ValidationFinding) other;
        return type == that.type && Objects.equals(message, that.message) && Objects.equals(stepId, that.stepId)
               && Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message, stepId, path);
    }

    @Override
    public String toString() {
        return type + (stepId == null ? "" : "[" + stepId + "]") + ": " + message;
    }
}
