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

package com.ticketflow.wf.model.form;

import java.util.Objects;

/**
 * What applies to a field when a conditional requirement matches.
 */
public final class RequirementOutcome {

    private final boolean required;
    private final DateValidation dateValidation;

    public RequirementOutcome(boolean required, DateValidation dateValidation) {
        this.required = required;
        this.dateValidation = dateValidation;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Null when the rule doesn't override date validation.
     */
    public DateValidation getDateValidation() {
        return dateValidation;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        RequirementOutcome that = (RequirementOutcome) other;
        return required == that.required && Objects.equals(dateValidation, that.dateValidation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(required, dateValidation);
    }
}
