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

import com.ticketflow.wf.conditions.CompoundCondition;

/**
 * A "when ... then ..." rule attached to a form field.
 */
public final class ConditionalRequirement {

    private final String ruleId;
    private final CompoundCondition when;
    private final RequirementOutcome then;

    public ConditionalRequirement(String ruleId, CompoundCondition when, RequirementOutcome then) {
        if (when == null) {
            throw new IllegalArgumentException("when may not be null.");
        }
        if (then == null) {
            throw new IllegalArgumentException("then may not be null.");
        }
        this.ruleId = ruleId;
        this.when = when;
        this.then = then;
    }

    public String getRuleId() {
        return ruleId;
    }

    public CompoundCondition getWhen() {
        return when;
    }

    public RequirementOutcome getThen() {
        return then;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ConditionalRequirement that = (ConditionalRequirement) other;
        return Objects.equals(ruleId, that.ruleId) && when.equals(that.when) && then.equals(that.then);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, when, then);
    }
}
