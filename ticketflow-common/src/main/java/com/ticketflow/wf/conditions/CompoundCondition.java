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

package com.ticketflow.wf.conditions;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A primary condition plus any number of additional conditions, combined with AND or OR.
 * This is the shape used by the "when" clause of conditional field requirements.
 */
public final class CompoundCondition {

    private final Condition primary;
    private final ConditionLogic logic;
    private final List<Condition> additionalConditions;

    public CompoundCondition(Condition primary) {
        this(primary, ConditionLogic.AND, Collections.emptyList());
    }

    public CompoundCondition(Condition primary, ConditionLogic logic, List<Condition> additionalConditions) {
        if (primary == null) {
            throw new IllegalArgumentException("primary may not be null.");
        }
        this.primary = primary;
        this.logic = (logic == null ? ConditionLogic.AND : logic);
        this.additionalConditions = (additionalConditions == null
                                     ? Collections.emptyList()
                                     : Collections.unmodifiableList(List.copyOf(additionalConditions)));
    }

    public Condition getPrimary() {
        return primary;
    }

    public ConditionLogic getLogic() {
        return logic;
    }

    public List<Condition> getAdditionalConditions() {
        return additionalConditions;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        CompoundCondition that = (CompoundCondition) other;
        return primary.equals(that.primary) && logic == that.logic
               && additionalConditions.equals(that.additionalConditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primary, logic, additionalConditions);
    }
}
