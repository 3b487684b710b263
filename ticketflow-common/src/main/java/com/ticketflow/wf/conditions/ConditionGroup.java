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
 * A flat list of conditions combined with AND or OR; used to guard transitions.
 * A group without conditions always matches.
 */
public final class ConditionGroup {

    private final List<Condition> conditions;
    private final ConditionLogic logic;

    public ConditionGroup(List<Condition> conditions, ConditionLogic logic) {
        this.conditions = (conditions == null
                           ? Collections.emptyList()
                           : Collections.unmodifiableList(List.copyOf(conditions)));
        this.logic = (logic == null ? ConditionLogic.AND : logic);
    }

    public static ConditionGroup allOf(Condition... conditions) {
        return new ConditionGroup(List.of(conditions), ConditionLogic.AND);
    }

    public static ConditionGroup anyOf(Condition... conditions) {
        return new ConditionGroup(List.of(conditions), ConditionLogic.OR);
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public ConditionLogic getLogic() {
        return logic;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ConditionGroup that = (ConditionGroup) other;
        return conditions.equals(that.conditions) && logic == that.logic;
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, logic);
    }
}
