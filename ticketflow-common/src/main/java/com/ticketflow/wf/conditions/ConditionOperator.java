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

/**
 * Comparison operators understood by the {@link ConditionEvaluator}.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    IN("in"),
    NOT_IN("not_in"),
    IS_EMPTY("is_empty"),
    IS_NOT_EMPTY("is_not_empty"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_THAN_OR_EQUALS("greater_than_or_equals"),
    LESS_THAN_OR_EQUALS("less_than_or_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Case-insensitive lookup, so both "not_in" and "NOT_IN" resolve. Returns null if the name is not recognized.
     */
    public static ConditionOperator fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (ConditionOperator op : values()) {
            if (op.wireName.equalsIgnoreCase(name)) {
                return op;
            }
        }
        return null;
    }
}
