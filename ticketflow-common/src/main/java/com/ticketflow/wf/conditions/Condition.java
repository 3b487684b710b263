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

import java.util.Objects;

/**
 * A single comparison of a context value against a constant, e.g. "priority equals HIGH".
 *
 * The operator name is kept as written so that conditions using an operator this version
 * doesn't know about can still be stored and reported; such conditions never match.
 */
public final class Condition {

    private final String fieldKey;
    private final String operatorName;
    private final ConditionOperator operator;
    private final Object value;

    public Condition(String fieldKey, ConditionOperator operator, Object value) {
        this(fieldKey, operator == null ? null : operator.getWireName(), value);
    }

    public Condition(String fieldKey, String operatorName, Object value) {
        if (fieldKey == null) {
            throw new IllegalArgumentException("fieldKey may not be null.");
        }
        this.fieldKey = fieldKey;
        this.operatorName = operatorName;
        this.operator = ConditionOperator.fromWireName(operatorName);
        this.value = value;
    }

    public String getFieldKey() {
        return fieldKey;
    }

    public String getOperatorName() {
        return operatorName;
    }

    /**
     * Null when the operator name was not recognized.
     */
    public ConditionOperator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Condition that = (Condition) other;
        return fieldKey.equals(that.fieldKey)
               && Objects.equals(operatorName, that.operatorName)
               && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldKey, operatorName, value);
    }

    @Override
    public String toString() {
        return fieldKey + " " + operatorName + " " + value;
    }
}
