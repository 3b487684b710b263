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

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates conditions against a flat context of field values, optionally overlaid with a row context
 * (the values of the table row currently being edited).
 *
 * Evaluation never throws; anything that can't be evaluated counts as "no match".
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    /**
     * Evaluates a single condition.
     *
     * @param condition  The condition to evaluate.
     * @param context    Field values keyed by field key.
     * @param rowContext Optional row values; these take precedence over the context for keys they contain.
     */
    public boolean evaluate(Condition condition, Map<String, Object> context, Map<String, Object> rowContext) {
        if (condition == null) {
            return false;
        }
        ConditionOperator operator = condition.getOperator();
        if (operator == null) {
            log.warn("Unrecognized condition operator '{}' on field {}, treating the condition as false.",
                     condition.getOperatorName(), condition.getFieldKey());
            return false;
        }

        Object fieldValue = lookup(condition.getFieldKey(), context, rowContext);
        Object expected = condition.getValue();

        switch (operator) {
            case EQUALS:
                return valuesEqual(fieldValue, expected);
            case NOT_EQUALS:
                return !valuesEqual(fieldValue, expected);
            case IN:
                return expected instanceof Collection && containsValue((Collection<?>) expected, fieldValue);
            case NOT_IN:
                return expected instanceof Collection && !containsValue((Collection<?>) expected, fieldValue);
            case IS_EMPTY:
                return isEmpty(fieldValue);
            case IS_NOT_EMPTY:
                return !isEmpty(fieldValue);
            case GREATER_THAN:
            case LESS_THAN:
            case GREATER_THAN_OR_EQUALS:
            case LESS_THAN_OR_EQUALS:
                return compareNumbers(operator, fieldValue, expected, condition);
            case CONTAINS:
                return fieldValue != null && contains(fieldValue, expected);
            case NOT_CONTAINS:
                return fieldValue == null || !contains(fieldValue, expected);
            default:
                log.warn("No evaluation rule for operator {}, treating the condition as false.", operator);
                return false;
        }
    }

    public boolean evaluate(Condition condition, Map<String, Object> context) {
        return evaluate(condition, context, null);
    }

    /**
     * Evaluates the primary condition and any additional conditions, combining them with the compound's logic.
     * Without additional conditions the result is that of the primary condition.
     */
    public boolean evaluate(CompoundCondition compound, Map<String, Object> context, Map<String, Object> rowContext) {
        if (compound == null) {
            return false;
        }
        boolean result = evaluate(compound.getPrimary(), context, rowContext);
        if (compound.getAdditionalConditions().isEmpty()) {
            return result;
        }
        boolean isOr = (compound.getLogic() == ConditionLogic.OR);
        for (Condition additional : compound.getAdditionalConditions()) {
            boolean next = evaluate(additional, context, rowContext);
            result = isOr ? (result || next) : (result && next);
        }
        return result;
    }

    /**
     * Evaluates a transition guard. A null or empty group matches.
     */
    public boolean evaluate(ConditionGroup group, Map<String, Object> context) {
        if (group == null || group.getConditions().isEmpty()) {
            return true;
        }
        if (group.getLogic() == ConditionLogic.OR) {
            return group.getConditions().stream().anyMatch(c -> evaluate(c, context, null));
        }
        return group.getConditions().stream().allMatch(c -> evaluate(c, context, null));
    }

    /**
     * Resolves a field value. The row context wins if it has the key; otherwise the context is consulted,
     * falling back to a dotted path through nested maps (e.g. "form_values.amount").
     */
    Object lookup(String fieldKey, Map<String, Object> context, Map<String, Object> rowContext) {
        if (rowContext != null && rowContext.containsKey(fieldKey)) {
            return rowContext.get(fieldKey);
        }
        if (context == null) {
            return null;
        }
        if (context.containsKey(fieldKey) || fieldKey.indexOf('.') < 0) {
            return context.get(fieldKey);
        }

        Object current = context;
        for (String part : fieldKey.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }

    private static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            if (isFloatingPoint(left) || isFloatingPoint(right)) {
                return ((Number) left).doubleValue() == ((Number) right).doubleValue();
            }
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right)) == 0;
        }
        return Objects.equals(left, right);
    }

    private static boolean isFloatingPoint(Object number) {
        return number instanceof Double || number instanceof Float;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        return new BigDecimal(number.toString());
    }

    private static boolean containsValue(Collection<?> candidates, Object value) {
        for (Object candidate : candidates) {
            if (valuesEqual(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isEmpty();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        return false;
    }

    private static boolean contains(Object fieldValue, Object expected) {
        if (fieldValue instanceof Collection) {
            return containsValue((Collection<?>) fieldValue, expected);
        }
        return String.valueOf(fieldValue).contains(String.valueOf(expected));
    }

    private static boolean compareNumbers(ConditionOperator operator, Object fieldValue, Object expected,
                                          Condition condition) {
        double left;
        double right;
        try {
            left = toDouble(fieldValue);
            right = toDouble(expected);
        } catch (NumberFormatException e) {
            log.warn("Could not compare {} numerically, treating the condition as false: {}", condition, e.getMessage());
            return false;
        }

        switch (operator) {
            case GREATER_THAN:
                return left > right;
            case LESS_THAN:
                return left < right;
            case GREATER_THAN_OR_EQUALS:
                return left >= right;
            case LESS_THAN_OR_EQUALS:
                return left <= right;
            default:
                return false;
        }
    }

    // missing values compare as zero
    private static double toDouble(Object value) {
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return 0.0;
        }
        return Double.parseDouble(text);
    }
}
