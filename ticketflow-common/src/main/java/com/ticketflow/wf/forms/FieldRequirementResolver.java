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

package com.ticketflow.wf.forms;

import java.util.Map;

import com.ticketflow.wf.conditions.ConditionEvaluator;
import com.ticketflow.wf.model.form.ConditionalRequirement;
import com.ticketflow.wf.model.form.DateValidation;
import com.ticketflow.wf.model.form.FormField;

/**
 * Works out whether a field is currently required and which dates it accepts, given the values entered so far.
 *
 * Conditional rules are checked in the order they are declared on the field; the first rule whose condition
 * matches decides, and later rules are ignored.
 */
public class FieldRequirementResolver {

    private final ConditionEvaluator evaluator;

    public FieldRequirementResolver(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public FieldRequirementResolver() {
        this(new ConditionEvaluator());
    }

    public boolean isRequired(FormField field, Map<String, Object> context, Map<String, Object> rowContext) {
        ConditionalRequirement rule = firstMatchingRule(field, context, rowContext);
        if (rule != null) {
            return rule.getThen().isRequired();
        }
        return field.isRequired();
    }

    public boolean isRequired(FormField field, Map<String, Object> context) {
        return isRequired(field, context, null);
    }

    /**
     * Returns the date settings that apply right now. Fields without static settings allow every date.
     * If the first matching rule carries date settings they replace the static ones.
     */
    public DateValidation resolveDateValidation(FormField field, Map<String, Object> context,
                                                Map<String, Object> rowContext) {
        DateValidation effective = (field.getDateValidation() == null
                                    ? DateValidation.ALLOW_ALL : field.getDateValidation());
        ConditionalRequirement rule = firstMatchingRule(field, context, rowContext);
        if (rule != null && rule.getThen().getDateValidation() != null) {
            effective = rule.getThen().getDateValidation();
        }
        return effective;
    }

    public DateValidation resolveDateValidation(FormField field, Map<String, Object> context) {
        return resolveDateValidation(field, context, null);
    }

    private ConditionalRequirement firstMatchingRule(FormField field, Map<String, Object> context,
                                                     Map<String, Object> rowContext) {
        for (ConditionalRequirement rule : field.getConditionalRequirements()) {
            if (evaluator.evaluate(rule.getWhen(), context, rowContext)) {
                return rule;
            }
        }
        return null;
    }
}
