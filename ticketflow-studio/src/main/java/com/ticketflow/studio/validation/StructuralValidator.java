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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.ticketflow.wf.model.FormConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.TaskConfig;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;

/**
 * The quick checks run after every edit in the designer. Only a missing terminal step is an error;
 * everything else is advice.
 */
public class StructuralValidator {

    public ValidationResult validate(WorkflowDefinition definition) {
        if (definition.isEmpty()) {
            return ValidationResult.empty();
        }
        List<Step> steps = definition.getSteps();
        List<ValidationFinding> findings = new ArrayList<>();

        boolean anyStartFlag = steps.stream().anyMatch(Step::isStart);
        if (definition.getStartStepId() == null && !anyStartFlag) {
            findings.add(new ValidationFinding(FindingType.NO_START, "Workflow has no start step", null));
        }

        if (steps.stream().noneMatch(Step::isTerminal)) {
            findings.add(new ValidationFinding(FindingType.NO_TERMINAL,
                                               "Workflow has no terminal step; tickets could never complete", null));
        }

        if (steps.size() > 1) {
            String startId = effectiveStartId(definition);
            Set<String> targets = new HashSet<>();
            for (Transition transition : definition.getTransitions()) {
                targets.add(transition.getToStepId());
            }
            for (Step step : steps) {
                if (!step.getStepId().equals(startId) && !targets.contains(step.getStepId())) {
                    findings.add(new ValidationFinding(FindingType.ORPHAN_STEP,
                                                       "Step \"" + step.getStepName() + "\" has no incoming transitions",
                                                       step.getStepId()));
                }
            }
        }

        for (Step step : steps) {
            if (step.getStepType() == StepType.FORM && step.getConfig(FormConfig.class).getFields().isEmpty()) {
                findings.add(new ValidationFinding(FindingType.EMPTY_FORM,
                                                   "Form step \"" + step.getStepName() + "\" has no fields",
                                                   step.getStepId()));
            }
            if (step.getStepType() == StepType.APPROVAL && !step.isTerminal() && !hasRejectPath(definition, step)) {
                findings.add(new ValidationFinding(FindingType.NO_REJECT_HANDLING,
                                                   "Approval step \"" + step.getStepName()
                                                   + "\" has no transition for rejection",
                                                   step.getStepId()));
            }
            if (step.getStepType() == StepType.TASK
                    && step.getConfig(TaskConfig.class).getInstructions().trim().isEmpty()) {
                findings.add(new ValidationFinding(FindingType.NO_INSTRUCTIONS,
                                                   "Task step \"" + step.getStepName() + "\" has no instructions",
                                                   step.getStepId()));
            }
        }
        return new ValidationResult(findings);
    }

    private static String effectiveStartId(WorkflowDefinition definition) {
        if (definition.getStartStepId() != null) {
            return definition.getStartStepId();
        }
        return definition.getSteps().stream().filter(Step::isStart).map(Step::getStepId).findFirst()
                         .orElse(definition.getSteps().get(0).getStepId());
    }

    private static boolean hasRejectPath(WorkflowDefinition definition, Step step) {
        return definition.outgoing(step.getStepId()).stream().anyMatch(t -> t.getEvent() == TransitionEvent.REJECT);
    }
}
