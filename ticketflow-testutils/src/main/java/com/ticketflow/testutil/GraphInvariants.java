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

package com.ticketflow.testutil;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.JoinConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.WorkflowDefinition;

/**
 * Checks the structural guarantees every edited definition must keep.
 * Failures are reported as a RuntimeException listing every problem found.
 */
public final class GraphInvariants {

    private GraphInvariants() {}

    public static void verify(WorkflowDefinition definition) {
        List<String> problems = findProblems(definition);
        if (!problems.isEmpty()) {
            throw new RuntimeException("Workflow definition violates graph invariants: " + problems);
        }
    }

    public static List<String> findProblems(WorkflowDefinition definition) {
        List<String> problems = new ArrayList<>();
        Set<String> stepIds = new HashSet<>();
        definition.getSteps().forEach(s -> stepIds.add(s.getStepId()));

        for (Transition transition : definition.getTransitions()) {
            if (!stepIds.contains(transition.getFromStepId())) {
                problems.add(transition.getTransitionId() + " starts at missing step " + transition.getFromStepId());
            }
            if (!stepIds.contains(transition.getToStepId())) {
                problems.add(transition.getTransitionId() + " ends at missing step " + transition.getToStepId());
            }
        }

        if (definition.isEmpty()) {
            if (definition.getStartStepId() != null) {
                problems.add("empty definition has start step " + definition.getStartStepId());
            }
        } else if (definition.getStartStepId() == null || !stepIds.contains(definition.getStartStepId())) {
            problems.add("start step " + definition.getStartStepId() + " does not exist");
        }

        for (Step step : definition.getSteps()) {
            if (step.getStepType() == StepType.FORK) {
                for (Branch branch : step.getConfig(ForkConfig.class).getBranches()) {
                    if (branch.hasStartStep() && !stepIds.contains(branch.getStartStepId())) {
                        problems.add("branch " + branch.getBranchId() + " starts at missing step "
                                     + branch.getStartStepId());
                    }
                }
            }
            if (step.getStepType() == StepType.JOIN) {
                String source = step.getConfig(JoinConfig.class).getSourceForkStepId();
                if (source != null && definition.findStep(source).map(Step::getStepType).orElse(null) != StepType.FORK) {
                    problems.add("join " + step.getStepId() + " references missing fork " + source);
                }
            }
            if (step.getParentForkStepId() != null && !stepIds.contains(step.getParentForkStepId())) {
                problems.add("step " + step.getStepId() + " belongs to missing fork " + step.getParentForkStepId());
            }
        }

        for (int i = 0; i < definition.getSteps().size(); i++) {
            if (definition.getSteps().get(i).getOrder() != i) {
                problems.add("step " + definition.getSteps().get(i).getStepId() + " has order "
                             + definition.getSteps().get(i).getOrder() + " at position " + i);
            }
        }
        return problems;
    }
}
