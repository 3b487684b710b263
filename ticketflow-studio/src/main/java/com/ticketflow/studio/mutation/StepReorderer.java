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

package com.ticketflow.studio.mutation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ticketflow.wf.graph.BranchTraversal;
import com.ticketflow.wf.graph.GraphStructureException;
import com.ticketflow.wf.ids.StepIdGenerator;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a new display order to the steps and rewires the linear "next step" transitions to match it.
 *
 * Only the simple linear links are rewired. Fork steps, steps on a branch and steps that lead into a join
 * keep their transitions exactly as they are, as do steps with conditional or multiple outgoing transitions.
 */
final class StepReorderer {

    private static final Logger log = LoggerFactory.getLogger(StepReorderer.class);

    private final StepIdGenerator ids;

    StepReorderer(StepIdGenerator ids) {
        this.ids = ids;
    }

    WorkflowDefinition reorder(WorkflowDefinition definition, List<String> orderedStepIds) {
        checkPermutation(definition, orderedStepIds);
        if (orderedStepIds.isEmpty()) {
            return definition;
        }

        Set<String> branchStepIds = BranchTraversal.allBranchStepIds(definition);
        Set<String> joinFeederIds = new HashSet<>();
        for (Transition transition : definition.getTransitions()) {
            if (isJoin(definition, transition.getToStepId())) {
                joinFeederIds.add(transition.getFromStepId());
            }
        }

        Map<String, Transition> rewired = new HashMap<>();
        List<Transition> added = new ArrayList<>();

        for (int i = 0; i < orderedStepIds.size(); i++) {
            Step step = definition.requireStep(orderedStepIds.get(i));
            String nextId = (i + 1 < orderedStepIds.size() ? orderedStepIds.get(i + 1) : null);
            if (nextId == null
                    || step.getStepType() == StepType.FORK
                    || branchStepIds.contains(step.getStepId())
                    || joinFeederIds.contains(step.getStepId())) {
                continue;
            }

            List<Transition> outgoing = definition.outgoing(step.getStepId());
            if (step.getStepType() == StepType.JOIN) {
                if (outgoing.isEmpty()) {
                    added.add(new Transition(ids.nextTransitionId(), step.getStepId(), nextId,
                                             TransitionEvent.COMPLETE_TASK));
                } else if (outgoing.size() == 1) {
                    rewired.put(outgoing.get(0).getTransitionId(), outgoing.get(0).withToStepId(nextId));
                }
                continue;
            }

            if (outgoing.size() == 1) {
                Transition only = outgoing.get(0);
                if (!only.hasCondition() && !isJoin(definition, only.getToStepId())) {
                    rewired.put(only.getTransitionId(), only.withToStepId(nextId));
                }
            }
        }

        List<Transition> transitions = new ArrayList<>(definition.getTransitions().size() + added.size());
        for (Transition transition : definition.getTransitions()) {
            transitions.add(rewired.getOrDefault(transition.getTransitionId(), transition));
        }
        transitions.addAll(added);

        List<Step> steps = new ArrayList<>(orderedStepIds.size());
        for (int i = 0; i < orderedStepIds.size(); i++) {
            Step step = definition.requireStep(orderedStepIds.get(i));
            steps.add(step.toBuilder().order(i).start(i == 0).build());
        }

        log.debug("Reordered {} steps, rewired {} transitions and added {}.", steps.size(), rewired.size(),
                  added.size());
        return new WorkflowDefinition(steps, transitions, orderedStepIds.get(0));
    }

    private static boolean isJoin(WorkflowDefinition definition, String stepId) {
        return definition.findStep(stepId).map(s -> s.getStepType() == StepType.JOIN).orElse(false);
    }

    private static void checkPermutation(WorkflowDefinition definition, List<String> orderedStepIds) {
        if (orderedStepIds == null) {
            throw new IllegalArgumentException("orderedStepIds may not be null.");
        }
        Set<String> seen = new HashSet<>();
        for (String stepId : orderedStepIds) {
            definition.requireStep(stepId);
            if (!seen.add(stepId)) {
                throw new GraphStructureException("Step " + stepId + " appears more than once in the new order.");
            }
        }
        if (seen.size() != definition.getSteps().size()) {
            throw new GraphStructureException("The new order lists " + seen.size() + " steps but the workflow has "
                                              + definition.getSteps().size() + ".");
        }
    }
}
