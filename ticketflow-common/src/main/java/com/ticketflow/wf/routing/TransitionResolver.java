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

package com.ticketflow.wf.routing;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.ticketflow.wf.conditions.ConditionEvaluator;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the transition a ticket follows when a step emits an event.
 *
 * Among the transitions leaving the step on that event whose condition matches, the one with the highest
 * priority wins; transitions of equal priority are tried in creation order.
 */
public class TransitionResolver {

    private static final Logger log = LoggerFactory.getLogger(TransitionResolver.class);

    private final ConditionEvaluator evaluator;

    public TransitionResolver(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public TransitionResolver() {
        this(new ConditionEvaluator());
    }

    /**
     * @return The selected transition, or empty if the step is terminal and has no transition for the event.
     * @throws TransitionNotFoundException if the step is not terminal and no transition applies.
     */
    public Optional<Transition> resolve(WorkflowDefinition definition, String stepId, TransitionEvent event,
                                        Map<String, Object> context) {
        Step step = definition.requireStep(stepId);
        List<Transition> candidates = definition.getTransitions().stream()
                .filter(t -> t.getFromStepId().equals(stepId) && t.getEvent() == event)
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            if (step.isTerminal()) {
                log.debug("Step {} is terminal and has no {} transition.", stepId, event);
                return Optional.empty();
            }
            throw new TransitionNotFoundException("No transition found from step " + stepId + " for event " + event);
        }

        // List.sort is stable, so equal priorities stay in creation order.
        candidates.sort(Comparator.comparingInt(Transition::getPriority).reversed());
        for (Transition candidate : candidates) {
            if (evaluator.evaluate(candidate.getCondition(), context)) {
                log.debug("Resolved {} from step {} to transition {}.", event, stepId, candidate.getTransitionId());
                return Optional.of(candidate);
            }
        }
        throw new TransitionNotFoundException("No transition condition matched for step " + stepId
                                              + " and event " + event);
    }

    /**
     * Convenience wrapper around {@link #resolve} returning only the target step id.
     */
    public Optional<String> resolveNextStep(WorkflowDefinition definition, String stepId, TransitionEvent event,
                                            Map<String, Object> context) {
        return resolve(definition, stepId, event, context).map(Transition::getToStepId);
    }
}
