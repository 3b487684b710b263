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

package com.ticketflow.wf.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.ticketflow.wf.graph.GraphReferenceException;
import com.ticketflow.wf.graph.GraphStructureException;

/**
 * An immutable workflow graph: ordered steps, transitions in creation order, and the start step.
 *
 * Steps, transitions and branches refer to each other by id only. Duplicate ids are rejected here;
 * dangling references in loaded documents are tolerated and reported by validation.
 */
public final class WorkflowDefinition {

    private static final WorkflowDefinition EMPTY =
            new WorkflowDefinition(Collections.emptyList(), Collections.emptyList(), null);

    private final List<Step> steps;
    private final List<Transition> transitions;
    private final String startStepId;

    public WorkflowDefinition(List<Step> steps, List<Transition> transitions, String startStepId) {
        this.steps = (steps == null ? Collections.emptyList() : List.copyOf(steps));
        this.transitions = (transitions == null ? Collections.emptyList() : List.copyOf(transitions));
        this.startStepId = (startStepId == null || startStepId.isEmpty() ? null : startStepId);

        Set<String> stepIds = new HashSet<>();
        for (Step step : this.steps) {
            if (!stepIds.add(step.getStepId())) {
                throw new GraphStructureException("Duplicate step id: " + step.getStepId());
            }
        }
        Set<String> transitionIds = new HashSet<>();
        for (Transition transition : this.transitions) {
            if (!transitionIds.add(transition.getTransitionId())) {
                throw new GraphStructureException("Duplicate transition id: " + transition.getTransitionId());
            }
        }
    }

    public static WorkflowDefinition empty() {
        return EMPTY;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    /**
     * Null when no start step has been recorded.
     */
    public String getStartStepId() {
        return startStepId;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public Optional<Step> findStep(String stepId) {
        return steps.stream().filter(s -> s.getStepId().equals(stepId)).findFirst();
    }

    public boolean containsStep(String stepId) {
        return stepId != null && findStep(stepId).isPresent();
    }

    /**
     * @throws GraphReferenceException if there is no such step.
     */
    public Step requireStep(String stepId) {
        return findStep(stepId).orElseThrow(() -> new GraphReferenceException("Unknown step id: " + stepId));
    }

    /**
     * @return The step's position in the step list, or -1 if absent.
     */
    public int indexOf(String stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getStepId().equals(stepId)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<Transition> findTransition(String transitionId) {
        return transitions.stream().filter(t -> t.getTransitionId().equals(transitionId)).findFirst();
    }

    /**
     * @throws GraphReferenceException if there is no such transition.
     */
    public Transition requireTransition(String transitionId) {
        return findTransition(transitionId)
                .orElseThrow(() -> new GraphReferenceException("Unknown transition id: " + transitionId));
    }

    public List<Transition> outgoing(String stepId) {
        return transitions.stream().filter(t -> t.getFromStepId().equals(stepId)).collect(Collectors.toList());
    }

    public List<Transition> incoming(String stepId) {
        return transitions.stream().filter(t -> t.getToStepId().equals(stepId)).collect(Collectors.toList());
    }

    /**
     * Finds the first join step whose source fork is the given step.
     */
    public Optional<Step> findJoinFor(String forkStepId) {
        return steps.stream()
                    .filter(s -> s.getStepType() == StepType.JOIN)
                    .filter(s -> forkStepId.equals(s.getConfig(JoinConfig.class).getSourceForkStepId()))
                    .findFirst();
    }

    public WorkflowDefinition withSteps(List<Step> newSteps) {
        return new WorkflowDefinition(newSteps, transitions, startStepId);
    }

    public WorkflowDefinition withTransitions(List<Transition> newTransitions) {
        return new WorkflowDefinition(steps, newTransitions, startStepId);
    }

    public WorkflowDefinition withStartStepId(String newStartStepId) {
        return new WorkflowDefinition(steps, transitions, newStartStepId);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        WorkflowDefinition that = (WorkflowDefinition) other;
        return steps.equals(that.steps) && transitions.equals(that.transitions)
               && Objects.equals(startStepId, that.startStepId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(steps, transitions, startStepId);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{steps=" + steps + ", transitions=" + transitions + ", start=" + startStepId + "}";
    }
}
