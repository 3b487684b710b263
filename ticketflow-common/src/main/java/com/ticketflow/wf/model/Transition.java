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

import java.util.Objects;

import com.ticketflow.wf.conditions.ConditionGroup;

/**
 * A directed edge between two steps, taken when the source step emits the transition's event
 * and the optional condition matches.
 */
public final class Transition {

    private final String transitionId;
    private final String fromStepId;
    private final String toStepId;
    private final TransitionEvent event;
    private final int priority;
    private final ConditionGroup condition;

    public Transition(String transitionId, String fromStepId, String toStepId, TransitionEvent event, int priority,
                      ConditionGroup condition) {
        if (transitionId == null || transitionId.isEmpty()) {
            throw new IllegalArgumentException("transitionId may not be blank.");
        }
        if (fromStepId == null || toStepId == null) {
            throw new IllegalArgumentException("Transition endpoints may not be null.");
        }
        if (event == null) {
            throw new IllegalArgumentException("event may not be null.");
        }
        this.transitionId = transitionId;
        this.fromStepId = fromStepId;
        this.toStepId = toStepId;
        this.event = event;
        this.priority = priority;
        this.condition = condition;
    }

    public Transition(String transitionId, String fromStepId, String toStepId, TransitionEvent event) {
        this(transitionId, fromStepId, toStepId, event, 0, null);
    }

    public String getTransitionId() {
        return transitionId;
    }

    public String getFromStepId() {
        return fromStepId;
    }

    public String getToStepId() {
        return toStepId;
    }

    public TransitionEvent getEvent() {
        return event;
    }

    public int getPriority() {
        return priority;
    }

    public ConditionGroup getCondition() {
        return condition;
    }

    public boolean hasCondition() {
        return condition != null && !condition.getConditions().isEmpty();
    }

    public boolean touches(String stepId) {
        return fromStepId.equals(stepId) || toStepId.equals(stepId);
    }

    public Transition withFromStepId(String newFromStepId) {
        return new Transition(transitionId, newFromStepId, toStepId, event, priority, condition);
    }

    public Transition withToStepId(String newToStepId) {
        return new Transition(transitionId, fromStepId, newToStepId, event, priority, condition);
    }

    public Transition withEvent(TransitionEvent newEvent) {
        return new Transition(transitionId, fromStepId, toStepId, newEvent, priority, condition);
    }

    public Transition withPriority(int newPriority) {
        return new Transition(transitionId, fromStepId, toStepId, event, newPriority, condition);
    }

    public Transition withCondition(ConditionGroup newCondition) {
        return new Transition(transitionId, fromStepId, toStepId, event, priority, newCondition);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Transition that = (Transition) other;
        return priority == that.priority
               && transitionId.equals(that.transitionId)
               && fromStepId.equals(that.fromStepId)
               && toStepId.equals(that.toStepId)
               && event == that.event
               && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transitionId, fromStepId, toStepId, event, priority, condition);
    }

    @Override
    public String toString() {
        return transitionId + ": " + fromStepId + " -[" + event + "]-> " + toStepId;
    }
}
