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

package com.ticketflow.wf.graph;

import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.TransitionEvent;

/**
 * Maps step types to the event they emit when they complete normally.
 */
public final class TransitionEvents {

    private TransitionEvents() {}

    /**
     * @throws IllegalStateException if the step type has no completion event.
     */
    public static TransitionEvent eventFor(StepType stepType) {
        if (stepType == null) {
            throw new IllegalArgumentException("stepType may not be null.");
        }
        switch (stepType) {
            case FORM:
                return TransitionEvent.SUBMIT_FORM;
            case APPROVAL:
                return TransitionEvent.APPROVE;
            case TASK:
            case NOTIFY:
            case FORK:
            case JOIN:
            case SUB_WORKFLOW:
                return TransitionEvent.COMPLETE_TASK;
            default:
                throw new IllegalStateException("No completion event is defined for step type " + stepType);
        }
    }
}
