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

/**
 * Events that cause a ticket to move along a transition.
 */
public enum TransitionEvent {
    SUBMIT_FORM(true),
    APPROVE(true),
    REJECT(false),
    SKIP(false),
    COMPLETE_TASK(true);

    private final boolean completion;

    TransitionEvent(boolean completion) {
        this.completion = completion;
    }

    /**
     * True for the events that mean "this step finished normally".
     */
    public boolean isCompletion() {
        return completion;
    }

    /**
     * Returns null if the name is not recognized.
     */
    public static TransitionEvent fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (TransitionEvent event : values()) {
            if (event.name().equalsIgnoreCase(name)) {
                return event;
            }
        }
        return null;
    }
}
