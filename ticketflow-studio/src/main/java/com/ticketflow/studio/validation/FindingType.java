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

/**
 * Every kind of problem the validators report, with the severity it is always reported at.
 */
public enum FindingType {
    // editor checks
    NO_START(Severity.WARNING),
    NO_TERMINAL(Severity.ERROR),
    ORPHAN_STEP(Severity.WARNING),
    EMPTY_FORM(Severity.WARNING),
    NO_REJECT_HANDLING(Severity.WARNING),
    NO_INSTRUCTIONS(Severity.WARNING),

    // publish checks
    EMPTY_STEPS(Severity.ERROR),
    MISSING_START(Severity.ERROR),
    INVALID_START(Severity.ERROR),
    MISSING_APPROVER(Severity.ERROR),
    JOIN_NO_SOURCE(Severity.ERROR),
    JOIN_INVALID_SOURCE(Severity.ERROR),
    SUB_WORKFLOW_NO_ID(Severity.ERROR),
    SUB_WORKFLOW_NO_VERSION(Severity.ERROR),
    INVALID_TRANSITION_FROM(Severity.ERROR),
    INVALID_TRANSITION_TO(Severity.ERROR),
    FORK_NO_BRANCHES(Severity.WARNING),
    BRANCH_NO_START(Severity.WARNING),
    BRANCH_NO_JOIN_TRANSITION(Severity.WARNING),
    UNREACHABLE_STEP(Severity.WARNING);

    private final Severity severity;

    FindingType(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
