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
import java.util.List;
import java.util.Objects;

/**
 * Configuration of an approval step: who approves, and how parallel approvals are counted.
 */
public final class ApprovalConfig implements StepConfig {

    private final ApproverResolution approverResolution;
    private final String specificApproverEmail;
    private final String spocEmail;
    private final ParallelApprovalRule parallelApproval;
    private final List<String> parallelApprovers;
    private final boolean allowReassign;

    public ApprovalConfig(ApproverResolution approverResolution, String specificApproverEmail, String spocEmail,
                          ParallelApprovalRule parallelApproval, List<String> parallelApprovers,
                          boolean allowReassign) {
        this.approverResolution = approverResolution;
        this.specificApproverEmail = specificApproverEmail;
        this.spocEmail = spocEmail;
        this.parallelApproval = parallelApproval;
        this.parallelApprovers = (parallelApprovers == null ? Collections.emptyList() : List.copyOf(parallelApprovers));
        this.allowReassign = allowReassign;
    }

    public static ApprovalConfig requesterManager() {
        return new ApprovalConfig(ApproverResolution.REQUESTER_MANAGER, null, null, null, null, false);
    }

    public static ApprovalConfig specificApprover(String email) {
        return new ApprovalConfig(ApproverResolution.SPECIFIC_EMAIL, email, null, null, null, false);
    }

    @Override
    public StepType getStepType() {
        return StepType.APPROVAL;
    }

    /**
     * May be null for documents that never chose a resolution strategy.
     */
    public ApproverResolution getApproverResolution() {
        return approverResolution;
    }

    public String getSpecificApproverEmail() {
        return specificApproverEmail;
    }

    public String getSpocEmail() {
        return spocEmail;
    }

    public ParallelApprovalRule getParallelApproval() {
        return parallelApproval;
    }

    public List<String> getParallelApprovers() {
        return parallelApprovers;
    }

    public boolean isAllowReassign() {
        return allowReassign;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ApprovalConfig)) {
            return false;
        }
        ApprovalConfig that = (ApprovalConfig) other;
        return allowReassign == that.allowReassign
               && approverResolution == that.approverResolution
               && Objects.equals(specificApproverEmail, that.specificApproverEmail)
               && Objects.equals(spocEmail, that.spocEmail)
               && parallelApproval == that.parallelApproval
               && parallelApprovers.equals(that.parallelApprovers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(approverResolution, specificApproverEmail, spocEmail, parallelApproval,
                            parallelApprovers, allowReassign);
    }
}
