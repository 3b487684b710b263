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

/**
 * One parallel path out of a fork step.
 */
public final class Branch {

    private final String branchId;
    private final String branchName;
    private final String description;
    private final String assignedTeam;
    private final String color;
    private final String startStepId;

    public Branch(String branchId, String branchName, String description, String assignedTeam, String color,
                  String startStepId) {
        if (branchId == null || branchId.isEmpty()) {
            throw new IllegalArgumentException("branchId may not be blank.");
        }
        this.branchId = branchId;
        this.branchName = branchName;
        this.description = description;
        this.assignedTeam = assignedTeam;
        this.color = color;
        this.startStepId = (startStepId == null || startStepId.isEmpty() ? null : startStepId);
    }

    public String getBranchId() {
        return branchId;
    }

    public String getBranchName() {
        return branchName;
    }

    public String getDescription() {
        return description;
    }

    public String getAssignedTeam() {
        return assignedTeam;
    }

    public String getColor() {
        return color;
    }

    /**
     * The first step of the branch, or null if the branch has no steps yet.
     */
    public String getStartStepId() {
        return startStepId;
    }

    public boolean hasStartStep() {
        return startStepId != null;
    }

    public Branch withStartStepId(String newStartStepId) {
        return new Branch(branchId, branchName, description, assignedTeam, color, newStartStepId);
    }

    public Branch withBranchName(String newName) {
        return new Branch(branchId, newName, description, assignedTeam, color, startStepId);
    }

    public Branch withAssignedTeam(String newTeam) {
        return new Branch(branchId, branchName, description, newTeam, color, startStepId);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Branch that = (Branch) other;
        return branchId.equals(that.branchId)
               && Objects.equals(branchName, that.branchName)
               && Objects.equals(description, that.description)
               && Objects.equals(assignedTeam, that.assignedTeam)
               && Objects.equals(color, that.color)
               && Objects.equals(startStepId, that.startStepId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(branchId, branchName, description, assignedTeam, color, startStepId);
    }

    @Override
    public String toString() {
        return "Branch{" + branchId + ", start=" + startStepId + "}";
    }
}
