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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of a fork step: the parallel branches it starts and what happens when one of them fails.
 */
public final class ForkConfig implements StepConfig {

    private final List<Branch> branches;
    private final BranchFailurePolicy failurePolicy;

    public ForkConfig(List<Branch> branches, BranchFailurePolicy failurePolicy) {
        this.branches = (branches == null ? Collections.emptyList() : List.copyOf(branches));
        this.failurePolicy = (failurePolicy == null ? BranchFailurePolicy.FAIL_ALL : failurePolicy);
    }

    @Override
    public StepType getStepType() {
        return StepType.FORK;
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public BranchFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public Optional<Branch> findBranch(String branchId) {
        return branches.stream().filter(b -> b.getBranchId().equals(branchId)).findFirst();
    }

    public ForkConfig withBranches(List<Branch> newBranches) {
        return new ForkConfig(newBranches, failurePolicy);
    }

    /**
     * Returns a copy with the branch of the same id replaced; the branch list order is kept.
     */
    public ForkConfig withBranch(Branch replacement) {
        List<Branch> updated = new ArrayList<>(branches.size());
        for (Branch branch : branches) {
            updated.add(branch.getBranchId().equals(replacement.getBranchId()) ? replacement : branch);
        }
        return withBranches(updated);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ForkConfig)) {
            return false;
        }
        ForkConfig that = (ForkConfig) other;
        return branches.equals(that.branches) && failurePolicy == that.failurePolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(branches, failurePolicy);
    }
}
