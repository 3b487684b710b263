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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.WorkflowDefinition;

/**
 * Walks the steps of fork branches.
 *
 * A branch walk starts at the branch's start step and follows completion-style transitions breadth-first.
 * It never enters a join step, never enters the start step of a sibling branch, and visits each step once.
 */
public final class BranchTraversal {

    private BranchTraversal() {}

    /**
     * Returns the ids of the steps reachable within the branch, in visit order.
     * The result is empty when the branch has no start step or the start step doesn't exist.
     */
    public static List<String> branchStepIds(WorkflowDefinition definition, Step fork, Branch branch) {
        if (!branch.hasStartStep() || !definition.containsStep(branch.getStartStepId())) {
            return Collections.emptyList();
        }
        Set<String> siblingStarts = siblingStartIds(fork, branch);

        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(branch.getStartStepId());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (visited.contains(current)) {
                continue;
            }
            Step step = definition.findStep(current).orElse(null);
            if (step == null || step.getStepType() == StepType.JOIN) {
                continue;
            }
            visited.add(current);
            for (Transition transition : definition.outgoing(current)) {
                if (!transition.getEvent().isCompletion()) {
                    continue;
                }
                String target = transition.getToStepId();
                if (!visited.contains(target) && !siblingStarts.contains(target)) {
                    queue.add(target);
                }
            }
        }
        return new ArrayList<>(visited);
    }

    /**
     * Returns the steps of the branch that have no completion-style transition to another step of the same branch;
     * these are the steps that should lead into the join.
     */
    public static List<String> branchEndStepIds(WorkflowDefinition definition, Step fork, Branch branch) {
        List<String> members = branchStepIds(definition, fork, branch);
        Set<String> memberSet = new HashSet<>(members);
        List<String> ends = new ArrayList<>();
        for (String member : members) {
            boolean continuesInBranch = definition.outgoing(member).stream()
                    .anyMatch(t -> t.getEvent().isCompletion()
                                   && memberSet.contains(t.getToStepId())
                                   && !t.getToStepId().equals(member));
            if (!continuesInBranch) {
                ends.add(member);
            }
        }
        return ends;
    }

    /**
     * Returns the ids of all steps that lie on some fork branch of the definition.
     */
    public static Set<String> allBranchStepIds(WorkflowDefinition definition) {
        Set<String> ids = new LinkedHashSet<>();
        for (Step step : definition.getSteps()) {
            if (step.getStepType() != StepType.FORK) {
                continue;
            }
            for (Branch branch : step.getConfig(ForkConfig.class).getBranches()) {
                ids.addAll(branchStepIds(definition, step, branch));
            }
        }
        return ids;
    }

    private static Set<String> siblingStartIds(Step fork, Branch branch) {
        Set<String> starts = new HashSet<>();
        for (Branch other : fork.getConfig(ForkConfig.class).getBranches()) {
            if (!other.getBranchId().equals(branch.getBranchId()) && other.hasStartStep()) {
                starts.add(other.getStartStepId());
            }
        }
        return starts;
    }
}
