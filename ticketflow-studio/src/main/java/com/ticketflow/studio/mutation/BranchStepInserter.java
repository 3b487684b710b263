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

package com.ticketflow.studio.mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.ticketflow.wf.graph.GraphReferenceException;
import com.ticketflow.wf.graph.GraphStructureException;
import com.ticketflow.wf.graph.TransitionEvents;
import com.ticketflow.wf.ids.StepIdGenerator;
import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds a step to one branch of a fork, wiring it between its predecessor and the branch's continuation
 * (usually the matching join) and placing it inside the branch's block of steps.
 */
final class BranchStepInserter {

    private static final Logger log = LoggerFactory.getLogger(BranchStepInserter.class);

    private final StepIdGenerator ids;

    BranchStepInserter(StepIdGenerator ids) {
        this.ids = ids;
    }

    WorkflowDefinition insert(WorkflowDefinition definition, String forkStepId, String branchId,
                              String afterStepId, StepType type) {
        Step fork = definition.requireStep(forkStepId);
        if (fork.getStepType() != StepType.FORK) {
            throw new GraphStructureException("Step " + forkStepId + " is a " + fork.getStepType()
                                              + " step; branch steps can only be added to a fork.");
        }
        ForkConfig forkConfig = fork.getConfig(ForkConfig.class);
        Branch branch = forkConfig.findBranch(branchId)
                .orElseThrow(() -> new GraphReferenceException("Fork " + forkStepId + " has no branch " + branchId));

        Step after = null;
        if (afterStepId != null) {
            after = definition.requireStep(afterStepId);
            if (after.getStepId().equals(forkStepId)) {
                throw new GraphStructureException("To add the first step of a branch, do not specify a preceding step.");
            }
            if (after.isInBranch() && !branchId.equals(after.getBranchId())) {
                throw new GraphStructureException("Step " + afterStepId + " belongs to branch " + after.getBranchId()
                                                  + ", not " + branchId);
            }
        }

        Optional<Step> join = definition.findJoinFor(forkStepId);
        String branchName = (branch.getBranchName() == null ? branchId : branch.getBranchName());
        Step newStep = Step.builder(ids.nextStepId(), type)
                           .stepName(branchName + " - " + type.getLabel())
                           .description("Step in " + branchName + " branch")
                           .branchId(branchId)
                           .parentForkStepId(forkStepId)
                           .build();

        List<Transition> transitions = new ArrayList<>(definition.getTransitions());
        Step updatedFork = fork;
        int insertIndex;
        String continuation;

        if (after != null) {
            List<Transition> replaced = new ArrayList<>();
            for (Transition transition : definition.outgoing(after.getStepId())) {
                if (transition.getEvent().isCompletion()) {
                    replaced.add(transition);
                }
            }
            transitions.removeAll(replaced);
            transitions.add(new Transition(ids.nextTransitionId(), after.getStepId(), newStep.getStepId(),
                                           TransitionEvents.eventFor(after.getStepType())));
            // the join takes precedence; the old target is only kept when the fork has no join yet
            continuation = join.map(Step::getStepId)
                               .orElse(replaced.stream().map(Transition::getToStepId).findFirst().orElse(null));
            insertIndex = clampToBranchBlock(definition, forkConfig, branchId, join, after,
                                             definition.indexOf(after.getStepId()) + 1);
        } else {
            String oldStart = (branch.hasStartStep() && definition.containsStep(branch.getStartStepId())
                               ? branch.getStartStepId() : null);
            if (oldStart != null) {
                transitions.removeIf(t -> t.getFromStepId().equals(forkStepId) && t.getToStepId().equals(oldStart));
            }
            transitions.add(new Transition(ids.nextTransitionId(), forkStepId, newStep.getStepId(),
                                           TransitionEvents.eventFor(StepType.FORK)));
            continuation = join.map(Step::getStepId).orElse(oldStart);
            updatedFork = fork.withConfig(forkConfig.withBranch(branch.withStartStepId(newStep.getStepId())));

            int forkIndex = definition.indexOf(forkStepId);
            int joinIndex = join.map(j -> definition.indexOf(j.getStepId())).orElse(-1);
            if (oldStart != null) {
                insertIndex = definition.indexOf(oldStart);
            } else if (joinIndex > forkIndex) {
                insertIndex = joinIndex;
            } else {
                insertIndex = forkIndex + 1;
            }
        }

        if (continuation != null) {
            transitions.add(new Transition(ids.nextTransitionId(), newStep.getStepId(), continuation,
                                           TransitionEvents.eventFor(type)));
        }

        List<Step> steps = StepPositions.replace(definition.getSteps(), updatedFork);
        steps.add(insertIndex, newStep);

        log.debug("Added {} to branch {} of fork {} at position {}.", newStep.getStepId(), branchId, forkStepId,
                  insertIndex);
        return new WorkflowDefinition(StepPositions.renumber(steps), transitions, definition.getStartStepId());
    }

    /**
     * Keeps an insertion position before the join and before every other branch's start step that follows
     * the beginning of this branch's block.
     */
    private static int clampToBranchBlock(WorkflowDefinition definition, ForkConfig forkConfig, String branchId,
                                          Optional<Step> join, Step after, int insertIndex) {
        Branch branch = forkConfig.findBranch(branchId).get();
        int blockStart = definition.indexOf(branch.hasStartStep() ? branch.getStartStepId() : after.getStepId());
        if (blockStart < 0) {
            blockStart = definition.indexOf(after.getStepId());
        }

        List<String> boundaries = new ArrayList<>();
        join.ifPresent(j -> boundaries.add(j.getStepId()));
        for (Branch other : forkConfig.getBranches()) {
            if (!other.getBranchId().equals(branchId) && other.hasStartStep()) {
                boundaries.add(other.getStartStepId());
            }
        }

        int clamped = insertIndex;
        for (String boundary : boundaries) {
            int index = definition.indexOf(boundary);
            if (index > blockStart && index < clamped) {
                clamped = index;
            }
        }
        return clamped;
    }
}
