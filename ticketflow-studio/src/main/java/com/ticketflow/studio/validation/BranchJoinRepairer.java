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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.ticketflow.wf.graph.BranchTraversal;
import com.ticketflow.wf.graph.TransitionEvents;
import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds the missing transition from the last step of each fork branch into the fork's join.
 */
public class BranchJoinRepairer {

    private static final Logger log = LoggerFactory.getLogger(BranchJoinRepairer.class);

    /**
     * @return The repaired definition, or the same instance if every branch already reaches its join.
     */
    public WorkflowDefinition repair(WorkflowDefinition definition) {
        Set<String> usedIds = new HashSet<>();
        definition.getTransitions().forEach(t -> usedIds.add(t.getTransitionId()));
        List<Transition> added = new ArrayList<>();

        for (Step fork : definition.getSteps()) {
            if (fork.getStepType() != StepType.FORK) {
                continue;
            }
            Optional<Step> join = definition.findJoinFor(fork.getStepId());
            if (join.isEmpty()) {
                continue;
            }
            String joinId = join.get().getStepId();
            for (Branch branch : fork.getConfig(ForkConfig.class).getBranches()) {
                for (String endId : BranchTraversal.branchEndStepIds(definition, fork, branch)) {
                    boolean linked = definition.outgoing(endId).stream().anyMatch(t -> t.getToStepId().equals(joinId))
                                     || added.stream().anyMatch(t -> t.getFromStepId().equals(endId));
                    if (linked) {
                        continue;
                    }
                    Step end = definition.requireStep(endId);
                    String transitionId = uniqueId("t_auto_" + endId + "_to_join", usedIds);
                    added.add(new Transition(transitionId, endId, joinId, TransitionEvents.eventFor(end.getStepType())));
                    log.info("Connected the end of branch {} (step {}) to join {}.", branch.getBranchId(), endId,
                             joinId);
                }
            }
        }

        if (added.isEmpty()) {
            return definition;
        }
        List<Transition> transitions = new ArrayList<>(definition.getTransitions());
        transitions.addAll(added);
        return definition.withTransitions(transitions);
    }

    private static String uniqueId(String candidate, Set<String> usedIds) {
        String id = candidate;
        int suffix = 2;
        while (usedIds.contains(id)) {
            id = candidate + "_" + suffix++;
        }
        usedIds.add(id);
        return id;
    }
}
