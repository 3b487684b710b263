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

package com.ticketflow.studio.migration;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.ticketflow.wf.graph.BranchTraversal;
import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backfills branch membership on definitions saved before steps carried a branch id.
 *
 * Each branch is walked from its start step; steps reached on the way to the join that have no branch id yet
 * are tagged with the branch and its fork. Steps that already have a branch id are never changed, so running
 * the migration again has no effect.
 */
public class BranchMigrator {

    private static final Logger log = LoggerFactory.getLogger(BranchMigrator.class);

    /**
     * @return The migrated definition, or the very same instance if no step needed tagging.
     */
    public WorkflowDefinition migrate(WorkflowDefinition definition) {
        Map<String, Step> tagged = new HashMap<>();
        for (Step fork : definition.getSteps()) {
            if (fork.getStepType() != StepType.FORK) {
                continue;
            }
            for (Branch branch : fork.getConfig(ForkConfig.class).getBranches()) {
                for (String stepId : BranchTraversal.branchStepIds(definition, fork, branch)) {
                    Step step = tagged.getOrDefault(stepId, definition.requireStep(stepId));
                    if (!step.isInBranch()) {
                        tagged.put(stepId, step.withBranch(branch.getBranchId(), fork.getStepId()));
                    }
                }
            }
        }

        if (tagged.isEmpty()) {
            return definition;
        }
        log.debug("Tagged {} steps with their branch: {}", tagged.size(), tagged.keySet());
        List<Step> steps = definition.getSteps().stream()
                                     .map(s -> tagged.getOrDefault(s.getStepId(), s))
                                     .collect(Collectors.toList());
        return definition.withSteps(steps);
    }
}
