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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.ticketflow.wf.graph.BranchTraversal;
import com.ticketflow.wf.model.ApprovalConfig;
import com.ticketflow.wf.model.ApproverResolution;
import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.JoinConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.SubWorkflowConfig;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The full set of checks a definition must pass before it can be published.
 */
public class PublishValidator {

    private static final Logger log = LoggerFactory.getLogger(PublishValidator.class);

    public ValidationResult validate(WorkflowDefinition definition) {
        List<ValidationFinding> findings = new ArrayList<>();
        if (definition.isEmpty()) {
            findings.add(new ValidationFinding(FindingType.EMPTY_STEPS, "Workflow must have at least one step",
                                               null, "steps"));
            return new ValidationResult(findings);
        }

        String startStepId = definition.getStartStepId();
        if (startStepId == null) {
            findings.add(new ValidationFinding(FindingType.MISSING_START, "Workflow must have a start step",
                                               null, "start_step_id"));
        } else if (!definition.containsStep(startStepId)) {
            findings.add(new ValidationFinding(FindingType.INVALID_START,
                                               "Start step " + startStepId + " does not exist",
                                               startStepId, "start_step_id"));
        }

        List<Step> steps = definition.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            checkStep(definition, steps.get(i), "steps[" + i + "]", findings);
        }

        if (steps.stream().noneMatch(Step::isTerminal)) {
            findings.add(new ValidationFinding(FindingType.NO_TERMINAL,
                                               "Workflow must have at least one terminal step", null, "steps"));
        }

        List<Transition> transitions = definition.getTransitions();
        for (int i = 0; i < transitions.size(); i++) {
            Transition transition = transitions.get(i);
            if (!definition.containsStep(transition.getFromStepId())) {
                findings.add(new ValidationFinding(FindingType.INVALID_TRANSITION_FROM,
                                                   "Transition " + transition.getTransitionId()
                                                   + " starts at unknown step " + transition.getFromStepId(),
                                                   null, "transitions[" + i + "].from_step_id"));
            }
            if (!definition.containsStep(transition.getToStepId())) {
                findings.add(new ValidationFinding(FindingType.INVALID_TRANSITION_TO,
                                                   "Transition " + transition.getTransitionId()
                                                   + " leads to unknown step " + transition.getToStepId(),
                                                   null, "transitions[" + i + "].to_step_id"));
            }
        }

        if (startStepId != null && definition.containsStep(startStepId)) {
            Set<String> reachable = reachableFrom(definition, startStepId);
            for (Step step : steps) {
                if (!reachable.contains(step.getStepId())) {
                    findings.add(new ValidationFinding(FindingType.UNREACHABLE_STEP,
                                                       "Step \"" + step.getStepName()
                                                       + "\" cannot be reached from the start step",
                                                       step.getStepId()));
                }
            }
        }

        checkBranchJoins(definition, findings);

        ValidationResult result = new ValidationResult(findings);
        log.debug("Publish validation found {} errors and {} warnings.", result.getErrors().size(),
                  result.getWarnings().size());
        return result;
    }

    private static void checkStep(WorkflowDefinition definition, Step step, String path,
                                  List<ValidationFinding> findings) {
        String stepId = step.getStepId();
        switch (step.getStepType()) {
            case APPROVAL:
                ApprovalConfig approval = step.getConfig(ApprovalConfig.class);
                if (!hasApprover(approval)) {
                    findings.add(new ValidationFinding(FindingType.MISSING_APPROVER,
                                                       "Approval step \"" + step.getStepName()
                                                       + "\" must say who approves",
                                                       stepId, path + ".approver_resolution"));
                }
                break;
            case JOIN:
                String source = step.getConfig(JoinConfig.class).getSourceForkStepId();
                if (source == null) {
                    findings.add(new ValidationFinding(FindingType.JOIN_NO_SOURCE,
                                                       "Join step \"" + step.getStepName()
                                                       + "\" must reference a fork step",
                                                       stepId, path + ".source_fork_step_id"));
                } else if (definition.findStep(source).map(Step::getStepType).orElse(null) != StepType.FORK) {
                    findings.add(new ValidationFinding(FindingType.JOIN_INVALID_SOURCE,
                                                       "Join step \"" + step.getStepName() + "\" references "
                                                       + source + ", which is not a fork step",
                                                       stepId, path + ".source_fork_step_id"));
                }
                break;
            case SUB_WORKFLOW:
                SubWorkflowConfig sub = step.getConfig(SubWorkflowConfig.class);
                if (sub.getSubWorkflowId() == null || sub.getSubWorkflowId().isEmpty()) {
                    findings.add(new ValidationFinding(FindingType.SUB_WORKFLOW_NO_ID,
                                                       "Sub-workflow step \"" + step.getStepName()
                                                       + "\" must reference a workflow",
                                                       stepId, path + ".sub_workflow_id"));
                }
                if (sub.getSubWorkflowVersion() == null) {
                    findings.add(new ValidationFinding(FindingType.SUB_WORKFLOW_NO_VERSION,
                                                       "Sub-workflow step \"" + step.getStepName()
                                                       + "\" must reference a published version",
                                                       stepId, path + ".sub_workflow_version"));
                }
                break;
            case FORK:
                List<Branch> branches = step.getConfig(ForkConfig.class).getBranches();
                if (branches.isEmpty()) {
                    findings.add(new ValidationFinding(FindingType.FORK_NO_BRANCHES,
                                                       "Fork step \"" + step.getStepName() + "\" has no branches",
                                                       stepId, path + ".branches"));
                }
                for (int i = 0; i < branches.size(); i++) {
                    Branch branch = branches.get(i);
                    if (!branch.hasStartStep() || !definition.containsStep(branch.getStartStepId())) {
                        findings.add(new ValidationFinding(FindingType.BRANCH_NO_START,
                                                           "Branch \"" + branch.getBranchName()
                                                           + "\" has no valid start step",
                                                           stepId, path + ".branches[" + i + "].start_step_id"));
                    }
                }
                break;
            default:
                break;
        }
    }

    private static boolean hasApprover(ApprovalConfig approval) {
        ApproverResolution resolution = approval.getApproverResolution();
        if (resolution == null) {
            return false;
        }
        if (resolution == ApproverResolution.SPECIFIC_EMAIL) {
            return approval.getSpecificApproverEmail() != null && !approval.getSpecificApproverEmail().isEmpty();
        }
        if (resolution == ApproverResolution.SPOC_EMAIL) {
            return approval.getSpocEmail() != null && !approval.getSpocEmail().isEmpty();
        }
        return true;
    }

    private static Set<String> reachableFrom(WorkflowDefinition definition, String startStepId) {
        Set<String> reachable = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startStepId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!reachable.add(current)) {
                continue;
            }
            for (Transition transition : definition.outgoing(current)) {
                queue.add(transition.getToStepId());
            }
            Optional<Step> step = definition.findStep(current);
            if (step.isPresent() && step.get().getStepType() == StepType.FORK) {
                for (Branch branch : step.get().getConfig(ForkConfig.class).getBranches()) {
                    if (branch.hasStartStep()) {
                        queue.add(branch.getStartStepId());
                    }
                }
            }
        }
        return reachable;
    }

    private static void checkBranchJoins(WorkflowDefinition definition, List<ValidationFinding> findings) {
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
                    boolean linked = definition.outgoing(endId).stream().anyMatch(t -> t.getToStepId().equals(joinId));
                    if (!linked) {
                        findings.add(new ValidationFinding(FindingType.BRANCH_NO_JOIN_TRANSITION,
                                                           "Branch \"" + branch.getBranchName() + "\" ends at step "
                                                           + endId + ", which does not lead to the join",
                                                           endId));
                    }
                }
            }
        }
    }
}
