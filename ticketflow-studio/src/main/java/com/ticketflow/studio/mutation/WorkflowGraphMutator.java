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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.ticketflow.wf.conditions.ConditionGroup;
import com.ticketflow.wf.graph.GraphReferenceException;
import com.ticketflow.wf.graph.GraphStructureException;
import com.ticketflow.wf.graph.TransitionEvents;
import com.ticketflow.wf.ids.StepIdGenerator;
import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.JoinConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepConfig;
import com.ticketflow.wf.model.StepConfigs;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.SubWorkflowConfig;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Editing operations on workflow definitions.
 *
 * Every operation takes a definition and returns a new one; the input is never modified, and an operation
 * that fails throws before producing anything. Referring to an unknown step, transition or branch raises
 * {@link GraphReferenceException}; asking for a change that would break the graph's shape raises
 * {@link GraphStructureException}.
 */
public class WorkflowGraphMutator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowGraphMutator.class);

    static final List<String> BRANCH_COLORS = List.of("#3b82f6", "#10b981", "#8b5cf6", "#f59e0b", "#f43f5e",
                                                      "#06b6d4");

    private final StepIdGenerator ids;
    private final StepReorderer reorderer;
    private final BranchStepInserter branchInserter;

    public WorkflowGraphMutator(StepIdGenerator ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids may not be null.");
        }
        this.ids = ids;
        this.reorderer = new StepReorderer(ids);
        this.branchInserter = new BranchStepInserter(ids);
    }

    /**
     * Appends a step with the default configuration for its type, linked from the current last step.
     */
    public WorkflowDefinition appendStep(WorkflowDefinition definition, StepType type) {
        return appendStep(definition, StepConfigs.defaultFor(type));
    }

    /**
     * Appends a step carrying the given configuration, linked from the current last step using that
     * step's completion event. The first step of an empty workflow becomes its start step.
     */
    public WorkflowDefinition appendStep(WorkflowDefinition definition, StepConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config may not be null.");
        }
        StepType type = config.getStepType();
        boolean first = definition.isEmpty();
        Step step = Step.builder(ids.nextStepId(), type)
                        .stepName(defaultName(config))
                        .order(definition.getSteps().size())
                        .start(first)
                        .terminal(type == StepType.NOTIFY)
                        .config(config)
                        .build();

        List<Step> steps = new ArrayList<>(definition.getSteps());
        steps.add(step);
        List<Transition> transitions = new ArrayList<>(definition.getTransitions());
        if (!first) {
            Step last = definition.getSteps().get(definition.getSteps().size() - 1);
            transitions.add(new Transition(ids.nextTransitionId(), last.getStepId(), step.getStepId(),
                                           TransitionEvents.eventFor(last.getStepType())));
        }

        log.debug("Appended {} step {}.", type, step.getStepId());
        return new WorkflowDefinition(steps, transitions, first ? step.getStepId() : definition.getStartStepId());
    }

    /**
     * Inserts a new step directly after an existing one. Everything the existing step used to lead to is now
     * reached through the new step.
     */
    public WorkflowDefinition insertStepAfter(WorkflowDefinition definition, String afterStepId, StepType type) {
        Step after = definition.requireStep(afterStepId);
        Step step = Step.builder(ids.nextStepId(), type)
                        .stepName(defaultName(StepConfigs.defaultFor(type)))
                        .branchId(after.getBranchId())
                        .parentForkStepId(after.getParentForkStepId())
                        .build();

        List<Transition> transitions = new ArrayList<>(definition.getTransitions().size() + 1);
        for (Transition transition : definition.getTransitions()) {
            transitions.add(transition.getFromStepId().equals(afterStepId)
                            ? transition.withFromStepId(step.getStepId()) : transition);
        }
        transitions.add(new Transition(ids.nextTransitionId(), afterStepId, step.getStepId(),
                                       TransitionEvents.eventFor(after.getStepType())));

        List<Step> steps = new ArrayList<>(definition.getSteps());
        steps.add(definition.indexOf(afterStepId) + 1, step);

        log.debug("Inserted {} step {} after {}.", type, step.getStepId(), afterStepId);
        return new WorkflowDefinition(StepPositions.renumber(steps), transitions, definition.getStartStepId());
    }

    /**
     * Removes a step. Every predecessor is connected to every successor so that paths through the step survive;
     * each bypass keeps the event of the incoming transition it replaces.
     */
    public WorkflowDefinition deleteStep(WorkflowDefinition definition, String stepId) {
        Step victim = definition.requireStep(stepId);

        List<Transition> incoming = new ArrayList<>();
        List<Transition> outgoing = new ArrayList<>();
        List<Transition> transitions = new ArrayList<>();
        for (Transition transition : definition.getTransitions()) {
            boolean selfLoop = transition.getFromStepId().equals(stepId) && transition.getToStepId().equals(stepId);
            if (!transition.touches(stepId)) {
                transitions.add(transition);
            } else if (!selfLoop && transition.getToStepId().equals(stepId)) {
                incoming.add(transition);
            } else if (!selfLoop) {
                outgoing.add(transition);
            }
        }
        for (Transition in : incoming) {
            for (Transition out : outgoing) {
                transitions.add(new Transition(ids.nextTransitionId(), in.getFromStepId(), out.getToStepId(),
                                               in.getEvent()));
            }
        }

        String branchSuccessor = outgoing.stream()
                .map(Transition::getToStepId)
                .filter(id -> definition.findStep(id).map(s -> s.getStepType() != StepType.JOIN).orElse(false))
                .findFirst().orElse(null);

        List<Step> steps = new ArrayList<>();
        for (Step step : definition.getSteps()) {
            if (!step.getStepId().equals(stepId)) {
                steps.add(detachFrom(step, victim, branchSuccessor));
            }
        }

        boolean wasStart = victim.isStart() || stepId.equals(definition.getStartStepId());
        String startStepId = definition.getStartStepId();
        if (steps.isEmpty()) {
            startStepId = null;
        } else if (wasStart) {
            steps.set(0, steps.get(0).withStart(true));
            startStepId = steps.get(0).getStepId();
        }

        log.debug("Deleted step {} and added {} bypass transitions.", stepId, incoming.size() * outgoing.size());
        return new WorkflowDefinition(StepPositions.renumber(steps), transitions, startStepId);
    }

    // Clears references the remaining step holds to the deleted one.
    private static Step detachFrom(Step step, Step victim, String branchSuccessor) {
        String victimId = victim.getStepId();
        Step result = step;
        if (victimId.equals(step.getParentForkStepId())) {
            result = result.withBranch(null, null);
        }
        if (result.getStepType() == StepType.JOIN
                && victimId.equals(result.getConfig(JoinConfig.class).getSourceForkStepId())) {
            result = result.withConfig(result.getConfig(JoinConfig.class).withSourceForkStepId(null));
        }
        if (result.getStepType() == StepType.FORK) {
            ForkConfig config = result.getConfig(ForkConfig.class);
            for (Branch branch : config.getBranches()) {
                if (victimId.equals(branch.getStartStepId())) {
                    config = config.withBranch(branch.withStartStepId(branchSuccessor));
                }
            }
            if (config != result.getConfig()) {
                result = result.withConfig(config);
            }
        }
        return result;
    }

    /**
     * Puts the steps in the given order and rewires the simple linear links to follow it.
     *
     * @param orderedStepIds Every step id of the definition, exactly once.
     */
    public WorkflowDefinition reorderSteps(WorkflowDefinition definition, List<String> orderedStepIds) {
        return reorderer.reorder(definition, orderedStepIds);
    }

    /**
     * Adds a step to a fork branch.
     *
     * @param afterStepId The branch step to insert after, or null to make the new step the branch's first step.
     */
    public WorkflowDefinition addStepToBranch(WorkflowDefinition definition, String forkStepId, String branchId,
                                              String afterStepId, StepType type) {
        return branchInserter.insert(definition, forkStepId, branchId, afterStepId, type);
    }

    /**
     * Adds a transition whose priority is the number of transitions already leaving its source.
     */
    public WorkflowDefinition addBranchTransition(WorkflowDefinition definition, String fromStepId, String toStepId,
                                                  TransitionEvent event, ConditionGroup condition) {
        definition.requireStep(fromStepId);
        definition.requireStep(toStepId);
        if (event == null) {
            throw new IllegalArgumentException("event may not be null.");
        }
        int priority = definition.outgoing(fromStepId).size();
        List<Transition> transitions = new ArrayList<>(definition.getTransitions());
        transitions.add(new Transition(ids.nextTransitionId(), fromStepId, toStepId, event, priority, condition));
        return definition.withTransitions(transitions);
    }

    /**
     * Replaces a transition with the result of applying the update to it. The transition id may not change,
     * and both endpoints of the result must exist.
     */
    public WorkflowDefinition updateTransition(WorkflowDefinition definition, String transitionId,
                                               UnaryOperator<Transition> update) {
        Transition existing = definition.requireTransition(transitionId);
        Transition updated = update.apply(existing);
        if (updated == null || !updated.getTransitionId().equals(transitionId)) {
            throw new GraphStructureException("Updating transition " + transitionId + " may not change its id.");
        }
        definition.requireStep(updated.getFromStepId());
        definition.requireStep(updated.getToStepId());

        List<Transition> transitions = new ArrayList<>(definition.getTransitions().size());
        for (Transition transition : definition.getTransitions()) {
            transitions.add(transition.getTransitionId().equals(transitionId) ? updated : transition);
        }
        return definition.withTransitions(transitions);
    }

    public WorkflowDefinition deleteTransition(WorkflowDefinition definition, String transitionId) {
        definition.requireTransition(transitionId);
        List<Transition> transitions = new ArrayList<>(definition.getTransitions());
        transitions.removeIf(t -> t.getTransitionId().equals(transitionId));
        return definition.withTransitions(transitions);
    }

    /**
     * Replaces a step with the result of applying the update to it. The step's id, type, position and start
     * flag are kept; use {@link #setStartStep} and {@link #reorderSteps} to change those.
     */
    public WorkflowDefinition updateStep(WorkflowDefinition definition, String stepId, UnaryOperator<Step> update) {
        Step existing = definition.requireStep(stepId);
        Step updated = update.apply(existing);
        if (updated == null || !updated.getStepId().equals(stepId)) {
            throw new GraphStructureException("Updating step " + stepId + " may not change its id.");
        }
        if (updated.getStepType() != existing.getStepType()) {
            throw new GraphStructureException("Updating step " + stepId + " may not change its type.");
        }
        checkStepReferences(definition, updated);
        Step normalized = updated.toBuilder().order(existing.getOrder()).start(existing.isStart()).build();
        return definition.withSteps(StepPositions.replace(definition.getSteps(), normalized));
    }

    private static void checkStepReferences(WorkflowDefinition definition, Step step) {
        if (step.getStepType() == StepType.FORK) {
            for (Branch branch : step.getConfig(ForkConfig.class).getBranches()) {
                if (branch.hasStartStep()) {
                    definition.requireStep(branch.getStartStepId());
                }
            }
        }
        if (step.getStepType() == StepType.JOIN) {
            String source = step.getConfig(JoinConfig.class).getSourceForkStepId();
            if (source != null && definition.requireStep(source).getStepType() != StepType.FORK) {
                throw new GraphStructureException("Join " + step.getStepId() + " must reference a fork step, but "
                                                  + source + " is not one.");
            }
        }
    }

    /**
     * Moves a step one position up or down without touching any transitions. Moving past either end does nothing.
     */
    public WorkflowDefinition moveStep(WorkflowDefinition definition, String stepId, MoveDirection direction) {
        definition.requireStep(stepId);
        int index = definition.indexOf(stepId);
        int target = (direction == MoveDirection.UP ? index - 1 : index + 1);
        if (target < 0 || target >= definition.getSteps().size()) {
            return definition;
        }
        List<Step> steps = new ArrayList<>(definition.getSteps());
        Step moved = steps.get(index);
        steps.set(index, steps.get(target));
        steps.set(target, moved);
        return definition.withSteps(StepPositions.renumber(steps));
    }

    /**
     * Appends an unconnected copy of a step. The copy is never the start step, never terminal and not part of
     * any branch; a copied fork gets fresh, empty branches and a copied join has no source fork.
     */
    public WorkflowDefinition duplicateStep(WorkflowDefinition definition, String stepId) {
        Step source = definition.requireStep(stepId);
        StepConfig config = source.getConfig();
        if (config instanceof ForkConfig) {
            ForkConfig forkConfig = (ForkConfig) config;
            List<Branch> branches = new ArrayList<>();
            for (Branch branch : forkConfig.getBranches()) {
                branches.add(new Branch(ids.nextBranchId(), branch.getBranchName(), branch.getDescription(),
                                        branch.getAssignedTeam(), branch.getColor(), null));
            }
            config = forkConfig.withBranches(branches);
        } else if (config instanceof JoinConfig) {
            config = ((JoinConfig) config).withSourceForkStepId(null);
        }

        Step copy = source.toBuilder()
                          .stepId(ids.nextStepId())
                          .stepName(source.getStepName() + " (copy)")
                          .order(definition.getSteps().size())
                          .start(false)
                          .terminal(false)
                          .branchId(null)
                          .parentForkStepId(null)
                          .config(config)
                          .build();
        List<Step> steps = new ArrayList<>(definition.getSteps());
        steps.add(copy);
        return definition.withSteps(steps);
    }

    /**
     * Makes the given step the only start step.
     */
    public WorkflowDefinition setStartStep(WorkflowDefinition definition, String stepId) {
        definition.requireStep(stepId);
        List<Step> steps = new ArrayList<>(definition.getSteps().size());
        for (Step step : definition.getSteps()) {
            steps.add(step.withStart(step.getStepId().equals(stepId)));
        }
        return new WorkflowDefinition(steps, definition.getTransitions(), stepId);
    }

    public WorkflowDefinition setTerminal(WorkflowDefinition definition, String stepId, boolean terminal) {
        Step step = definition.requireStep(stepId);
        return definition.withSteps(StepPositions.replace(definition.getSteps(),
                                                          step.toBuilder().terminal(terminal).build()));
    }

    /**
     * Adds an empty branch to a fork.
     *
     * @param branchName The branch's name, or null for "Branch N".
     */
    public WorkflowDefinition addBranch(WorkflowDefinition definition, String forkStepId, String branchName) {
        Step fork = requireFork(definition, forkStepId);
        ForkConfig config = fork.getConfig(ForkConfig.class);
        int count = config.getBranches().size();
        Branch branch = new Branch(ids.nextBranchId(),
                                   branchName == null ? "Branch " + (count + 1) : branchName,
                                   null, null, BRANCH_COLORS.get(count % BRANCH_COLORS.size()), null);
        List<Branch> branches = new ArrayList<>(config.getBranches());
        branches.add(branch);
        return definition.withSteps(StepPositions.replace(definition.getSteps(),
                                                          fork.withConfig(config.withBranches(branches))));
    }

    /**
     * Replaces a branch's metadata with the result of the update. The branch id may not change, and a start
     * step, if set, must exist.
     */
    public WorkflowDefinition updateBranch(WorkflowDefinition definition, String forkStepId, String branchId,
                                           UnaryOperator<Branch> update) {
        Step fork = requireFork(definition, forkStepId);
        ForkConfig config = fork.getConfig(ForkConfig.class);
        Branch existing = config.findBranch(branchId)
                .orElseThrow(() -> new GraphReferenceException("Fork " + forkStepId + " has no branch " + branchId));
        Branch updated = update.apply(existing);
        if (updated == null || !updated.getBranchId().equals(branchId)) {
            throw new GraphStructureException("Updating branch " + branchId + " may not change its id.");
        }
        if (updated.hasStartStep()) {
            definition.requireStep(updated.getStartStepId());
        }
        return definition.withSteps(StepPositions.replace(definition.getSteps(),
                                                          fork.withConfig(config.withBranch(updated))));
    }

    /**
     * Removes a branch from a fork. Steps that belonged to it stay in the workflow but are no longer tagged
     * with the branch.
     */
    public WorkflowDefinition deleteBranch(WorkflowDefinition definition, String forkStepId, String branchId) {
        Step fork = requireFork(definition, forkStepId);
        ForkConfig config = fork.getConfig(ForkConfig.class);
        if (config.findBranch(branchId).isEmpty()) {
            throw new GraphReferenceException("Fork " + forkStepId + " has no branch " + branchId);
        }
        List<Branch> branches = new ArrayList<>(config.getBranches());
        branches.removeIf(b -> b.getBranchId().equals(branchId));
        Step updatedFork = fork.withConfig(config.withBranches(branches));

        Set<String> untagged = new HashSet<>();
        List<Step> steps = new ArrayList<>(definition.getSteps().size());
        for (Step step : definition.getSteps()) {
            if (step.getStepId().equals(forkStepId)) {
                steps.add(updatedFork);
            } else if (branchId.equals(step.getBranchId()) && forkStepId.equals(step.getParentForkStepId())) {
                steps.add(step.withBranch(null, null));
                untagged.add(step.getStepId());
            } else {
                steps.add(step);
            }
        }
        log.debug("Deleted branch {} of fork {}; untagged steps {}.", branchId, forkStepId, untagged);
        return definition.withSteps(steps);
    }

    private static Step requireFork(WorkflowDefinition definition, String forkStepId) {
        Step fork = definition.requireStep(forkStepId);
        if (fork.getStepType() != StepType.FORK) {
            throw new GraphStructureException("Step " + forkStepId + " is not a fork step.");
        }
        return fork;
    }

    private static String defaultName(StepConfig config) {
        if (config instanceof SubWorkflowConfig && ((SubWorkflowConfig) config).getSubWorkflowName() != null) {
            return ((SubWorkflowConfig) config).getSubWorkflowName();
        }
        return "New " + config.getStepType().getLabel();
    }
}
