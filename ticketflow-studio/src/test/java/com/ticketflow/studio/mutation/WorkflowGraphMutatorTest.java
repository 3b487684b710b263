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

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.ticketflow.testutil.GraphInvariants;
import com.ticketflow.testutil.SequentialIdGenerator;
import com.ticketflow.wf.conditions.Condition;
import com.ticketflow.wf.conditions.ConditionGroup;
import com.ticketflow.wf.conditions.ConditionOperator;
import com.ticketflow.wf.graph.GraphReferenceException;
import com.ticketflow.wf.graph.GraphStructureException;
import com.ticketflow.wf.model.ApprovalConfig;
import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.JoinConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.SubWorkflowConfig;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class WorkflowGraphMutatorTest {

    private WorkflowGraphMutator mutator;

    @BeforeEach
    public void setup() {
        mutator = new WorkflowGraphMutator(new SequentialIdGenerator());
    }

    // step_1 (form) -> step_2 (approval) -> step_3 (task)
    private WorkflowDefinition formApprovalTask() {
        WorkflowDefinition definition = mutator.appendStep(WorkflowDefinition.empty(), StepType.FORM);
        definition = mutator.appendStep(definition, StepType.APPROVAL);
        return mutator.appendStep(definition, StepType.TASK);
    }

    private static Transition only(List<Transition> transitions) {
        Assertions.assertEquals(1, transitions.size(), transitions.toString());
        return transitions.get(0);
    }

    private static List<String> stepIds(WorkflowDefinition definition) {
        return definition.getSteps().stream().map(Step::getStepId).collect(Collectors.toList());
    }

    @Test
    public void appendBuildsALinearChain() {
        WorkflowDefinition definition = formApprovalTask();

        Assertions.assertEquals(List.of("step_1", "step_2", "step_3"), stepIds(definition));
        Assertions.assertEquals("step_1", definition.getStartStepId());
        Assertions.assertTrue(definition.getSteps().get(0).isStart());
        Assertions.assertFalse(definition.getSteps().get(1).isStart());
        Assertions.assertEquals("New Form", definition.getSteps().get(0).getStepName());

        Assertions.assertEquals(List.of(new Transition("t_1", "step_1", "step_2", TransitionEvent.SUBMIT_FORM),
                                        new Transition("t_2", "step_2", "step_3", TransitionEvent.APPROVE)),
                                definition.getTransitions());
        GraphInvariants.verify(definition);
    }

    @Test
    public void appendedNotifyStepIsTerminal() {
        WorkflowDefinition definition = mutator.appendStep(formApprovalTask(), StepType.NOTIFY);
        Step notify = definition.requireStep("step_4");
        Assertions.assertTrue(notify.isTerminal());
        Assertions.assertEquals(TransitionEvent.COMPLETE_TASK, only(definition.incoming("step_4")).getEvent());
    }

    @Test
    public void appendUsesSubWorkflowNameWhenPresent() {
        WorkflowDefinition definition = mutator.appendStep(WorkflowDefinition.empty(),
                                                           new SubWorkflowConfig("wf-onboarding", 3, "Onboarding"));
        Assertions.assertEquals("Onboarding", definition.requireStep("step_1").getStepName());
    }

    @Test
    public void insertAfterTakesOverTheOutgoingTransitions() {
        WorkflowDefinition definition = mutator.insertStepAfter(formApprovalTask(), "step_1", StepType.TASK);

        Assertions.assertEquals(List.of("step_1", "step_4", "step_2", "step_3"), stepIds(definition));
        Transition intoNew = only(definition.incoming("step_4"));
        Assertions.assertEquals("step_1", intoNew.getFromStepId());
        Assertions.assertEquals(TransitionEvent.SUBMIT_FORM, intoNew.getEvent());

        Transition moved = definition.requireTransition("t_1");
        Assertions.assertEquals("step_4", moved.getFromStepId());
        Assertions.assertEquals("step_2", moved.getToStepId());
        GraphInvariants.verify(definition);
    }

    @Test
    public void deleteConnectsPredecessorToSuccessor() {
        WorkflowDefinition definition = mutator.deleteStep(formApprovalTask(), "step_2");

        Assertions.assertEquals(List.of("step_1", "step_3"), stepIds(definition));
        Transition bypass = only(definition.getTransitions());
        Assertions.assertEquals("step_1", bypass.getFromStepId());
        Assertions.assertEquals("step_3", bypass.getToStepId());
        Assertions.assertEquals(TransitionEvent.SUBMIT_FORM, bypass.getEvent());
        Assertions.assertEquals(0, bypass.getPriority());
        Assertions.assertFalse(bypass.hasCondition());
        GraphInvariants.verify(definition);
    }

    @Test
    public void deleteConnectsEveryPredecessorToEverySuccessor() {
        List<Step> steps = Arrays.asList(Step.builder("a", StepType.FORM).order(0).start(true).build(),
                                         Step.builder("b", StepType.FORM).order(1).build(),
                                         Step.builder("x", StepType.APPROVAL).order(2).build(),
                                         Step.builder("c", StepType.TASK).order(3).build(),
                                         Step.builder("d", StepType.TASK).order(4).build());
        List<Transition> transitions = Arrays.asList(
                new Transition("t_a", "a", "x", TransitionEvent.SUBMIT_FORM),
                new Transition("t_b", "b", "x", TransitionEvent.SUBMIT_FORM),
                new Transition("t_c", "x", "c", TransitionEvent.APPROVE),
                new Transition("t_d", "x", "d", TransitionEvent.REJECT),
                new Transition("t_loop", "x", "x", TransitionEvent.SKIP));
        WorkflowDefinition definition = mutator.deleteStep(new WorkflowDefinition(steps, transitions, "a"), "x");

        Assertions.assertEquals(4, definition.getTransitions().size());
        for (String from : List.of("a", "b")) {
            List<String> targets = definition.outgoing(from).stream().map(Transition::getToStepId)
                                             .collect(Collectors.toList());
            Assertions.assertEquals(List.of("c", "d"), targets);
            definition.outgoing(from).forEach(t -> Assertions.assertEquals(TransitionEvent.SUBMIT_FORM, t.getEvent()));
        }
        GraphInvariants.verify(definition);
    }

    @Test
    public void deletingTheStartStepPromotesTheFirstRemainingStep() {
        WorkflowDefinition definition = mutator.deleteStep(formApprovalTask(), "step_1");

        Assertions.assertEquals("step_2", definition.getStartStepId());
        Assertions.assertTrue(definition.requireStep("step_2").isStart());
        Assertions.assertEquals(0, definition.requireStep("step_2").getOrder());
        GraphInvariants.verify(definition);
    }

    @Test
    public void deletingTheLastStepClearsTheStart() {
        WorkflowDefinition definition = mutator.appendStep(WorkflowDefinition.empty(), StepType.FORM);
        definition = mutator.deleteStep(definition, "step_1");
        Assertions.assertTrue(definition.isEmpty());
        Assertions.assertNull(definition.getStartStepId());
    }

    @Test
    public void deleteUnknownStepThrowsAndLeavesInputAlone() {
        WorkflowDefinition before = formApprovalTask();
        WorkflowDefinition snapshot = new WorkflowDefinition(before.getSteps(), before.getTransitions(),
                                                             before.getStartStepId());
        Assertions.assertThrows(GraphReferenceException.class, () -> mutator.deleteStep(before, "ghost"));
        Assertions.assertEquals(snapshot, before);
    }

    @Test
    public void deletingAForkClearsReferencesToIt() {
        Branch branch = new Branch("b1", "Left", null, null, null, "a1");
        List<Step> steps = Arrays.asList(
                Step.builder("fork", StepType.FORK).order(0).start(true)
                    .config(new ForkConfig(List.of(branch), null)).build(),
                Step.builder("a1", StepType.TASK).order(1).branchId("b1").parentForkStepId("fork").build(),
                Step.builder("join", StepType.JOIN).order(2).config(new JoinConfig("fork")).build());
        List<Transition> transitions = Arrays.asList(new Transition("t1", "fork", "a1", TransitionEvent.COMPLETE_TASK),
                                                     new Transition("t2", "a1", "join", TransitionEvent.COMPLETE_TASK));
        WorkflowDefinition definition = mutator.deleteStep(new WorkflowDefinition(steps, transitions, "fork"), "fork");

        Assertions.assertNull(definition.requireStep("join").getConfig(JoinConfig.class).getSourceForkStepId());
        Assertions.assertFalse(definition.requireStep("a1").isInBranch());
        Assertions.assertNull(definition.requireStep("a1").getParentForkStepId());
        Assertions.assertEquals("a1", definition.getStartStepId());
        GraphInvariants.verify(definition);
    }

    @Test
    public void addBranchTransitionUsesOutgoingCountAsPriority() {
        ConditionGroup rejected = ConditionGroup.allOf(new Condition("reason", ConditionOperator.IS_NOT_EMPTY, null));
        WorkflowDefinition definition = mutator.addBranchTransition(formApprovalTask(), "step_2", "step_1",
                                                                    TransitionEvent.REJECT, rejected);
        Transition added = definition.requireTransition("t_3");
        Assertions.assertEquals(1, added.getPriority());
        Assertions.assertEquals(rejected, added.getCondition());
        Assertions.assertEquals(TransitionEvent.REJECT, added.getEvent());
    }

    @Test
    public void addBranchTransitionRejectsUnknownSteps() {
        Assertions.assertThrows(GraphReferenceException.class,
                                () -> mutator.addBranchTransition(formApprovalTask(), "step_2", "ghost",
                                                                  TransitionEvent.REJECT, null));
    }

    @Test
    public void updateTransitionPatchesInPlace() {
        WorkflowDefinition definition = mutator.updateTransition(formApprovalTask(), "t_2", t -> t.withPriority(7));
        Assertions.assertEquals(7, definition.requireTransition("t_2").getPriority());
        Assertions.assertEquals(1, definition.getTransitions().indexOf(definition.requireTransition("t_2")));
    }

    @Test
    public void updateTransitionMayNotChangeIdOrDangle() {
        WorkflowDefinition definition = formApprovalTask();
        Assertions.assertThrows(GraphStructureException.class,
                                () -> mutator.updateTransition(definition, "t_2",
                                                               t -> new Transition("t_9", "step_2", "step_3",
                                                                                   TransitionEvent.APPROVE)));
        Assertions.assertThrows(GraphReferenceException.class,
                                () -> mutator.updateTransition(definition, "t_2", t -> t.withToStepId("ghost")));
    }

    @Test
    public void deleteTransition() {
        WorkflowDefinition definition = mutator.deleteTransition(formApprovalTask(), "t_1");
        Assertions.assertFalse(definition.findTransition("t_1").isPresent());
        Assertions.assertThrows(GraphReferenceException.class, () -> mutator.deleteTransition(definition, "t_1"));
    }

    @Test
    public void updateStepKeepsOrderAndStartFlag() {
        WorkflowDefinition definition = mutator.updateStep(formApprovalTask(), "step_1",
                                                           s -> s.toBuilder().stepName("Intake").order(9)
                                                                 .start(false).build());
        Step updated = definition.requireStep("step_1");
        Assertions.assertEquals("Intake", updated.getStepName());
        Assertions.assertEquals(0, updated.getOrder());
        Assertions.assertTrue(updated.isStart());
    }

    @Test
    public void updateStepChangesConfig() {
        WorkflowDefinition definition = mutator.updateStep(formApprovalTask(), "step_2",
                                                           s -> s.withConfig(ApprovalConfig.specificApprover(
                                                                   "cfo@example.com")));
        Assertions.assertEquals("cfo@example.com",
                                definition.requireStep("step_2").getConfig(ApprovalConfig.class)
                                          .getSpecificApproverEmail());
    }

    @Test
    public void updateStepMayNotChangeType() {
        Assertions.assertThrows(GraphStructureException.class,
                                () -> mutator.updateStep(formApprovalTask(), "step_1",
                                                         s -> Step.builder("step_1", StepType.TASK).build()));
    }

    @Test
    public void joinMustReferenceAFork() {
        WorkflowDefinition definition = mutator.appendStep(formApprovalTask(), StepType.JOIN);
        Assertions.assertThrows(GraphStructureException.class,
                                () -> mutator.updateStep(definition, "step_4",
                                                         s -> s.withConfig(new JoinConfig("step_1"))));
    }

    @Test
    public void moveStepSwapsNeighboursWithoutTouchingTransitions() {
        WorkflowDefinition original = formApprovalTask();
        WorkflowDefinition definition = mutator.moveStep(original, "step_3", MoveDirection.UP);

        Assertions.assertEquals(List.of("step_1", "step_3", "step_2"), stepIds(definition));
        Assertions.assertEquals(1, definition.requireStep("step_3").getOrder());
        Assertions.assertEquals(original.getTransitions(), definition.getTransitions());
    }

    @Test
    public void moveStepPastEitherEndDoesNothing() {
        WorkflowDefinition definition = formApprovalTask();
        Assertions.assertSame(definition, mutator.moveStep(definition, "step_1", MoveDirection.UP));
        Assertions.assertSame(definition, mutator.moveStep(definition, "step_3", MoveDirection.DOWN));
    }

    @Test
    public void duplicateAppendsAnUnconnectedCopy() {
        WorkflowDefinition definition = mutator.duplicateStep(formApprovalTask(), "step_1");
        Step copy = definition.requireStep("step_4");

        Assertions.assertEquals("New Form (copy)", copy.getStepName());
        Assertions.assertEquals(3, copy.getOrder());
        Assertions.assertFalse(copy.isStart());
        Assertions.assertTrue(definition.incoming("step_4").isEmpty());
        Assertions.assertTrue(definition.outgoing("step_4").isEmpty());
        Assertions.assertEquals("step_1", definition.getStartStepId());
    }

    @Test
    public void duplicatedForkGetsFreshEmptyBranches() {
        WorkflowDefinition definition = mutator.appendStep(WorkflowDefinition.empty(), StepType.FORK);
        definition = mutator.addBranch(definition, "step_1", "Hardware");
        definition = mutator.duplicateStep(definition, "step_1");

        Branch original = definition.requireStep("step_1").getConfig(ForkConfig.class).getBranches().get(0);
        Branch copy = definition.requireStep("step_2").getConfig(ForkConfig.class).getBranches().get(0);
        Assertions.assertEquals("Hardware", copy.getBranchName());
        Assertions.assertNotEquals(original.getBranchId(), copy.getBranchId());
        Assertions.assertFalse(copy.hasStartStep());
    }

    @Test
    public void setStartStepLeavesExactlyOneStart() {
        WorkflowDefinition definition = mutator.setStartStep(formApprovalTask(), "step_2");
        Assertions.assertEquals("step_2", definition.getStartStepId());
        Assertions.assertEquals(List.of("step_2"),
                                definition.getSteps().stream().filter(Step::isStart).map(Step::getStepId)
                                          .collect(Collectors.toList()));
    }

    @Test
    public void setTerminal() {
        WorkflowDefinition definition = mutator.setTerminal(formApprovalTask(), "step_3", true);
        Assertions.assertTrue(definition.requireStep("step_3").isTerminal());
    }

    @Test
    public void addBranchNamesAndColoursBranches() {
        WorkflowDefinition definition = mutator.appendStep(WorkflowDefinition.empty(), StepType.FORK);
        definition = mutator.addBranch(definition, "step_1", null);
        definition = mutator.addBranch(definition, "step_1", "Access");

        List<Branch> branches = definition.requireStep("step_1").getConfig(ForkConfig.class).getBranches();
        Assertions.assertEquals("Branch 1", branches.get(0).getBranchName());
        Assertions.assertEquals(WorkflowGraphMutator.BRANCH_COLORS.get(0), branches.get(0).getColor());
        Assertions.assertEquals("Access", branches.get(1).getBranchName());
        Assertions.assertEquals(WorkflowGraphMutator.BRANCH_COLORS.get(1), branches.get(1).getColor());
    }

    @Test
    public void addBranchRequiresAFork() {
        Assertions.assertThrows(GraphStructureException.class,
                                () -> mutator.addBranch(formApprovalTask(), "step_1", null));
    }

    @Test
    public void updateBranch() {
        WorkflowDefinition definition = mutator.appendStep(WorkflowDefinition.empty(), StepType.FORK);
        WorkflowDefinition withBranch = mutator.addBranch(definition, "step_1", null);

        WorkflowDefinition renamed = mutator.updateBranch(withBranch, "step_1", "branch_1",
                                                          b -> b.withBranchName("IT").withAssignedTeam("helpdesk"));
        Branch branch = renamed.requireStep("step_1").getConfig(ForkConfig.class).findBranch("branch_1").get();
        Assertions.assertEquals("IT", branch.getBranchName());
        Assertions.assertEquals("helpdesk", branch.getAssignedTeam());

        Assertions.assertThrows(GraphReferenceException.class,
                                () -> mutator.updateBranch(withBranch, "step_1", "branch_1",
                                                           b -> b.withStartStepId("ghost")));
        Assertions.assertThrows(GraphReferenceException.class,
                                () -> mutator.updateBranch(withBranch, "step_1", "branch_9", b -> b));
    }

    @Test
    public void deleteBranchUntagsItsSteps() {
        WorkflowDefinition definition = mutator.appendStep(WorkflowDefinition.empty(), StepType.FORK);
        definition = mutator.addBranch(definition, "step_1", null);
        definition = mutator.addStepToBranch(definition, "step_1", "branch_1", null, StepType.TASK);
        Assertions.assertTrue(definition.requireStep("step_2").isInBranch());

        definition = mutator.deleteBranch(definition, "step_1", "branch_1");
        Assertions.assertTrue(definition.requireStep("step_1").getConfig(ForkConfig.class).getBranches().isEmpty());
        Assertions.assertFalse(definition.requireStep("step_2").isInBranch());
        GraphInvariants.verify(definition);
    }
}
