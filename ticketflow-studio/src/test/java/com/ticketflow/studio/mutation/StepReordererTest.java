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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import com.ticketflow.testutil.GraphInvariants;
import com.ticketflow.testutil.SequentialIdGenerator;
import com.ticketflow.wf.conditions.Condition;
import com.ticketflow.wf.conditions.ConditionGroup;
import com.ticketflow.wf.conditions.ConditionOperator;
import com.ticketflow.wf.graph.GraphReferenceException;
import com.ticketflow.wf.graph.GraphStructureException;
import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.JoinConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class StepReordererTest {

    private WorkflowGraphMutator mutator;
    private WorkflowDefinition linear;

    @BeforeEach
    public void setup() {
        mutator = new WorkflowGraphMutator(new SequentialIdGenerator());
        linear = mutator.appendStep(WorkflowDefinition.empty(), StepType.FORM);
        linear = mutator.appendStep(linear, StepType.APPROVAL);
        linear = mutator.appendStep(linear, StepType.TASK);
    }

    private static List<String> stepIds(WorkflowDefinition definition) {
        return definition.getSteps().stream().map(Step::getStepId).collect(Collectors.toList());
    }

    @Test
    public void rewiresLinearLinksToFollowTheNewOrder() {
        WorkflowDefinition definition = mutator.reorderSteps(linear, List.of("step_2", "step_1", "step_3"));

        Assertions.assertEquals(List.of("step_2", "step_1", "step_3"), stepIds(definition));
        Assertions.assertEquals("step_2", definition.getStartStepId());
        Assertions.assertTrue(definition.requireStep("step_2").isStart());
        Assertions.assertFalse(definition.requireStep("step_1").isStart());

        // ids and events survive, only the targets move
        Assertions.assertEquals(List.of(new Transition("t_1", "step_1", "step_3", TransitionEvent.SUBMIT_FORM),
                                        new Transition("t_2", "step_2", "step_1", TransitionEvent.APPROVE)),
                                definition.getTransitions());
        GraphInvariants.verify(definition);
    }

    @Test
    public void preservesTheSetOfStepIds() {
        List<String> order = List.of("step_3", "step_1", "step_2");
        WorkflowDefinition definition = mutator.reorderSteps(linear, order);
        Assertions.assertEquals(new HashSet<>(stepIds(linear)), new HashSet<>(stepIds(definition)));
        Assertions.assertEquals(order, stepIds(definition));
        for (int i = 0; i < order.size(); i++) {
            Assertions.assertEquals(i, definition.getSteps().get(i).getOrder());
        }
    }

    @Test
    public void keepsStepsWithSeveralOutgoingTransitions() {
        List<Transition> transitions = new ArrayList<>(linear.getTransitions());
        transitions.add(new Transition("t_reject", "step_2", "step_1", TransitionEvent.REJECT));
        WorkflowDefinition withReject = linear.withTransitions(transitions);

        WorkflowDefinition definition = mutator.reorderSteps(withReject, List.of("step_2", "step_1", "step_3"));
        Assertions.assertEquals("step_3", definition.requireTransition("t_2").getToStepId());
        Assertions.assertEquals("step_1", definition.requireTransition("t_reject").getToStepId());
        Assertions.assertEquals("step_3", definition.requireTransition("t_1").getToStepId());
    }

    @Test
    public void keepsConditionalTransitions() {
        ConditionGroup big = ConditionGroup.allOf(new Condition("amount", ConditionOperator.GREATER_THAN, 500));
        WorkflowDefinition guarded = mutator.updateTransition(linear, "t_1", t -> t.withCondition(big));

        WorkflowDefinition definition = mutator.reorderSteps(guarded, List.of("step_1", "step_3", "step_2"));
        Assertions.assertEquals("step_2", definition.requireTransition("t_1").getToStepId());
    }

    @Test
    public void joinWithoutOutgoingGetsALinkToTheNextStep() {
        List<Step> steps = Arrays.asList(
                Step.builder("fork", StepType.FORK).order(0).start(true).build(),
                Step.builder("join", StepType.JOIN).order(1).config(new JoinConfig("fork")).build(),
                Step.builder("done", StepType.TASK).order(2).build());
        WorkflowDefinition definition = new WorkflowDefinition(steps, List.of(), "fork");

        WorkflowDefinition reordered = mutator.reorderSteps(definition, List.of("fork", "join", "done"));
        Transition added = reordered.outgoing("join").get(0);
        Assertions.assertEquals("done", added.getToStepId());
        Assertions.assertEquals(TransitionEvent.COMPLETE_TASK, added.getEvent());
        Assertions.assertTrue(reordered.outgoing("fork").isEmpty());
    }

    @Test
    public void leavesTheLastStepsTransitionsAlone() {
        List<Transition> transitions = new ArrayList<>(linear.getTransitions());
        transitions.add(new Transition("t_back", "step_3", "step_1", TransitionEvent.COMPLETE_TASK));
        WorkflowDefinition looped = linear.withTransitions(transitions);

        WorkflowDefinition definition = mutator.reorderSteps(looped, List.of("step_1", "step_2", "step_3"));
        Assertions.assertEquals(looped.getTransitions(), definition.getTransitions());
    }

    @Test
    public void rejectsOrdersThatAreNotAPermutation() {
        Assertions.assertThrows(GraphStructureException.class,
                                () -> mutator.reorderSteps(linear, List.of("step_1", "step_2")));
        Assertions.assertThrows(GraphStructureException.class,
                                () -> mutator.reorderSteps(linear, List.of("step_1", "step_1", "step_2")));
        Assertions.assertThrows(GraphReferenceException.class,
                                () -> mutator.reorderSteps(linear, List.of("step_1", "step_2", "ghost")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> mutator.reorderSteps(linear, null));
    }

    @Test
    public void reorderingAnEmptyWorkflowIsANoOp() {
        Assertions.assertSame(WorkflowDefinition.empty(),
                              mutator.reorderSteps(WorkflowDefinition.empty(), List.of()));
    }

    @Test
    public void keepsForkAndBranchWiringWhileMovingTheJoinExit() {
        ForkConfig forkConfig = new ForkConfig(List.of(new Branch("left", "Left", null, null, null, "a"),
                                                       new Branch("right", "Right", null, null, null, "b")), null);
        List<Step> steps = Arrays.asList(
                Step.builder("s", StepType.FORM).order(0).start(true).build(),
                Step.builder("fork", StepType.FORK).order(1).config(forkConfig).build(),
                Step.builder("a", StepType.TASK).order(2).branchId("left").parentForkStepId("fork").build(),
                Step.builder("b", StepType.APPROVAL).order(3).branchId("right").parentForkStepId("fork").build(),
                Step.builder("join", StepType.JOIN).order(4).config(new JoinConfig("fork")).build(),
                Step.builder("x", StepType.TASK).order(5).build(),
                Step.builder("y", StepType.NOTIFY).order(6).terminal(true).build());
        List<Transition> transitions = List.of(
                new Transition("t_sf", "s", "fork", TransitionEvent.SUBMIT_FORM),
                new Transition("t_fa", "fork", "a", TransitionEvent.COMPLETE_TASK),
                new Transition("t_fb", "fork", "b", TransitionEvent.COMPLETE_TASK),
                new Transition("t_aj", "a", "join", TransitionEvent.COMPLETE_TASK),
                new Transition("t_bj", "b", "join", TransitionEvent.APPROVE),
                new Transition("t_jx", "join", "x", TransitionEvent.COMPLETE_TASK),
                new Transition("t_xy", "x", "y", TransitionEvent.COMPLETE_TASK));
        WorkflowDefinition forked = new WorkflowDefinition(steps, transitions, "s");

        WorkflowDefinition definition = mutator.reorderSteps(forked,
                                                             List.of("s", "fork", "a", "b", "join", "y", "x"));

        Assertions.assertEquals(List.of("s", "fork", "a", "b", "join", "y", "x"), stepIds(definition));
        for (String unchanged : List.of("t_sf", "t_fa", "t_fb", "t_aj", "t_bj", "t_xy")) {
            Assertions.assertEquals(forked.requireTransition(unchanged), definition.requireTransition(unchanged));
        }
        Assertions.assertEquals(new Transition("t_jx", "join", "y", TransitionEvent.COMPLETE_TASK),
                                definition.requireTransition("t_jx"));
        Assertions.assertEquals(transitions.size(), definition.getTransitions().size());
        Assertions.assertEquals(forked.requireStep("fork").getConfig(), definition.requireStep("fork").getConfig());
        GraphInvariants.verify(definition);
    }
}
