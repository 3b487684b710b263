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
import java.util.Arrays;
import java.util.List;

import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.JoinConfig;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class BranchJoinRepairerTest {

    private final BranchJoinRepairer repairer = new BranchJoinRepairer();

    // fork -> (a1 -> a2) | (b1), neither branch connected to the join
    private static WorkflowDefinition unjoined(List<Transition> extra) {
        ForkConfig forkConfig = new ForkConfig(List.of(new Branch("left", "Left", null, null, null, "a1"),
                                                       new Branch("right", "Right", null, null, null, "b1")), null);
        List<Step> steps = Arrays.asList(
                Step.builder("fork", StepType.FORK).order(0).start(true).config(forkConfig).build(),
                Step.builder("a1", StepType.TASK).order(1).branchId("left").parentForkStepId("fork").build(),
                Step.builder("a2", StepType.APPROVAL).order(2).branchId("left").parentForkStepId("fork").build(),
                Step.builder("b1", StepType.FORM).order(3).branchId("right").parentForkStepId("fork").build(),
                Step.builder("join", StepType.JOIN).order(4).config(new JoinConfig("fork")).terminal(true).build());
        List<Transition> transitions = new ArrayList<>(Arrays.asList(
                new Transition("t1", "fork", "a1", TransitionEvent.COMPLETE_TASK),
                new Transition("t2", "fork", "b1", TransitionEvent.COMPLETE_TASK),
                new Transition("t3", "a1", "a2", TransitionEvent.COMPLETE_TASK)));
        transitions.addAll(extra);
        return new WorkflowDefinition(steps, transitions, "fork");
    }

    @Test
    public void connectsEveryBranchEndToTheJoin() {
        WorkflowDefinition repaired = repairer.repair(unjoined(List.of()));

        Transition left = repaired.requireTransition("t_auto_a2_to_join");
        Assertions.assertEquals("join", left.getToStepId());
        Assertions.assertEquals(TransitionEvent.APPROVE, left.getEvent());
        Transition right = repaired.requireTransition("t_auto_b1_to_join");
        Assertions.assertEquals(TransitionEvent.SUBMIT_FORM, right.getEvent());
        Assertions.assertEquals(5, repaired.getTransitions().size());

        Assertions.assertFalse(new PublishValidator().validate(repaired)
                                                     .hasFinding(FindingType.BRANCH_NO_JOIN_TRANSITION));
    }

    @Test
    public void repairIsIdempotent() {
        WorkflowDefinition once = repairer.repair(unjoined(List.of()));
        Assertions.assertSame(once, repairer.repair(once));
    }

    @Test
    public void generatedIdsAvoidCollisions() {
        WorkflowDefinition definition = unjoined(List.of(
                new Transition("t_auto_b1_to_join", "a1", "a1", TransitionEvent.SKIP),
                new Transition("t_b", "b1", "join", TransitionEvent.SUBMIT_FORM)));
        WorkflowDefinition repaired = repairer.repair(definition);

        Assertions.assertEquals("a2", repaired.requireTransition("t_auto_a2_to_join").getFromStepId());
        Assertions.assertEquals(definition.getTransitions().size() + 1, repaired.getTransitions().size());

        WorkflowDefinition clash = unjoined(List.of(new Transition("t_auto_a2_to_join", "a1", "a1",
                                                                   TransitionEvent.SKIP)));
        Assertions.assertEquals("a2", repairer.repair(clash).requireTransition("t_auto_a2_to_join_2")
                                              .getFromStepId());
    }

    @Test
    public void forkWithoutJoinIsLeftAlone() {
        WorkflowDefinition definition = new WorkflowDefinition(
                List.of(Step.builder("fork", StepType.FORK).start(true)
                            .config(new ForkConfig(List.of(new Branch("b", "B", null, null, null, null)), null))
                            .build()),
                List.of(), "fork");
        Assertions.assertSame(definition, repairer.repair(definition));
    }
}
