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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

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

public class BranchTraversalTest {

    private WorkflowDefinition definition;
    private Step fork;
    private Branch left;
    private Branch right;

    // fork -> (a1 -> a2) | (b1) -> join
    @BeforeEach
    public void setup() {
        left = new Branch("left", "Left", null, null, null, "a1");
        right = new Branch("right", "Right", null, null, null, "b1");
        fork = Step.builder("fork", StepType.FORK).order(0).start(true)
                   .config(new ForkConfig(List.of(left, right), null)).build();
        List<Step> steps = Arrays.asList(
                fork,
                Step.builder("a1", StepType.TASK).order(1).branchId("left").parentForkStepId("fork").build(),
                Step.builder("a2", StepType.APPROVAL).order(2).branchId("left").parentForkStepId("fork").build(),
                Step.builder("b1", StepType.TASK).order(3).branchId("right").parentForkStepId("fork").build(),
                Step.builder("join", StepType.JOIN).order(4).config(new JoinConfig("fork")).build());
        List<Transition> transitions = Arrays.asList(
                new Transition("t1", "fork", "a1", TransitionEvent.COMPLETE_TASK),
                new Transition("t2", "fork", "b1", TransitionEvent.COMPLETE_TASK),
                new Transition("t3", "a1", "a2", TransitionEvent.COMPLETE_TASK),
                new Transition("t4", "a2", "join", TransitionEvent.APPROVE),
                new Transition("t5", "a2", "a1", TransitionEvent.REJECT),
                new Transition("t6", "b1", "join", TransitionEvent.COMPLETE_TASK));
        definition = new WorkflowDefinition(steps, transitions, "fork");
    }

    @Test
    public void testBranchStepsStopAtJoin() {
        Assertions.assertEquals(List.of("a1", "a2"), BranchTraversal.branchStepIds(definition, fork, left));
        Assertions.assertEquals(List.of("b1"), BranchTraversal.branchStepIds(definition, fork, right));
    }

    @Test
    public void testBranchEnds() {
        Assertions.assertEquals(List.of("a2"), BranchTraversal.branchEndStepIds(definition, fork, left));
        Assertions.assertEquals(List.of("b1"), BranchTraversal.branchEndStepIds(definition, fork, right));
    }

    @Test
    public void testWalkDoesNotCrossIntoSiblingBranch() {
        WorkflowDefinition crossed = definition.withTransitions(
                concat(definition.getTransitions(), new Transition("t7", "a2", "b1", TransitionEvent.COMPLETE_TASK)));
        Assertions.assertEquals(List.of("a1", "a2"), BranchTraversal.branchStepIds(crossed, fork, left));
    }

    @Test
    public void testBranchWithoutStartIsEmpty() {
        Branch empty = new Branch("empty", "Empty", null, null, null, null);
        Assertions.assertTrue(BranchTraversal.branchStepIds(definition, fork, empty).isEmpty());

        Branch dangling = new Branch("dangling", "Dangling", null, null, null, "nowhere");
        Assertions.assertTrue(BranchTraversal.branchStepIds(definition, fork, dangling).isEmpty());
    }

    @Test
    public void testAllBranchSteps() {
        Assertions.assertEquals(Set.of("a1", "a2", "b1"), BranchTraversal.allBranchStepIds(definition));
    }

    private static List<Transition> concat(List<Transition> existing, Transition extra) {
        List<Transition> result = new ArrayList<>(existing);
        result.add(extra);
        return result;
    }
}
