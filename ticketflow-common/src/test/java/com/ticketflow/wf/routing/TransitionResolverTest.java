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

package com.ticketflow.wf.routing;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.ticketflow.wf.conditions.Condition;
import com.ticketflow.wf.conditions.ConditionEvaluator;
import com.ticketflow.wf.conditions.ConditionGroup;
import com.ticketflow.wf.conditions.ConditionOperator;
import com.ticketflow.wf.graph.GraphReferenceException;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.easymock.EasyMock;
import org.easymock.IMocksControl;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TransitionResolverTest {

    private static final ConditionGroup HIGH_PRIORITY =
            ConditionGroup.allOf(new Condition("priority", ConditionOperator.EQUALS, "HIGH"));
    private static final ConditionGroup BIG_SPEND =
            ConditionGroup.allOf(new Condition("amount", ConditionOperator.GREATER_THAN, 10000));

    private static WorkflowDefinition approvalRouting() {
        List<Step> steps = Arrays.asList(Step.builder("approve", StepType.APPROVAL).order(0).start(true).build(),
                                         Step.builder("director", StepType.APPROVAL).order(1).build(),
                                         Step.builder("escalate", StepType.TASK).order(2).build(),
                                         Step.builder("fulfil", StepType.TASK).order(3).terminal(true).build());
        List<Transition> transitions = Arrays.asList(
                new Transition("t_default", "approve", "fulfil", TransitionEvent.APPROVE, 0, null),
                new Transition("t_big", "approve", "director", TransitionEvent.APPROVE, 5, BIG_SPEND),
                new Transition("t_high", "approve", "escalate", TransitionEvent.APPROVE, 5, HIGH_PRIORITY),
                new Transition("t_director", "director", "fulfil", TransitionEvent.APPROVE),
                new Transition("t_escalated", "escalate", "fulfil", TransitionEvent.COMPLETE_TASK));
        return new WorkflowDefinition(steps, transitions, "approve");
    }

    @Test
    public void picksHighestPriorityMatchingTransition() {
        TransitionResolver resolver = new TransitionResolver();
        Map<String, Object> context = Map.of("amount", 25000, "priority", "LOW");
        Assertions.assertEquals(Optional.of("director"),
                                resolver.resolveNextStep(approvalRouting(), "approve", TransitionEvent.APPROVE, context));
    }

    @Test
    public void equalPrioritiesAreTriedInCreationOrder() {
        TransitionResolver resolver = new TransitionResolver();
        Map<String, Object> context = Map.of("amount", 25000, "priority", "HIGH");
        Assertions.assertEquals("t_big",
                                resolver.resolve(approvalRouting(), "approve", TransitionEvent.APPROVE, context)
                                        .get().getTransitionId());
    }

    @Test
    public void fallsBackToUnconditionedTransition() {
        TransitionResolver resolver = new TransitionResolver();
        Map<String, Object> context = Map.of("amount", 50, "priority", "LOW");
        Assertions.assertEquals(Optional.of("fulfil"),
                                resolver.resolveNextStep(approvalRouting(), "approve", TransitionEvent.APPROVE, context));
    }

    @Test
    public void evaluatesCandidatesInPriorityOrderAndStopsAtFirstMatch() {
        IMocksControl mockery = EasyMock.createStrictControl();
        ConditionEvaluator evaluator = mockery.createMock(ConditionEvaluator.class);
        Map<String, Object> context = Collections.emptyMap();

        EasyMock.expect(evaluator.evaluate(EasyMock.eq(BIG_SPEND), EasyMock.eq(context))).andReturn(false);
        EasyMock.expect(evaluator.evaluate(EasyMock.eq(HIGH_PRIORITY), EasyMock.eq(context))).andReturn(true);
        mockery.replay();

        TransitionResolver resolver = new TransitionResolver(evaluator);
        Assertions.assertEquals(Optional.of("escalate"),
                                resolver.resolveNextStep(approvalRouting(), "approve", TransitionEvent.APPROVE, context));
        mockery.verify();
    }

    @Test
    public void terminalStepWithoutTransitionResolvesToNothing() {
        TransitionResolver resolver = new TransitionResolver();
        Assertions.assertEquals(Optional.empty(), resolver.resolve(approvalRouting(), "fulfil",
                                                                   TransitionEvent.COMPLETE_TASK, Map.of()));
    }

    @Test
    public void nonTerminalStepWithoutTransitionThrows() {
        TransitionResolver resolver = new TransitionResolver();
        Assertions.assertThrows(TransitionNotFoundException.class,
                                () -> resolver.resolve(approvalRouting(), "approve", TransitionEvent.REJECT, Map.of()));
    }

    @Test
    public void throwsWhenNoConditionMatches() {
        WorkflowDefinition guardedOnly = approvalRouting().withTransitions(Arrays.asList(
                new Transition("t_big", "approve", "director", TransitionEvent.APPROVE, 5, BIG_SPEND)));
        TransitionResolver resolver = new TransitionResolver();
        Assertions.assertThrows(TransitionNotFoundException.class,
                                () -> resolver.resolve(guardedOnly, "approve", TransitionEvent.APPROVE,
                                                       Map.of("amount", 10)));
    }

    @Test
    public void unknownStepThrows() {
        TransitionResolver resolver = new TransitionResolver();
        Assertions.assertThrows(GraphReferenceException.class,
                                () -> resolver.resolve(approvalRouting(), "ghost", TransitionEvent.APPROVE, Map.of()));
    }
}
