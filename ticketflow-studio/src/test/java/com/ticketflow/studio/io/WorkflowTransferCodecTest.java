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

package com.ticketflow.studio.io;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketflow.studio.migration.BranchMigrator;
import com.ticketflow.testutil.ManualClock;
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

public class WorkflowTransferCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ManualClock clock;
    private WorkflowTransferCodec codec;

    @BeforeEach
    public void setup() {
        clock = new ManualClock(Instant.parse("2024-05-01T12:00:00Z"));
        codec = new WorkflowTransferCodec(clock, new WorkflowDefinitionCodec(), new BranchMigrator());
    }

    private static WorkflowDefinition forkWithUntaggedBranch() {
        ForkConfig forkConfig = new ForkConfig(List.of(new Branch("b", "Only", null, null, null, "task")), null);
        List<Step> steps = Arrays.asList(
                Step.builder("fork", StepType.FORK).order(0).config(forkConfig).build(),
                Step.builder("task", StepType.TASK).order(1).build(),
                Step.builder("join", StepType.JOIN).order(2).config(new JoinConfig("fork")).terminal(true).build());
        List<Transition> transitions = Arrays.asList(
                new Transition("t1", "fork", "task", TransitionEvent.COMPLETE_TASK),
                new Transition("t2", "task", "join", TransitionEvent.COMPLETE_TASK));
        return new WorkflowDefinition(steps, transitions, null);
    }

    @Test
    public void exportWritesMetadataAndTimestamp() throws Exception {
        WorkflowMetadata metadata = new WorkflowMetadata("Laptop request", "New hardware", "IT",
                                                         List.of("hardware", "onboarding"));
        clock.forward(Duration.ofMinutes(5));
        JsonNode exported = MAPPER.readTree(codec.export(metadata, forkWithUntaggedBranch()));

        Assertions.assertEquals("Laptop request", exported.get("name").asText());
        Assertions.assertEquals("IT", exported.get("category").asText());
        Assertions.assertEquals(2, exported.get("tags").size());
        Assertions.assertEquals("2024-05-01T12:05:00Z", exported.get("exported_at").asText());
        Assertions.assertEquals("1.0", exported.get("version").asText());
        Assertions.assertEquals(3, exported.get("definition").get("steps").size());
    }

    @Test
    public void importNormalizesTheDefinition() {
        WorkflowMetadata metadata = new WorkflowMetadata("Laptop request", null, null, List.of());
        ImportedWorkflow imported = codec.importDocument(codec.export(metadata, forkWithUntaggedBranch()));

        Assertions.assertEquals("Laptop request", imported.getMetadata().getName());
        WorkflowDefinition definition = imported.getDefinition();
        Assertions.assertEquals("fork", definition.getStartStepId());
        Assertions.assertEquals("b", definition.requireStep("task").getBranchId());
        Assertions.assertEquals("fork", definition.requireStep("task").getParentForkStepId());
    }

    @Test
    public void importIgnoresUnknownProperties() {
        String json = "{\"name\":\"Minimal\",\"exported_by\":\"someone\",\"version\":\"2.0\","
                      + "\"definition\":{\"steps\":[{\"step_id\":\"s1\",\"step_type\":\"NOTIFY_STEP\","
                      + "\"is_terminal\":true}],\"transitions\":[]}}";
        ImportedWorkflow imported = codec.importDocument(json);
        Assertions.assertEquals("Minimal", imported.getMetadata().getName());
        Assertions.assertEquals("s1", imported.getDefinition().getStartStepId());
    }

    @Test
    public void importRejectsFilesWithoutADefinition() {
        Assertions.assertThrows(WorkflowDocumentException.class, () -> codec.importDocument("{\"name\":\"x\"}"));
        Assertions.assertThrows(WorkflowDocumentException.class,
                                () -> codec.importDocument("{\"name\":\"x\",\"definition\":null}"));
        Assertions.assertThrows(WorkflowDocumentException.class, () -> codec.importDocument("{broken"));
    }
}
