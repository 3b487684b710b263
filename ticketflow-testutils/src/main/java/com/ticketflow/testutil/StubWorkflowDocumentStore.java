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

package com.ticketflow.testutil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.ticketflow.wf.model.WorkflowDefinition;
import com.ticketflow.wf.store.WorkflowDocumentStore;

/**
 * An in-memory WorkflowDocumentStore intended to be used by unit tests.
 * Every save is recorded so tests can verify what was persisted and when.
 */
public class StubWorkflowDocumentStore implements WorkflowDocumentStore {

    private final Map<String, WorkflowDefinition> drafts;
    private final Map<String, List<WorkflowDefinition>> saveHistory;

    public StubWorkflowDocumentStore() {
        this.drafts = new HashMap<>();
        this.saveHistory = new HashMap<>();
    }

    /**
     * Seeds the store without recording a save.
     */
    public void put(String workflowId, WorkflowDefinition definition) {
        drafts.put(workflowId, definition);
    }

    @Override
    public Optional<WorkflowDefinition> load(String workflowId) {
        return Optional.ofNullable(drafts.get(workflowId));
    }

    @Override
    public void saveDraft(String workflowId, WorkflowDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition may not be null.");
        }
        drafts.put(workflowId, definition);
        saveHistory.computeIfAbsent(workflowId, k -> new ArrayList<>()).add(definition);
    }

    public List<WorkflowDefinition> getSaves(String workflowId) {
        return Collections.unmodifiableList(saveHistory.getOrDefault(workflowId, Collections.emptyList()));
    }

    /**
     * Verifies that the workflow was saved exactly the expected number of times.
     */
    public void verifySaveCount(String workflowId, int expectedCount) {
        int actual = getSaves(workflowId).size();
        if (actual != expectedCount) {
            throw new RuntimeException("Expected " + expectedCount + " saves of workflow " + workflowId
                                       + " but found " + actual);
        }
    }

    /**
     * Verifies that the workflow was never saved.
     */
    public void verifyNoSaves(String workflowId) {
        verifySaveCount(workflowId, 0);
    }

    public void reset() {
        drafts.clear();
        saveHistory.clear();
    }
}
