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

package com.ticketflow.wf.store;

import java.util.Optional;

import com.ticketflow.wf.model.WorkflowDefinition;

/**
 * The persistence collaborator that owns stored workflow definitions.
 */
public interface WorkflowDocumentStore {

    /**
     * Returns the current draft of the workflow, or empty if nothing has been stored for it.
     */
    Optional<WorkflowDefinition> load(String workflowId);

    /**
     * Replaces the stored draft of the workflow.
     */
    void saveDraft(String workflowId, WorkflowDefinition definition);
}
