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

import com.ticketflow.wf.model.WorkflowDefinition;

/**
 * The result of reading an export file: catalog attributes plus a definition that is ready to edit.
 */
public final class ImportedWorkflow {

    private final WorkflowMetadata metadata;
    private final WorkflowDefinition definition;

    public ImportedWorkflow(WorkflowMetadata metadata, WorkflowDefinition definition) {
        this.metadata = metadata;
        this.definition = definition;
    }

    public WorkflowMetadata getMetadata() {
        return metadata;
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }
}
