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

package com.ticketflow.studio.session;

import com.ticketflow.wf.model.WorkflowDefinition;

/**
 * Optionally replaces the stored draft when an editor session is opened.
 */
public final class DefinitionOverride {

    private static final DefinitionOverride NONE = new DefinitionOverride(LoadSource.NORMAL, null);

    private final LoadSource source;
    private final WorkflowDefinition definition;

    private DefinitionOverride(LoadSource source, WorkflowDefinition definition) {
        this.source = source;
        this.definition = definition;
    }

    /**
     * Open the stored draft.
     */
    public static DefinitionOverride none() {
        return NONE;
    }

    public static DefinitionOverride imported(WorkflowDefinition definition) {
        return new DefinitionOverride(LoadSource.IMPORTED, requireDefinition(definition));
    }

    public static DefinitionOverride restored(WorkflowDefinition definition) {
        return new DefinitionOverride(LoadSource.RESTORED, requireDefinition(definition));
    }

    private static WorkflowDefinition requireDefinition(WorkflowDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition may not be null.");
        }
        return definition;
    }

    public LoadSource getSource() {
        return source;
    }

    /**
     * Null for {@link #none()}.
     */
    public WorkflowDefinition getDefinition() {
        return definition;
    }
}
