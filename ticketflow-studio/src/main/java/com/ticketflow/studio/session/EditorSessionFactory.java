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

import com.ticketflow.studio.StudioConfig;
import com.ticketflow.studio.migration.BranchMigrator;
import com.ticketflow.studio.validation.BranchJoinRepairer;
import com.ticketflow.studio.validation.StructuralValidator;
import com.ticketflow.wf.model.WorkflowDefinition;
import com.ticketflow.wf.store.WorkflowDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens editor sessions, either on the stored draft or on an explicitly supplied definition.
 *
 * Whatever the source, the definition gets a start step if it lacks one and its branch membership is backfilled
 * exactly once, before the session sees it. Imported definitions are saved straight away; restored ones are left
 * unsaved but marked dirty.
 */
public class EditorSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(EditorSessionFactory.class);

    private final WorkflowDocumentStore store;
    private final BranchMigrator migrator;
    private final StructuralValidator validator;
    private final BranchJoinRepairer repairer;
    private final StudioConfig config;

    public EditorSessionFactory(WorkflowDocumentStore store, BranchMigrator migrator, StructuralValidator validator,
                                BranchJoinRepairer repairer, StudioConfig config) {
        this.store = store;
        this.migrator = migrator;
        this.validator = validator;
        this.repairer = repairer;
        this.config = config;
    }

    public EditorSession open(String workflowId) {
        return open(workflowId, DefinitionOverride.none());
    }

    public EditorSession open(String workflowId, DefinitionOverride override) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId may not be null.");
        }
        LoadSource source = override.getSource();
        WorkflowDefinition loaded = (source == LoadSource.NORMAL
                                     ? store.load(workflowId).orElse(WorkflowDefinition.empty())
                                     : override.getDefinition());

        WorkflowDefinition normalized = loaded;
        if (normalized.getStartStepId() == null && !normalized.isEmpty()) {
            normalized = normalized.withStartStepId(normalized.getSteps().get(0).getStepId());
        }
        normalized = migrator.migrate(normalized);

        boolean dirty = (source != LoadSource.NORMAL || normalized != loaded);
        EditorSession session = new EditorSession(workflowId, source, normalized, dirty, store, validator, repairer,
                                                  config.getUndoHistoryLimit(), config.isAutoRepairBranchJoins());
        log.info("Opened workflow {} from {} with {} steps.", workflowId, source, normalized.getSteps().size());

        if (source == LoadSource.IMPORTED) {
            session.save();
        }
        return session;
    }
}
