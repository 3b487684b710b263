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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.UnaryOperator;

import com.ticketflow.studio.validation.BranchJoinRepairer;
import com.ticketflow.studio.validation.StructuralValidator;
import com.ticketflow.studio.validation.ValidationResult;
import com.ticketflow.wf.model.WorkflowDefinition;
import com.ticketflow.wf.store.WorkflowDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The working copy of one workflow in the designer.
 *
 * Edits are applied as functions from one definition to the next; the structural validation result is refreshed
 * after every edit. A session belongs to a single editing user and is not thread-safe.
 */
public class EditorSession {

    private static final Logger log = LoggerFactory.getLogger(EditorSession.class);

    private final String workflowId;
    private final LoadSource loadSource;
    private final WorkflowDocumentStore store;
    private final StructuralValidator validator;
    private final BranchJoinRepairer repairer;
    private final int undoHistoryLimit;
    private final boolean autoRepairBranchJoins;

    private final Deque<WorkflowDefinition> undoStack = new ArrayDeque<>();
    private final Deque<WorkflowDefinition> redoStack = new ArrayDeque<>();

    private WorkflowDefinition current;
    private ValidationResult validation;
    private boolean dirty;

    EditorSession(String workflowId, LoadSource loadSource, WorkflowDefinition initial, boolean dirty,
                  WorkflowDocumentStore store, StructuralValidator validator, BranchJoinRepairer repairer,
                  int undoHistoryLimit, boolean autoRepairBranchJoins) {
        this.workflowId = workflowId;
        this.loadSource = loadSource;
        this.store = store;
        this.validator = validator;
        this.repairer = repairer;
        this.undoHistoryLimit = undoHistoryLimit;
        this.autoRepairBranchJoins = autoRepairBranchJoins;
        this.dirty = dirty;
        replaceCurrent(initial);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public LoadSource getLoadSource() {
        return loadSource;
    }

    public WorkflowDefinition current() {
        return current;
    }

    public ValidationResult validation() {
        return validation;
    }

    /**
     * True when the working copy differs from what was last saved.
     */
    public boolean isDirty() {
        return dirty;
    }

    /**
     * Applies an edit. If the edit throws, the session is left exactly as it was and the exception propagates.
     * An edit that returns the same instance is not recorded.
     *
     * @return The new working copy.
     */
    public WorkflowDefinition apply(UnaryOperator<WorkflowDefinition> edit) {
        WorkflowDefinition next = edit.apply(current);
        if (next == null) {
            throw new IllegalStateException("An edit of workflow " + workflowId + " produced no definition.");
        }
        if (next == current) {
            return current;
        }
        remember(undoStack, current);
        redoStack.clear();
        replaceCurrent(next);
        dirty = true;
        return current;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    /**
     * @return false if there was nothing to undo.
     */
    public boolean undo() {
        if (undoStack.isEmpty()) {
            return false;
        }
        remember(redoStack, current);
        replaceCurrent(undoStack.pop());
        dirty = true;
        return true;
    }

    /**
     * @return false if there was nothing to redo.
     */
    public boolean redo() {
        if (redoStack.isEmpty()) {
            return false;
        }
        remember(undoStack, current);
        replaceCurrent(redoStack.pop());
        dirty = true;
        return true;
    }

    /**
     * Hands the working copy to the store, first connecting dangling branch ends to their joins if configured to.
     */
    public void save() {
        WorkflowDefinition toSave = (autoRepairBranchJoins ? repairer.repair(current) : current);
        store.saveDraft(workflowId, toSave);
        if (toSave != current) {
            replaceCurrent(toSave);
        }
        dirty = false;
        log.info("Saved draft of workflow {} ({} steps, valid={}).", workflowId, current.getSteps().size(),
                 validation.isValid());
    }

    private void replaceCurrent(WorkflowDefinition definition) {
        this.current = definition;
        this.validation = validator.validate(definition);
    }

    private void remember(Deque<WorkflowDefinition> stack, WorkflowDefinition definition) {
        if (undoHistoryLimit == 0) {
            return;
        }
        stack.push(definition);
        while (stack.size() > undoHistoryLimit) {
            stack.removeLast();
        }
    }
}
