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

import java.time.Clock;
import java.time.Instant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ticketflow.studio.migration.BranchMigrator;
import com.ticketflow.wf.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes workflow export files.
 *
 * Imported definitions are normalized before they are handed out: a missing start step defaults to the first step,
 * and branch membership is backfilled by the {@link BranchMigrator}.
 */
public class WorkflowTransferCodec {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTransferCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Clock clock;
    private final WorkflowDefinitionCodec definitionCodec;
    private final BranchMigrator migrator;

    public WorkflowTransferCodec(Clock clock, WorkflowDefinitionCodec definitionCodec, BranchMigrator migrator) {
        this.clock = clock;
        this.definitionCodec = definitionCodec;
        this.migrator = migrator;
    }

    public String export(WorkflowMetadata metadata, WorkflowDefinition definition) {
        WorkflowExportDocument document = new WorkflowExportDocument();
        document.setName(metadata.getName());
        document.setDescription(metadata.getDescription());
        document.setCategory(metadata.getCategory());
        document.setTags(metadata.getTags());
        document.setDefinition(definitionCodec.toJson(definition));
        document.setExportedAt(Instant.now(clock).toString());
        document.setVersion(WorkflowExportDocument.FORMAT_VERSION);
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new WorkflowDocumentException("Unable to serialize export of workflow " + metadata.getName(), e);
        }
    }

    /**
     * @throws WorkflowDocumentException if the file is not a usable workflow export.
     */
    public ImportedWorkflow importDocument(String json) {
        WorkflowExportDocument document;
        try {
            document = MAPPER.readValue(json, WorkflowExportDocument.class);
        } catch (JsonProcessingException e) {
            throw new WorkflowDocumentException("Workflow export file is not valid JSON", e);
        }
        if (document == null || document.getDefinition() == null || document.getDefinition().isNull()) {
            throw new WorkflowDocumentException("Workflow export file has no definition");
        }
        if (document.getVersion() != null && !WorkflowExportDocument.FORMAT_VERSION.equals(document.getVersion())) {
            log.warn("Importing workflow export with format version {}, expected {}.", document.getVersion(),
                     WorkflowExportDocument.FORMAT_VERSION);
        }

        WorkflowDefinition definition = definitionCodec.fromJson(document.getDefinition());
        if (definition.getStartStepId() == null && !definition.isEmpty()) {
            definition = definition.withStartStepId(definition.getSteps().get(0).getStepId());
        }
        definition = migrator.migrate(definition);

        log.info("Imported workflow '{}' with {} steps and {} transitions.", document.getName(),
                 definition.getSteps().size(), definition.getTransitions().size());
        WorkflowMetadata metadata = new WorkflowMetadata(document.getName(), document.getDescription(),
                                                         document.getCategory(), document.getTags());
        return new ImportedWorkflow(metadata, definition);
    }
}
