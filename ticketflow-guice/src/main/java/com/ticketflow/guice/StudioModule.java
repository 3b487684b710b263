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

package com.ticketflow.guice;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.ticketflow.studio.StudioConfig;
import com.ticketflow.studio.io.WorkflowDefinitionCodec;
import com.ticketflow.studio.io.WorkflowTransferCodec;
import com.ticketflow.studio.migration.BranchMigrator;
import com.ticketflow.studio.mutation.WorkflowGraphMutator;
import com.ticketflow.studio.session.EditorSessionFactory;
import com.ticketflow.studio.validation.BranchJoinRepairer;
import com.ticketflow.studio.validation.PublishValidator;
import com.ticketflow.studio.validation.StructuralValidator;
import com.ticketflow.wf.conditions.ConditionEvaluator;
import com.ticketflow.wf.forms.DateRangeCalculator;
import com.ticketflow.wf.forms.FieldRequirementResolver;
import com.ticketflow.wf.routing.TransitionResolver;
import com.ticketflow.wf.store.WorkflowDocumentStore;

/**
 * Usage: When setting up your Guice injection context,
 * create a StudioModule object and pass it to either Guice.createInjector()
 * or to install() while creating another Module.
 *
 * The injection context must provide a {@link WorkflowDocumentStore} binding.
 */
public class StudioModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(BranchMigrator.class).in(Singleton.class);
        bind(StructuralValidator.class).in(Singleton.class);
        bind(PublishValidator.class).in(Singleton.class);
        bind(BranchJoinRepairer.class).in(Singleton.class);
        bind(ConditionEvaluator.class).in(Singleton.class);
        bind(WorkflowDefinitionCodec.class).in(Singleton.class);
    }

    /**
     * Creates a StudioConfig from configuration in the Guice context.
     */
    @Provides
    @Singleton
    public StudioConfig getStudioConfig(StudioOptionalConfigHolder configHolder) {
        return createConfig(configHolder);
    }

    @VisibleForTesting
    static StudioConfig createConfig(StudioOptionalConfigHolder configHolder) {
        StudioConfig config = new StudioConfig();
        if (configHolder.getClock() != null) {
            config.setClock(configHolder.getClock());
        }
        if (configHolder.getZoneId() != null) {
            config.setZoneId(configHolder.getZoneId());
        }
        if (configHolder.getUndoHistoryLimit() != null) {
            config.setUndoHistoryLimit(configHolder.getUndoHistoryLimit());
        }
        if (configHolder.getAutoRepairBranchJoins() != null) {
            config.setAutoRepairBranchJoins(configHolder.getAutoRepairBranchJoins());
        }
        return config;
    }

    @Provides
    @Singleton
    public WorkflowGraphMutator getWorkflowGraphMutator(StudioConfig config) {
        return new WorkflowGraphMutator(config.getIdGenerator());
    }

    @Provides
    @Singleton
    public FieldRequirementResolver getFieldRequirementResolver(ConditionEvaluator evaluator) {
        return new FieldRequirementResolver(evaluator);
    }

    @Provides
    @Singleton
    public TransitionResolver getTransitionResolver(ConditionEvaluator evaluator) {
        return new TransitionResolver(evaluator);
    }

    @Provides
    @Singleton
    public DateRangeCalculator getDateRangeCalculator(StudioConfig config) {
        return new DateRangeCalculator(config.getClock(), config.getZoneId());
    }

    @Provides
    @Singleton
    public WorkflowTransferCodec getWorkflowTransferCodec(StudioConfig config, WorkflowDefinitionCodec codec,
                                                          BranchMigrator migrator) {
        return new WorkflowTransferCodec(config.getClock(), codec, migrator);
    }

    /**
     * Creates the factory used to open editor sessions against the bound document store.
     */
    @Provides
    @Singleton
    public EditorSessionFactory getEditorSessionFactory(WorkflowDocumentStore store, BranchMigrator migrator,
                                                        StructuralValidator validator, BranchJoinRepairer repairer,
                                                        StudioConfig config) {
        return new EditorSessionFactory(store, migrator, validator, repairer, config);
    }
}
