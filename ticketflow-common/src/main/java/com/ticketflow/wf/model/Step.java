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

package com.ticketflow.wf.model;

import java.util.Objects;

/**
 * A node of a workflow definition.
 *
 * Steps are immutable; use {@link #toBuilder()} to derive a modified copy.
 */
public final class Step {

    private final String stepId;
    private final String stepName;
    private final String description;
    private final StepType stepType;
    private final int order;
    private final boolean start;
    private final boolean terminal;
    private final String branchId;
    private final String parentForkStepId;
    private final StepConfig config;

    private Step(Builder builder) {
        if (builder.stepId == null || builder.stepId.isEmpty()) {
            throw new IllegalArgumentException("stepId may not be blank.");
        }
        if (builder.stepType == null) {
            throw new IllegalArgumentException("stepType may not be null.");
        }
        StepConfig effectiveConfig = (builder.config == null ? StepConfigs.defaultFor(builder.stepType) : builder.config);
        if (effectiveConfig.getStepType() != builder.stepType) {
            throw new IllegalArgumentException("Step " + builder.stepId + " of type " + builder.stepType
                                               + " cannot carry " + effectiveConfig.getStepType() + " configuration.");
        }
        this.stepId = builder.stepId;
        this.stepName = builder.stepName;
        this.description = builder.description;
        this.stepType = builder.stepType;
        this.order = builder.order;
        this.start = builder.start;
        this.terminal = builder.terminal;
        this.branchId = emptyToNull(builder.branchId);
        this.parentForkStepId = emptyToNull(builder.parentForkStepId);
        this.config = effectiveConfig;
    }

    private static String emptyToNull(String value) {
        return (value == null || value.isEmpty() ? null : value);
    }

    public static Builder builder(String stepId, StepType stepType) {
        return new Builder().stepId(stepId).stepType(stepType);
    }

    public Builder toBuilder() {
        return new Builder().stepId(stepId).stepName(stepName).description(description).stepType(stepType)
                            .order(order).start(start).terminal(terminal).branchId(branchId)
                            .parentForkStepId(parentForkStepId).config(config);
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    public String getDescription() {
        return description;
    }

    public StepType getStepType() {
        return stepType;
    }

    public int getOrder() {
        return order;
    }

    public boolean isStart() {
        return start;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * The branch this step belongs to, or null if it is on the main line.
     */
    public String getBranchId() {
        return branchId;
    }

    public String getParentForkStepId() {
        return parentForkStepId;
    }

    public boolean isInBranch() {
        return branchId != null;
    }

    public StepConfig getConfig() {
        return config;
    }

    /**
     * Returns the configuration cast to the requested type.
     *
     * @throws IllegalStateException if this step's configuration is of a different type.
     */
    public <T extends StepConfig> T getConfig(Class<T> configType) {
        if (!configType.isInstance(config)) {
            throw new IllegalStateException("Step " + stepId + " is a " + stepType + " step, not "
                                            + configType.getSimpleName());
        }
        return configType.cast(config);
    }

    public Step withOrder(int newOrder) {
        return (newOrder == order ? this : toBuilder().order(newOrder).build());
    }

    public Step withStart(boolean newStart) {
        return (newStart == start ? this : toBuilder().start(newStart).build());
    }

    public Step withConfig(StepConfig newConfig) {
        return toBuilder().config(newConfig).build();
    }

    public Step withBranch(String newBranchId, String newParentForkStepId) {
        return toBuilder().branchId(newBranchId).parentForkStepId(newParentForkStepId).build();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Step that = (Step) other;
        return order == that.order && start == that.start && terminal == that.terminal
               && stepId.equals(that.stepId)
               && Objects.equals(stepName, that.stepName)
               && Objects.equals(description, that.description)
               && stepType == that.stepType
               && Objects.equals(branchId, that.branchId)
               && Objects.equals(parentForkStepId, that.parentForkStepId)
               && config.equals(that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, stepName, description, stepType, order, start, terminal, branchId,
                            parentForkStepId, config);
    }

    @Override
    public String toString() {
        return stepType + ":" + stepId;
    }

    /**
     * Builder for Step objects. A step built without a configuration gets the default for its type.
     */
    public static final class Builder {
        private String stepId;
        private String stepName;
        private String description;
        private StepType stepType;
        private int order;
        private boolean start;
        private boolean terminal;
        private String branchId;
        private String parentForkStepId;
        private StepConfig config;

        private Builder() {
        }

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder stepName(String stepName) {
            this.stepName = stepName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder stepType(StepType stepType) {
            this.stepType = stepType;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder start(boolean start) {
            this.start = start;
            return this;
        }

        public Builder terminal(boolean terminal) {
            this.terminal = terminal;
            return this;
        }

        public Builder branchId(String branchId) {
            this.branchId = branchId;
            return this;
        }

        public Builder parentForkStepId(String parentForkStepId) {
            this.parentForkStepId = parentForkStepId;
            return this;
        }

        public Builder config(StepConfig config) {
            this.config = config;
            return this;
        }

        public Step build() {
            return new Step(this);
        }
    }
}
