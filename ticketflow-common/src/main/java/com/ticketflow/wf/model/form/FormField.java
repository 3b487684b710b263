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

package com.ticketflow.wf.model.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A field on a form or task step.
 */
public final class FormField {

    private final String fieldKey;
    private final String fieldLabel;
    private final FieldType fieldType;
    private final boolean required;
    private final List<String> options;
    private final DateValidation dateValidation;
    private final int order;
    private final String sectionId;
    private final List<ConditionalRequirement> conditionalRequirements;

    private FormField(Builder builder) {
        if (builder.fieldKey == null || builder.fieldKey.isEmpty()) {
            throw new IllegalArgumentException("fieldKey may not be blank.");
        }
        this.fieldKey = builder.fieldKey;
        this.fieldLabel = builder.fieldLabel;
        this.fieldType = (builder.fieldType == null ? FieldType.TEXT : builder.fieldType);
        this.required = builder.required;
        this.options = Collections.unmodifiableList(new ArrayList<>(builder.options));
        this.dateValidation = builder.dateValidation;
        this.order = builder.order;
        this.sectionId = builder.sectionId;
        this.conditionalRequirements = Collections.unmodifiableList(new ArrayList<>(builder.conditionalRequirements));
    }

    public static Builder builder(String fieldKey, FieldType fieldType) {
        return new Builder().fieldKey(fieldKey).fieldType(fieldType);
    }

    public Builder toBuilder() {
        return new Builder().fieldKey(fieldKey).fieldLabel(fieldLabel).fieldType(fieldType).required(required)
                            .options(options).dateValidation(dateValidation).order(order).sectionId(sectionId)
                            .conditionalRequirements(conditionalRequirements);
    }

    public String getFieldKey() {
        return fieldKey;
    }

    public String getFieldLabel() {
        return fieldLabel;
    }

    public FieldType getFieldType() {
        return fieldType;
    }

    /**
     * The static required flag; conditional rules may override it.
     */
    public boolean isRequired() {
        return required;
    }

    public List<String> getOptions() {
        return options;
    }

    /**
     * The static date validation settings, or null if none were configured.
     */
    public DateValidation getDateValidation() {
        return dateValidation;
    }

    public int getOrder() {
        return order;
    }

    public String getSectionId() {
        return sectionId;
    }

    public List<ConditionalRequirement> getConditionalRequirements() {
        return conditionalRequirements;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        FormField that = (FormField) other;
        return required == that.required && order == that.order
               && fieldKey.equals(that.fieldKey)
               && Objects.equals(fieldLabel, that.fieldLabel)
               && fieldType == that.fieldType
               && options.equals(that.options)
               && Objects.equals(dateValidation, that.dateValidation)
               && Objects.equals(sectionId, that.sectionId)
               && conditionalRequirements.equals(that.conditionalRequirements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldKey, fieldLabel, fieldType, required, options, dateValidation, order, sectionId,
                            conditionalRequirements);
    }

    /**
     * Builder for FormField objects.
     */
    public static final class Builder {
        private String fieldKey;
        private String fieldLabel;
        private FieldType fieldType;
        private boolean required;
        private List<String> options = Collections.emptyList();
        private DateValidation dateValidation;
        private int order;
        private String sectionId;
        private List<ConditionalRequirement> conditionalRequirements = Collections.emptyList();

        private Builder() {
        }

        public Builder fieldKey(String fieldKey) {
            this.fieldKey = fieldKey;
            return this;
        }

        public Builder fieldLabel(String fieldLabel) {
            this.fieldLabel = fieldLabel;
            return this;
        }

        public Builder fieldType(FieldType fieldType) {
            this.fieldType = fieldType;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder options(List<String> options) {
            this.options = (options == null ? Collections.emptyList() : options);
            return this;
        }

        public Builder dateValidation(DateValidation dateValidation) {
            this.dateValidation = dateValidation;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder sectionId(String sectionId) {
            this.sectionId = sectionId;
            return this;
        }

        public Builder conditionalRequirements(List<ConditionalRequirement> conditionalRequirements) {
            this.conditionalRequirements = (conditionalRequirements == null
                                            ? Collections.emptyList() : conditionalRequirements);
            return this;
        }

        public FormField build() {
            return new FormField(this);
        }
    }
}
