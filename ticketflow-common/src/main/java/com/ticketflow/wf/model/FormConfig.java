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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.ticketflow.wf.model.form.FormField;

public final class FormConfig implements StepConfig {

    private final List<FormField> fields;

    public FormConfig(List<FormField> fields) {
        this.fields = (fields == null ? Collections.emptyList() : List.copyOf(fields));
    }

    @Override
    public StepType getStepType() {
        return StepType.FORM;
    }

    public List<FormField> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof FormConfig && fields.equals(((FormConfig) other).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }
}
