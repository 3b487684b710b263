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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The catalog attributes of a workflow that travel with it in an export file.
 */
public final class WorkflowMetadata {

    private final String name;
    private final String description;
    private final String category;
    private final List<String> tags;

    public WorkflowMetadata(String name, String description, String category, List<String> tags) {
        this.name = name;
        this.description = description;
        this.category = category;
        this.tags = (tags == null ? Collections.emptyList() : List.copyOf(tags));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        WorkflowMetadata that = (WorkflowMetadata) other;
        return Objects.equals(name, that.name) && Objects.equals(description, that.description)
               && Objects.equals(category, that.category) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, category, tags);
    }
}
