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

public enum FieldType {
    TEXT,
    TEXTAREA,
    NUMBER,
    DATE,
    SELECT,
    MULTISELECT,
    CHECKBOX,
    FILE,
    USER_SELECT,
    LOOKUP_USER_SELECT;

    /**
     * Returns null if the name is not recognized.
     */
    public static FieldType fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (FieldType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return null;
    }
}
