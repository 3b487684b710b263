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

package com.ticketflow.wf.conditions;

/**
 * How a list of condition results is combined.
 */
public enum ConditionLogic {
    AND,
    OR;

    /**
     * Anything other than "OR" (including null) means AND.
     */
    public static ConditionLogic fromWireName(String name) {
        if (name != null && OR.name().equalsIgnoreCase(name)) {
            return OR;
        }
        return AND;
    }
}
