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

/**
 * What happens to the other branches of a fork when one branch fails.
 */
public enum BranchFailurePolicy {
    FAIL_ALL, CONTINUE_OTHERS, CANCEL_OTHERS;

    /**
     * Returns null if the name is not recognized.
     */
    public static BranchFailurePolicy fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (BranchFailurePolicy value : values()) {
            if (value.name().equalsIgnoreCase(name)) {
                return value;
            }
        }
        return null;
    }
}
