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

package com.ticketflow.wf.graph;

/**
 * Indicates that an operation named a step, transition or branch id that does not exist in the definition.
 */
public class GraphReferenceException extends WorkflowGraphException {

    /**
     * Creates a GraphReferenceException.
     * @param message The message to include in the exception.
     */
    public GraphReferenceException(String message) {
        super(message);
    }

    /**
     * Creates a GraphReferenceException.
     * @param message The message to include in the exception.
     * @param cause   The cause of the exception.
     */
    public GraphReferenceException(String message, Throwable cause) {
        super(message, cause);
    }

}
