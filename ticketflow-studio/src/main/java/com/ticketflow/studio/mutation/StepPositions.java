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

package com.ticketflow.studio.mutation;

import java.util.ArrayList;
import java.util.List;

import com.ticketflow.wf.model.Step;

/**
 * Helpers for keeping each step's order equal to its position in the step list.
 */
final class StepPositions {

    private StepPositions() {}

    static List<Step> renumber(List<Step> steps) {
        List<Step> renumbered = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            renumbered.add(steps.get(i).withOrder(i));
        }
        return renumbered;
    }

    static List<Step> replace(List<Step> steps, Step replacement) {
        List<Step> updated = new ArrayList<>(steps.size());
        for (Step step : steps) {
            updated.add(step.getStepId().equals(replacement.getStepId()) ? replacement : step);
        }
        return updated;
    }
}
