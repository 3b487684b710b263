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

package com.ticketflow.wf.forms;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Inclusive lower and upper limits for a date input; either side may be open.
 */
public final class DateBounds {

    private final LocalDate minDate;
    private final LocalDate maxDate;

    public DateBounds(LocalDate minDate, LocalDate maxDate) {
        this.minDate = minDate;
        this.maxDate = maxDate;
    }

    public Optional<LocalDate> getMinDate() {
        return Optional.ofNullable(minDate);
    }

    public Optional<LocalDate> getMaxDate() {
        return Optional.ofNullable(maxDate);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        DateBounds that = (DateBounds) other;
        return Objects.equals(minDate, that.minDate) && Objects.equals(maxDate, that.maxDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minDate, maxDate);
    }

    @Override
    public String toString() {
        return "DateBounds[" + minDate + ", " + maxDate + "]";
    }
}
