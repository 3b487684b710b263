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

import java.util.Objects;

/**
 * Which dates, relative to today, a date field accepts.
 */
public final class DateValidation {

    public static final DateValidation ALLOW_ALL = new DateValidation(true, true, true);

    private final boolean allowPastDates;
    private final boolean allowToday;
    private final boolean allowFutureDates;

    public DateValidation(boolean allowPastDates, boolean allowToday, boolean allowFutureDates) {
        this.allowPastDates = allowPastDates;
        this.allowToday = allowToday;
        this.allowFutureDates = allowFutureDates;
    }

    public boolean isAllowPastDates() {
        return allowPastDates;
    }

    public boolean isAllowToday() {
        return allowToday;
    }

    public boolean isAllowFutureDates() {
        return allowFutureDates;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        DateValidation that = (DateValidation) other;
        return allowPastDates == that.allowPastDates
               && allowToday == that.allowToday
               && allowFutureDates == that.allowFutureDates;
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowPastDates, allowToday, allowFutureDates);
    }

    @Override
    public String toString() {
        return "DateValidation{past=" + allowPastDates + ", today=" + allowToday + ", future=" + allowFutureDates + "}";
    }
}
