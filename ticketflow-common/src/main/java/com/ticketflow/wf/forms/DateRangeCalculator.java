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

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

import com.ticketflow.wf.model.form.DateValidation;

/**
 * Turns date validation settings into concrete bounds relative to today, and checks entered dates against them.
 */
public class DateRangeCalculator {

    private final Clock clock;
    private final ZoneId zone;

    public DateRangeCalculator(Clock clock, ZoneId zone) {
        if (clock == null) {
            throw new IllegalArgumentException("clock may not be null.");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone may not be null.");
        }
        this.clock = clock;
        this.zone = zone;
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zone);
    }

    public DateBounds bounds(DateValidation settings) {
        DateValidation effective = (settings == null ? DateValidation.ALLOW_ALL : settings);
        LocalDate today = today();
        LocalDate min = null;
        LocalDate max = null;
        if (!effective.isAllowPastDates()) {
            min = effective.isAllowToday() ? today : today.plusDays(1);
        }
        if (!effective.isAllowFutureDates()) {
            max = effective.isAllowToday() ? today : today.minusDays(1);
        }
        return new DateBounds(min, max);
    }

    /**
     * Checks a date against the settings.
     *
     * @return A message suitable for showing next to the field, or empty if the date is acceptable.
     */
    public Optional<String> check(LocalDate date, DateValidation settings) {
        if (date == null) {
            return Optional.empty();
        }
        DateValidation effective = (settings == null ? DateValidation.ALLOW_ALL : settings);
        LocalDate today = today();
        if (date.isBefore(today) && !effective.isAllowPastDates()) {
            return Optional.of("Past dates are not allowed");
        }
        if (date.isEqual(today) && !effective.isAllowToday()) {
            return Optional.of("Today's date is not allowed");
        }
        if (date.isAfter(today) && !effective.isAllowFutureDates()) {
            return Optional.of("Future dates are not allowed");
        }
        return Optional.empty();
    }
}
