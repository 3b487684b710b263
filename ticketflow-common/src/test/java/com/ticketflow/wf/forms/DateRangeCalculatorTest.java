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
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import com.ticketflow.wf.model.form.DateValidation;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DateRangeCalculatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    private final DateRangeCalculator calculator =
            new DateRangeCalculator(Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC),
                                    ZoneOffset.UTC);

    @Test
    public void testAllowAllHasNoBounds() {
        Assertions.assertEquals(new DateBounds(null, null), calculator.bounds(DateValidation.ALLOW_ALL));
        Assertions.assertEquals(new DateBounds(null, null), calculator.bounds(null));
    }

    @Test
    public void testNoPastDates() {
        Assertions.assertEquals(new DateBounds(TODAY, null), calculator.bounds(new DateValidation(false, true, true)));
        Assertions.assertEquals(new DateBounds(TODAY.plusDays(1), null),
                                calculator.bounds(new DateValidation(false, false, true)));
    }

    @Test
    public void testNoFutureDates() {
        Assertions.assertEquals(new DateBounds(null, TODAY), calculator.bounds(new DateValidation(true, true, false)));
        Assertions.assertEquals(new DateBounds(null, TODAY.minusDays(1)),
                                calculator.bounds(new DateValidation(true, false, false)));
    }

    @Test
    public void testOnlyToday() {
        Assertions.assertEquals(new DateBounds(TODAY, TODAY), calculator.bounds(new DateValidation(false, true, false)));
    }

    @Test
    public void testTodayDependsOnZone() {
        DateRangeCalculator tokyo = new DateRangeCalculator(Clock.fixed(Instant.parse("2024-03-15T20:00:00Z"),
                                                                        ZoneOffset.UTC), ZoneId.of("Asia/Tokyo"));
        Assertions.assertEquals(LocalDate.of(2024, 3, 16), tokyo.today());
    }

    @Test
    public void testCheckMessages() {
        DateValidation futureOnly = new DateValidation(false, false, true);
        Assertions.assertEquals(Optional.of("Past dates are not allowed"),
                                calculator.check(TODAY.minusDays(3), futureOnly));
        Assertions.assertEquals(Optional.of("Today's date is not allowed"), calculator.check(TODAY, futureOnly));
        Assertions.assertEquals(Optional.empty(), calculator.check(TODAY.plusDays(1), futureOnly));
        Assertions.assertEquals(Optional.of("Future dates are not allowed"),
                                calculator.check(TODAY.plusDays(1), new DateValidation(true, true, false)));
    }

    @Test
    public void testConstructorRejectsNulls() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new DateRangeCalculator(null, ZoneOffset.UTC));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new DateRangeCalculator(Clock.systemUTC(), null));
    }
}
