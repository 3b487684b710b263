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

package com.ticketflow.studio.validation;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The findings of one validation run, split into errors and warnings.
 * A result is valid when it has no errors; warnings never block anything.
 */
public final class ValidationResult {

    private static final ValidationResult EMPTY = new ValidationResult(Collections.emptyList());

    private final List<ValidationFinding> errors;
    private final List<ValidationFinding> warnings;

    public ValidationResult(List<ValidationFinding> findings) {
        this.errors = findings.stream().filter(f -> f.getSeverity() == Severity.ERROR)
                              .collect(Collectors.toUnmodifiableList());
        this.warnings = findings.stream().filter(f -> f.getSeverity() == Severity.WARNING)
                                .collect(Collectors.toUnmodifiableList());
    }

    public static ValidationResult empty() {
        return EMPTY;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationFinding> getErrors() {
        return errors;
    }

    public List<ValidationFinding> getWarnings() {
        return warnings;
    }

    public boolean hasFinding(FindingType type) {
        return errors.stream().anyMatch(f -> f.getType() == type) || warnings.stream().anyMatch(f -> f.getType() == type);
    }

    public List<ValidationFinding> findingsOfType(FindingType type) {
        List<ValidationFinding> all = (type.getSeverity() == Severity.ERROR ? errors : warnings);
        return all.stream().filter(f -> f.getType() == type).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "ValidationResult{errors=" + errors + ", warnings=" + warnings + "}";
    }
}
