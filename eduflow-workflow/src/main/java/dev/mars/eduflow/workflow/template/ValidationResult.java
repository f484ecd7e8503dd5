/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.eduflow.workflow.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of validating a workflow template: fatal errors and non-fatal warnings,
 * each tagged with the field path of the rule it violates.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
        this.warnings = new ArrayList<>(warnings != null ? warnings : List.of());
    }

    public void addError(String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, message));
    }

    public void addError(String fieldPath, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, fieldPath, message));
    }

    public void addWarning(String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, message));
    }

    public void addWarning(String fieldPath, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, fieldPath, message));
    }

    /**
     * Appends the issues of another result to this one.
     */
    public void merge(ValidationResult other) {
        if (other != null) {
            errors.addAll(other.errors);
            warnings.addAll(other.warnings);
        }
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public List<String> getErrorMessages() {
        return errors.stream().map(ValidationIssue::toString).collect(Collectors.toList());
    }

    public List<String> getWarningMessages() {
        return warnings.stream().map(ValidationIssue::toString).collect(Collectors.toList());
    }

    /**
     * True when some error was recorded against exactly this field path.
     */
    public boolean hasErrorAt(String fieldPath) {
        return errors.stream().anyMatch(issue -> Objects.equals(fieldPath, issue.getFieldPath()));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * Represents a single validation issue (error or warning).
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String fieldPath;
        private final String message;

        public ValidationIssue(Severity severity, String message) {
            this(severity, null, message);
        }

        public ValidationIssue(Severity severity, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   Objects.equals(fieldPath, that.fieldPath) &&
                   Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, fieldPath, message);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            if (fieldPath != null) {
                sb.append("[").append(fieldPath).append("] ");
            }
            sb.append(message);
            return sb.toString();
        }
    }
}
