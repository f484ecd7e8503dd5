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

package dev.mars.eduflow.core.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A structured workflow failure: an {@link ErrorKind} plus a detail map holding
 * whatever the caller needs to correct the request (missing roles, expected and
 * actual state, available ids and so on).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowException extends EduflowException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public WorkflowException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    public WorkflowException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
