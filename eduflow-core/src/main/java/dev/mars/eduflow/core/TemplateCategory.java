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

package dev.mars.eduflow.core;

import java.util.Locale;

public enum TemplateCategory {
    EDUCATIONAL("educational"),
    CORPORATE("corporate"),
    RESEARCH("research");

    private final String value;

    TemplateCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TemplateCategory fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Category value cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TemplateCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown template category: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
