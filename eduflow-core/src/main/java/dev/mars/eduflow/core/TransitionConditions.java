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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed view over the free-form {@code conditions} map attached to a transition.
 *
 * <p>The engine evaluates two kinds of precondition:</p>
 * <ul>
 *   <li><strong>Comment requirements</strong> - {@code require_comments} and the
 *       feedback-style flags ({@code require_feedback}, {@code require_detailed_feedback},
 *       {@code require_archive_reason}) are all satisfied by a non-blank comment.</li>
 *   <li><strong>Content length</strong> - {@code min_content_length} is checked against
 *       the length reported by the content store.</li>
 * </ul>
 *
 * <p>Any other key (for example {@code min_peer_reviews}) is kept for presentation
 * but cannot be evaluated by the engine; it is reported by {@link #getUnsupportedKeys()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransitionConditions {

    public static final String REQUIRE_COMMENTS = "require_comments";
    public static final String REQUIRE_FEEDBACK = "require_feedback";
    public static final String REQUIRE_DETAILED_FEEDBACK = "require_detailed_feedback";
    public static final String REQUIRE_ARCHIVE_REASON = "require_archive_reason";
    public static final String MIN_CONTENT_LENGTH = "min_content_length";

    private static final Set<String> COMMENT_KEYS = Set.of(
            REQUIRE_COMMENTS, REQUIRE_FEEDBACK, REQUIRE_DETAILED_FEEDBACK, REQUIRE_ARCHIVE_REASON);

    private static final TransitionConditions NONE = new TransitionConditions(Map.of());

    private final Map<String, Object> values;

    public TransitionConditions(Map<String, Object> values) {
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static TransitionConditions none() {
        return NONE;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns the first enabled comment-style key, if any.
     */
    public Optional<String> getCommentRequirement() {
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (COMMENT_KEYS.contains(entry.getKey()) && isTruthy(entry.getValue())) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public boolean isCommentsRequired() {
        return getCommentRequirement().isPresent();
    }

    public Optional<Integer> getMinContentLength() {
        Object value = values.get(MIN_CONTENT_LENGTH);
        if (value instanceof Number) {
            return Optional.of(((Number) value).intValue());
        }
        if (value instanceof String) {
            try {
                return Optional.of(Integer.parseInt(((String) value).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Set<String> getUnsupportedKeys() {
        Set<String> unsupported = new LinkedHashSet<>();
        for (String key : values.keySet()) {
            if (!COMMENT_KEYS.contains(key) && !MIN_CONTENT_LENGTH.equals(key)) {
                unsupported.add(key);
            }
        }
        return unsupported;
    }

    private static boolean isTruthy(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((TransitionConditions) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "TransitionConditions" + values;
    }
}
