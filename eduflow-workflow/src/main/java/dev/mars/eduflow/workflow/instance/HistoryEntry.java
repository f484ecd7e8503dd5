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

package dev.mars.eduflow.workflow.instance;

import dev.mars.eduflow.core.Role;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One executed transition in an instance's history.
 */
public final class HistoryEntry {

    private final Instant timestamp;
    private final String fromState;
    private final String toState;
    private final String transitionId;
    private final String userId;
    private final Role role;
    private final String comments;

    public HistoryEntry(Instant timestamp, String fromState, String toState, String transitionId,
                        String userId, Role role, String comments) {
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.fromState = Objects.requireNonNull(fromState, "From state cannot be null");
        this.toState = Objects.requireNonNull(toState, "To state cannot be null");
        this.transitionId = Objects.requireNonNull(transitionId, "Transition id cannot be null");
        this.userId = Objects.requireNonNull(userId, "User id cannot be null");
        this.role = role;
        this.comments = comments;
    }

    public Instant getTimestamp() { return timestamp; }
    public String getFromState() { return fromState; }
    public String getToState() { return toState; }
    public String getTransitionId() { return transitionId; }
    public String getUserId() { return userId; }
    public Role getRole() { return role; }
    public Optional<String> getComments() { return Optional.ofNullable(comments); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HistoryEntry that = (HistoryEntry) o;
        return Objects.equals(timestamp, that.timestamp) &&
               Objects.equals(fromState, that.fromState) &&
               Objects.equals(toState, that.toState) &&
               Objects.equals(transitionId, that.transitionId) &&
               Objects.equals(userId, that.userId) &&
               role == that.role &&
               Objects.equals(comments, that.comments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, fromState, toState, transitionId, userId, role, comments);
    }

    @Override
    public String toString() {
        return "HistoryEntry{" +
               transitionId + ": " + fromState + " -> " + toState +
               ", user='" + userId + '\'' +
               ", at=" + timestamp +
               '}';
    }
}
