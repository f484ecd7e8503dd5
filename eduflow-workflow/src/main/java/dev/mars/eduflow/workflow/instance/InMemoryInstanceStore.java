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

import dev.mars.eduflow.core.exceptions.ConflictException;
import dev.mars.eduflow.core.exceptions.WorkflowException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * In-memory instance store: a concurrent map of immutable snapshots plus one
 * fair {@link ReentrantLock} per content uid for writers.
 *
 * <p>A lock lives only while some thread holds or waits for it; the last
 * thread out evicts it. A thread that acquires a lock which was evicted in the
 * meantime releases it and retries with the current one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryInstanceStore implements InstanceStore {

    private static final Logger logger = Logger.getLogger(InMemoryInstanceStore.class.getName());

    private final Map<String, WorkflowInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<WorkflowInstance> get(String contentUid) {
        return Optional.ofNullable(instances.get(contentUid));
    }

    @Override
    public <T> T withExclusiveAccess(String contentUid, Duration timeout, ExclusiveAction<T> action)
            throws WorkflowException, InterruptedException {
        Objects.requireNonNull(contentUid, "Content uid cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(contentUid, k -> new ReentrantLock(true));
            long remaining = Math.max(0L, deadline - System.nanoTime());
            if (!lock.tryLock(remaining, TimeUnit.NANOSECONDS)) {
                logger.warning("Timed out after " + timeout.toMillis() + "ms waiting for content " + contentUid);
                throw new ConflictException(contentUid,
                        "Another operation is in progress for content '" + contentUid + "'");
            }
            if (locks.get(contentUid) != lock) {
                // evicted between lookup and acquisition
                lock.unlock();
                continue;
            }
            try {
                return action.execute();
            } finally {
                lock.unlock();
                evictIfIdle(contentUid, lock);
            }
        }
    }

    @Override
    public void put(WorkflowInstance instance) {
        requireExclusiveAccess(instance.getContentUid());
        instances.put(instance.getContentUid(), instance);
        logger.fine("Stored instance " + instance);
    }

    @Override
    public Optional<WorkflowInstance> remove(String contentUid) {
        requireExclusiveAccess(contentUid);
        return Optional.ofNullable(instances.remove(contentUid));
    }

    @Override
    public Set<String> contentUids() {
        return Set.copyOf(instances.keySet());
    }

    @Override
    public int size() {
        return instances.size();
    }

    int lockCount() {
        return locks.size();
    }

    private void evictIfIdle(String contentUid, ReentrantLock lock) {
        locks.computeIfPresent(contentUid, (key, current) ->
                current == lock && !current.isLocked() && !current.hasQueuedThreads() ? null : current);
    }

    private void requireExclusiveAccess(String contentUid) {
        ReentrantLock lock = locks.get(contentUid);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Content '" + contentUid + "' must be modified inside its exclusive section");
        }
    }
}
