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

package dev.mars.eduflow.workflow;

import dev.mars.eduflow.config.EduflowConfiguration;
import dev.mars.eduflow.core.Role;
import dev.mars.eduflow.core.TransitionConditions;
import dev.mars.eduflow.core.WorkflowState;
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.WorkflowTransition;
import dev.mars.eduflow.core.exceptions.CollaboratorException;
import dev.mars.eduflow.core.exceptions.ConditionNotMetException;
import dev.mars.eduflow.core.exceptions.ConflictException;
import dev.mars.eduflow.core.exceptions.InvalidTransitionException;
import dev.mars.eduflow.core.exceptions.PermissionDeniedException;
import dev.mars.eduflow.core.exceptions.RoleAssignmentException;
import dev.mars.eduflow.core.exceptions.StructuralValidationException;
import dev.mars.eduflow.core.exceptions.TemplateNotFoundException;
import dev.mars.eduflow.core.exceptions.TransitionNotFoundException;
import dev.mars.eduflow.core.exceptions.WorkflowException;
import dev.mars.eduflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.eduflow.workflow.audit.AuditChange;
import dev.mars.eduflow.workflow.audit.AuditEntry;
import dev.mars.eduflow.workflow.audit.AuditOperation;
import dev.mars.eduflow.workflow.audit.AuditRecorder;
import dev.mars.eduflow.workflow.audit.JsonLinesAuditSink;
import dev.mars.eduflow.workflow.audit.LoggingAuditSink;
import dev.mars.eduflow.workflow.instance.HistoryEntry;
import dev.mars.eduflow.workflow.instance.InMemoryInstanceStore;
import dev.mars.eduflow.workflow.instance.InstanceStore;
import dev.mars.eduflow.workflow.instance.WorkflowBackup;
import dev.mars.eduflow.workflow.instance.WorkflowInstance;
import dev.mars.eduflow.workflow.observability.WorkflowMetrics;
import dev.mars.eduflow.workflow.permission.PermissionEvaluator;
import dev.mars.eduflow.workflow.spi.AuditSink;
import dev.mars.eduflow.workflow.spi.ContentStore;
import dev.mars.eduflow.workflow.spi.NativeWorkflowSnapshot;
import dev.mars.eduflow.workflow.spi.Notifier;
import dev.mars.eduflow.workflow.spi.WorkflowEvent;
import dev.mars.eduflow.workflow.template.TemplateFilter;
import dev.mars.eduflow.workflow.template.TemplateParseException;
import dev.mars.eduflow.workflow.template.TemplateRegistry;
import dev.mars.eduflow.workflow.template.TemplateSummary;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Default implementation of WorkflowEngine over a template registry and an
 * instance store.
 *
 * <p>Each mutating operation runs inside the content item's exclusive section
 * of the {@link InstanceStore}. The new snapshot is committed before the audit
 * entry is recorded and before notifications are dispatched, so neither side
 * effect can undo a committed change. Notifications and bulk applications run
 * on the engine's own thread pool.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(DefaultWorkflowEngine.class.getName());

    static final String CONTENT_STORE = "content store";
    static final Set<Role> CRITICAL_ROLES = Collections.unmodifiableSet(EnumSet.of(Role.ADMINISTRATOR, Role.EDITOR));

    private final TemplateRegistry registry;
    private final InstanceStore store;
    private final ContentStore contentStore;
    private final Notifier notifier;
    private final AuditRecorder auditRecorder;
    private final WorkflowMetrics metrics;
    private final PermissionEvaluator permissions;
    private final ExecutorService executorService;

    private final Duration collaboratorTimeout;
    private final Duration lockTimeout;
    private final int bulkMaxConcurrent;
    private final boolean notificationsEnabled;
    private volatile boolean shutdown = false;

    public DefaultWorkflowEngine(TemplateRegistry registry, InstanceStore store, ContentStore contentStore,
                                 Notifier notifier, AuditSink auditSink, EduflowConfiguration configuration) {
        this(registry, store, contentStore, notifier, auditSink, configuration,
                configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : WorkflowMetrics.noop());
    }

    public DefaultWorkflowEngine(TemplateRegistry registry, InstanceStore store, ContentStore contentStore,
                                 Notifier notifier, AuditSink auditSink, EduflowConfiguration configuration,
                                 WorkflowMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "Template registry cannot be null");
        this.store = Objects.requireNonNull(store, "Instance store cannot be null");
        this.contentStore = Objects.requireNonNull(contentStore, "Content store cannot be null");
        this.notifier = Objects.requireNonNull(notifier, "Notifier cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");

        this.collaboratorTimeout = configuration.getCollaboratorTimeout();
        this.lockTimeout = configuration.getLockTimeout();
        this.bulkMaxConcurrent = configuration.getBulkMaxConcurrent();
        this.notificationsEnabled = configuration.isNotificationsEnabled();

        this.auditRecorder = new AuditRecorder(Objects.requireNonNull(auditSink, "Audit sink cannot be null"),
                configuration.getAuditRetainedEntries(), collaboratorTimeout, metrics);
        this.permissions = new PermissionEvaluator();
        this.executorService = Executors.newCachedThreadPool();
        this.metrics.setActiveInstances(store.size());

        logger.info("Workflow engine started with " + registry.size() + " templates, lock timeout "
                + lockTimeout.toMillis() + "ms, collaborator timeout " + collaboratorTimeout.toMillis() + "ms");
    }

    /**
     * Builds an engine entirely from configuration: the template registry, an
     * in-memory instance store and the audit sink ({@link JsonLinesAuditSink} when
     * {@code eduflow.audit.file} is set, otherwise {@link LoggingAuditSink}).
     */
    public static DefaultWorkflowEngine fromConfiguration(EduflowConfiguration configuration,
                                                          ContentStore contentStore, Notifier notifier)
            throws TemplateParseException, StructuralValidationException {
        TemplateRegistry registry = TemplateRegistry.fromConfiguration(configuration);
        AuditSink sink = configuration.getAuditFile()
                .<AuditSink>map(JsonLinesAuditSink::new)
                .orElseGet(LoggingAuditSink::new);
        return new DefaultWorkflowEngine(registry, new InMemoryInstanceStore(), contentStore, notifier, sink,
                configuration);
    }

    @Override
    public List<TemplateSummary> listTemplates(TemplateFilter filter) {
        return registry.listTemplates(filter);
    }

    @Override
    public WorkflowTemplate getTemplate(String templateId) throws TemplateNotFoundException {
        return registry.getTemplate(templateId);
    }

    public AuditRecorder getAuditRecorder() {
        return auditRecorder;
    }

    // ----------------------------------------------------------------------------------------
    // apply

    @Override
    public ApplyResult applyTemplate(ApplyTemplateRequest request) throws WorkflowException, InterruptedException {
        checkNotShutdown();
        AuditEntry.Builder audit = AuditEntry.builder()
                .operation(AuditOperation.APPLY_TEMPLATE)
                .userId(request.getActingUserId())
                .contentUid(request.getContentUid())
                .templateId(request.getTemplateId())
                .metadata("force", request.isForce())
                .metadata("backup_existing", request.isBackupExisting());

        try {
            WorkflowTemplate template = registry.getTemplate(request.getTemplateId());
            List<String> warnings = validateRoleAssignments(template, request.getRoleAssignments());

            Committed<ApplyResult> committed = store.withExclusiveAccess(request.getContentUid(), lockTimeout,
                    () -> recordCommitted(applyLocked(template, request, warnings, audit), audit));

            metrics.recordTemplateApplied(template.getId());
            metrics.setActiveInstances(store.size());
            logger.info("Applied template '" + template.getId() + "' to " + request.getContentUid()
                    + (committed.result.getReplacedTemplateId().isPresent()
                    ? " (replacing '" + committed.result.getReplacedTemplateId().get() + "')" : ""));
            dispatchNotification(committed.recipients, committed.event);
            return committed.result;
        } catch (WorkflowException e) {
            recordFailure(audit, e);
            throw e;
        } catch (InterruptedException e) {
            recordInterrupted(audit);
            throw e;
        }
    }

    private Committed<ApplyResult> applyLocked(WorkflowTemplate template, ApplyTemplateRequest request,
                                               List<String> warnings, AuditEntry.Builder audit)
            throws WorkflowException {
        String contentUid = request.getContentUid();
        WorkflowInstance existing = store.get(contentUid).orElse(null);
        if (existing != null && !request.isForce()) {
            throw new ConflictException(contentUid, existing.getTemplateId(), existing.getAppliedAt());
        }

        Instant now = Instant.now();
        WorkflowBackup backup = null;
        if (request.isBackupExisting()) {
            NativeWorkflowSnapshot nativeSnapshot = await(() -> contentStore.getNativeWorkflowState(contentUid),
                    CONTENT_STORE, "Reading native workflow state of " + contentUid);
            WorkflowBackup candidate = new WorkflowBackup(existing, nativeSnapshot, now);
            if (!candidate.isEmpty()) {
                backup = candidate;
                audit.change(AuditChange.of(AuditChange.BACKUP_CREATED,
                        "prior_template_id", existing != null ? existing.getTemplateId() : null,
                        "native_state", nativeSnapshot != null ? nativeSnapshot.getState() : null));
            }
        }

        String initialState = template.getInitialState()
                .map(WorkflowState::getId)
                .orElseThrow(() -> new IllegalStateException("Registered template '" + template.getId()
                        + "' has no initial state"));

        WorkflowInstance instance = WorkflowInstance.builder()
                .contentUid(contentUid)
                .templateId(template.getId())
                .templateVersion(template.getVersion())
                .currentState(initialState)
                .roleAssignments(request.getRoleAssignments())
                .backup(backup)
                .appliedBy(request.getActingUserId())
                .appliedAt(now)
                .build();
        store.put(instance);

        audit.change(AuditChange.of(AuditChange.TEMPLATE_APPLIED,
                "template_id", template.getId(),
                "initial_state", initialState,
                "replaced_template_id", existing != null ? existing.getTemplateId() : null));
        recordRoleChanges(existing, instance, audit);

        WorkflowEvent event = WorkflowEvent.builder()
                .type(WorkflowEvent.Type.TEMPLATE_APPLIED)
                .contentUid(contentUid)
                .templateId(template.getId())
                .toState(initialState)
                .actingUserId(request.getActingUserId())
                .timestamp(now)
                .build();
        ApplyResult result = new ApplyResult(instance, warnings, backup != null,
                existing != null ? existing.getTemplateId() : null);
        return new Committed<>(result, instance.getAllAssignedUsers(), event);
    }

    /**
     * Checks the role assignments against the template.
     *
     * @return warnings about unused assigned roles and unassigned critical roles
     * @throws RoleAssignmentException if a transition's required role has no users,
     *         or any assigned role has an empty user list
     */
    List<String> validateRoleAssignments(WorkflowTemplate template, Map<Role, List<String>> assignments)
            throws RoleAssignmentException {
        Set<Role> missing = EnumSet.noneOf(Role.class);
        for (Role required : template.getRequiredRoles()) {
            List<String> users = assignments.get(required);
            if (users == null || users.isEmpty()) {
                missing.add(required);
            }
        }

        List<String> errors = new ArrayList<>();
        if (!missing.isEmpty()) {
            errors.add("Missing user assignments for required roles: " + missing);
        }
        for (Map.Entry<Role, List<String>> entry : assignments.entrySet()) {
            List<String> users = entry.getValue();
            if (users.isEmpty()) {
                if (!missing.contains(entry.getKey())) {
                    errors.add("Role '" + entry.getKey() + "' has no users assigned");
                }
            } else if (users.stream().anyMatch(user -> user == null || user.isBlank())) {
                errors.add("Role '" + entry.getKey() + "' has a blank user id");
            }
        }
        if (!errors.isEmpty()) {
            throw new RoleAssignmentException(template.getId(), missing, errors);
        }

        List<String> warnings = new ArrayList<>();
        Set<Role> referenced = template.getReferencedRoles();
        for (Role assigned : assignments.keySet()) {
            if (!referenced.contains(assigned)) {
                warnings.add("Role '" + assigned + "' is not used by template '" + template.getId() + "'");
            }
        }
        for (Role critical : CRITICAL_ROLES) {
            if (referenced.contains(critical) && !assignments.containsKey(critical)) {
                warnings.add("Critical role '" + critical + "' has no assigned users");
            }
        }
        return warnings;
    }

    private void recordRoleChanges(WorkflowInstance previous, WorkflowInstance current, AuditEntry.Builder audit) {
        Map<Role, List<String>> before = previous != null ? previous.getRoleAssignments() : Map.of();
        Map<Role, List<String>> after = current.getRoleAssignments();
        for (Map.Entry<Role, List<String>> entry : after.entrySet()) {
            List<String> old = before.getOrDefault(entry.getKey(), List.of());
            for (String user : entry.getValue()) {
                if (!old.contains(user)) {
                    audit.change(AuditChange.of(AuditChange.ROLE_ADDED, "role", entry.getKey().getValue(), "user_id", user));
                }
            }
        }
        for (Map.Entry<Role, List<String>> entry : before.entrySet()) {
            List<String> kept = after.getOrDefault(entry.getKey(), List.of());
            for (String user : entry.getValue()) {
                if (!kept.contains(user)) {
                    audit.change(AuditChange.of(AuditChange.ROLE_REMOVED, "role", entry.getKey().getValue(), "user_id", user));
                }
            }
        }
    }

    // ----------------------------------------------------------------------------------------
    // transition

    @Override
    public TransitionResult executeTransition(TransitionRequest request) throws WorkflowException, InterruptedException {
        checkNotShutdown();
        long startTime = System.nanoTime();
        AuditEntry.Builder audit = AuditEntry.builder()
                .operation(AuditOperation.EXECUTE_TRANSITION)
                .userId(request.getActingUserId())
                .contentUid(request.getContentUid())
                .metadata("transition_id", request.getTransitionId())
                .metadata("acting_role", request.getActingRole().getValue());

        try {
            Committed<TransitionResult> committed = store.withExclusiveAccess(request.getContentUid(), lockTimeout,
                    () -> recordCommitted(transitionLocked(request, audit), audit));
            TransitionResult result = committed.result;

            metrics.recordTransition(result.getTemplateId(), request.getTransitionId(),
                    (System.nanoTime() - startTime) / 1_000_000_000.0);
            logger.info("Content " + result.getContentUid() + " moved " + result.getFromState() + " -> "
                    + result.getToState() + " via '" + request.getTransitionId() + "' by "
                    + request.getActingUserId() + " (" + request.getActingRole() + ")");
            dispatchNotification(committed.recipients, committed.event);
            return result;
        } catch (WorkflowException e) {
            metrics.recordTransitionFailed(request.getTransitionId(), e.getKind().getValue());
            recordFailure(audit, e);
            throw e;
        } catch (InterruptedException e) {
            recordInterrupted(audit);
            throw e;
        }
    }

    private Committed<TransitionResult> transitionLocked(TransitionRequest request, AuditEntry.Builder audit)
            throws WorkflowException {
        String contentUid = request.getContentUid();
        WorkflowInstance instance = store.get(contentUid)
                .orElseThrow(() -> new WorkflowNotFoundException(contentUid));
        audit.templateId(instance.getTemplateId());

        WorkflowTemplate template = registry.getTemplate(instance.getTemplateId());
        WorkflowTransition transition = template.getTransition(request.getTransitionId())
                .orElseThrow(() -> new TransitionNotFoundException(contentUid, template.getId(),
                        request.getTransitionId(), template.getTransitionIds()));

        String currentState = instance.getCurrentState();
        if (!transition.getFromState().equals(currentState)) {
            List<String> valid = permissions.transitionsFrom(template, currentState).stream()
                    .map(WorkflowTransition::getId)
                    .collect(Collectors.toList());
            throw new InvalidTransitionException(contentUid, transition.getId(), transition.getFromState(),
                    currentState, valid);
        }

        Role actingRole = request.getActingRole();
        if (!permissions.canExecute(template, currentState, actingRole, transition)) {
            throw new PermissionDeniedException(contentUid, transition.getId(), actingRole,
                    transition.getRequiredRole());
        }
        if (actingRole != transition.getRequiredRole()) {
            audit.metadata("administrative_override", true);
            logger.fine("Role " + actingRole + " executes '" + transition.getId() + "' on " + contentUid
                    + " through the administrative override");
        }

        checkConditions(contentUid, transition, request);

        HistoryEntry entry = new HistoryEntry(Instant.now(), currentState, transition.getToState(),
                transition.getId(), request.getActingUserId(), actingRole,
                request.hasComments() ? request.getComments() : null);
        WorkflowInstance updated = instance.withTransition(entry);
        store.put(updated);

        audit.change(AuditChange.of(AuditChange.STATE_CHANGE,
                "from_state", entry.getFromState(),
                "to_state", entry.getToState(),
                "transition_id", transition.getId()));

        List<WorkflowTransition> available = permissions.executableTransitions(template, updated.getCurrentState(),
                actingRole);
        TransitionResult result = new TransitionResult(contentUid, template.getId(), entry, available,
                updated.getVersion());

        WorkflowEvent event = WorkflowEvent.builder()
                .type(WorkflowEvent.Type.STATE_CHANGED)
                .contentUid(contentUid)
                .templateId(template.getId())
                .fromState(entry.getFromState())
                .toState(entry.getToState())
                .transitionId(transition.getId())
                .actingUserId(request.getActingUserId())
                .comments(entry.getComments().orElse(null))
                .timestamp(entry.getTimestamp())
                .build();
        return new Committed<>(result, notificationRecipients(template, updated), event);
    }

    private void checkConditions(String contentUid, WorkflowTransition transition, TransitionRequest request)
            throws WorkflowException {
        TransitionConditions conditions = transition.getConditions();

        if (conditions.getCommentRequirement().isPresent() && !request.hasComments()) {
            throw new ConditionNotMetException(contentUid, transition.getId(),
                    conditions.getCommentRequirement().get(), "Comments are required for this transition");
        }

        if (conditions.getMinContentLength().isPresent()) {
            int minimum = conditions.getMinContentLength().get();
            Integer length = await(() -> contentStore.getContentLength(contentUid), CONTENT_STORE,
                    "Reading content length of " + contentUid);
            if (length == null) {
                throw new CollaboratorException(CONTENT_STORE, "No content length returned for " + contentUid, null);
            }
            if (length < minimum) {
                throw new ConditionNotMetException(contentUid, transition.getId(),
                        TransitionConditions.MIN_CONTENT_LENGTH,
                        "Content must be at least " + minimum + " characters, found " + length);
            }
        }
    }

    /**
     * Users who can act next: those assigned to a role able to act in the new
     * state, or every assigned user when the new state is terminal.
     */
    private Set<String> notificationRecipients(WorkflowTemplate template, WorkflowInstance instance) {
        Set<Role> roles = permissions.rolesAbleToAct(template, instance.getCurrentState());
        return roles.isEmpty() ? instance.getAllAssignedUsers() : instance.getUsersForRoles(roles);
    }

    // ----------------------------------------------------------------------------------------
    // remove

    @Override
    public RemovalResult removeTemplate(String contentUid, boolean restoreBackup, String actingUserId)
            throws WorkflowException, InterruptedException {
        checkNotShutdown();
        Objects.requireNonNull(contentUid, "Content uid cannot be null");
        AuditEntry.Builder audit = AuditEntry.builder()
                .operation(AuditOperation.REMOVE_TEMPLATE)
                .userId(actingUserId)
                .contentUid(contentUid)
                .metadata("restore_backup", restoreBackup);

        try {
            Committed<RemovalResult> committed = store.withExclusiveAccess(contentUid, lockTimeout,
                    () -> recordCommitted(removeLocked(contentUid, restoreBackup, actingUserId, audit), audit));
            RemovalResult result = committed.result;

            metrics.recordTemplateRemoved(result.getRemovedTemplateId());
            metrics.setActiveInstances(store.size());
            logger.info("Removed template '" + result.getRemovedTemplateId() + "' from " + contentUid
                    + (result.isBackupRestored() ? " and restored its backup" : ""));
            dispatchNotification(committed.recipients, committed.event);
            return result;
        } catch (WorkflowException e) {
            recordFailure(audit, e);
            throw e;
        } catch (InterruptedException e) {
            recordInterrupted(audit);
            throw e;
        }
    }

    private Committed<RemovalResult> removeLocked(String contentUid, boolean restoreBackup, String actingUserId,
                                                  AuditEntry.Builder audit) throws WorkflowException {
        WorkflowInstance instance = store.get(contentUid)
                .orElseThrow(() -> new WorkflowNotFoundException(contentUid));
        audit.templateId(instance.getTemplateId());

        WorkflowBackup backup = instance.getBackup().orElse(null);
        boolean restoring = restoreBackup && backup != null;
        if (restoreBackup && backup == null) {
            logger.warning("No backup recorded for " + contentUid + "; removing without restore");
        }

        // The native restore must succeed before the instance is touched.
        if (restoring && backup.getNativeSnapshot().isPresent()) {
            NativeWorkflowSnapshot snapshot = backup.getNativeSnapshot().get();
            await(() -> contentStore.setNativeWorkflowState(contentUid, snapshot), CONTENT_STORE,
                    "Restoring native workflow state of " + contentUid);
        }

        WorkflowInstance restored = null;
        if (restoring && backup.getPriorInstance().isPresent()) {
            restored = backup.getPriorInstance().get().toBuilder()
                    .updatedAt(Instant.now())
                    .version(instance.getVersion() + 1)
                    .build();
            store.put(restored);
        } else {
            store.remove(contentUid);
        }

        audit.change(AuditChange.of(AuditChange.TEMPLATE_REMOVED,
                "template_id", instance.getTemplateId(),
                "final_state", instance.getCurrentState()));
        if (restoring) {
            audit.change(AuditChange.of(AuditChange.BACKUP_RESTORED,
                    "native_state", backup.getNativeSnapshot().map(NativeWorkflowSnapshot::getState).orElse(null),
                    "restored_template_id", restored != null ? restored.getTemplateId() : null));
        }

        WorkflowEvent event = WorkflowEvent.builder()
                .type(WorkflowEvent.Type.TEMPLATE_REMOVED)
                .contentUid(contentUid)
                .templateId(instance.getTemplateId())
                .fromState(instance.getCurrentState())
                .toState(restored != null ? restored.getCurrentState() : null)
                .actingUserId(actingUserId)
                .build();
        RemovalResult result = new RemovalResult(contentUid, instance.getTemplateId(), instance.getCurrentState(),
                restoring, restored);
        return new Committed<>(result, instance.getAllAssignedUsers(), event);
    }

    // ----------------------------------------------------------------------------------------
    // read

    @Override
    public WorkflowStateView getState(String contentUid, Role requestingRole) throws WorkflowException {
        WorkflowInstance instance = store.get(contentUid)
                .orElseThrow(() -> new WorkflowNotFoundException(contentUid));
        WorkflowTemplate template = registry.getTemplate(instance.getTemplateId());
        WorkflowState state = template.getState(instance.getCurrentState())
                .orElseThrow(() -> new IllegalStateException("Instance " + contentUid + " is in state '"
                        + instance.getCurrentState() + "' unknown to template '" + template.getId() + "'"));

        return new WorkflowStateView(instance, template, state, requestingRole,
                permissions.availableActions(template, state.getId(), requestingRole),
                permissions.executableTransitions(template, state.getId(), requestingRole));
    }

    // ----------------------------------------------------------------------------------------
    // bulk

    @Override
    public BulkApplyResult bulkApplyTemplate(String templateId, List<BulkApplyItem> items, String userId)
            throws TemplateNotFoundException {
        checkNotShutdown();
        try {
            registry.getTemplate(templateId);
        } catch (TemplateNotFoundException e) {
            recordFailure(AuditEntry.builder()
                    .operation(AuditOperation.APPLY_TEMPLATE)
                    .userId(userId)
                    .templateId(templateId)
                    .metadata("bulk", true)
                    .metadata("items", items.size()), e);
            throw e;
        }

        logger.info("Starting bulk application of '" + templateId + "' to " + items.size() + " items");
        Semaphore permits = new Semaphore(bulkMaxConcurrent);
        List<CompletableFuture<Object>> futures = new ArrayList<>(items.size());
        for (BulkApplyItem item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> applySingle(templateId, item, userId, permits),
                    executorService));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ApplyResult> successes = new ArrayList<>();
        List<BulkApplyResult.Failure> failures = new ArrayList<>();
        for (CompletableFuture<Object> future : futures) {
            Object outcome = future.join();
            if (outcome instanceof ApplyResult) {
                successes.add((ApplyResult) outcome);
            } else {
                failures.add((BulkApplyResult.Failure) outcome);
            }
        }

        BulkApplyResult result = new BulkApplyResult(templateId, userId, successes, failures, Instant.now());
        logger.info("Bulk application of '" + templateId + "' completed: " + successes.size() + "/"
                + items.size() + " successful");
        return result;
    }

    private Object applySingle(String templateId, BulkApplyItem item, String userId, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new BulkApplyResult.Failure(item.getContentUid(), null, "Interrupted before applying");
        }
        try {
            return applyTemplate(ApplyTemplateRequest.builder()
                    .templateId(templateId)
                    .contentUid(item.getContentUid())
                    .roleAssignments(item.getRoleAssignments())
                    .force(item.isForce())
                    .actingUserId(userId)
                    .build());
        } catch (WorkflowException e) {
            return new BulkApplyResult.Failure(item.getContentUid(), e.getKind(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new BulkApplyResult.Failure(item.getContentUid(), null, "Interrupted while applying");
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Bulk application to " + item.getContentUid() + " failed unexpectedly", e);
            return new BulkApplyResult.Failure(item.getContentUid(), null, e.toString());
        } finally {
            permits.release();
        }
    }

    @Override
    public void shutdown() {
        shutdown = true;
        executorService.shutdown();
        auditRecorder.shutdown();
        logger.info("Workflow engine shutdown initiated");
    }

    // ----------------------------------------------------------------------------------------
    // helpers

    private void checkNotShutdown() {
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shutdown");
        }
    }

    private <T> T await(Supplier<CompletableFuture<T>> call, String collaborator, String action)
            throws CollaboratorException {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            throw new CollaboratorException(collaborator, action + " failed: " + e, e);
        }
        if (future == null) {
            throw new CollaboratorException(collaborator, action + " returned no result", null);
        }
        try {
            return future.get(collaboratorTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorException(collaborator,
                    action + " timed out after " + collaboratorTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CollaboratorException(collaborator, action + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(collaborator, action + " was interrupted", e);
        }
    }

    private void dispatchNotification(Set<String> recipients, WorkflowEvent event) {
        if (!notificationsEnabled || recipients.isEmpty()) {
            return;
        }
        Set<String> userIds = Collections.unmodifiableSet(new LinkedHashSet<>(recipients));
        try {
            CompletableFuture.supplyAsync(() -> notifier.notify(userIds, event), executorService)
                    .thenCompose(delivery -> delivery != null ? delivery : CompletableFuture.<Void>completedFuture(null))
                    .orTimeout(collaboratorTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            logger.warning("Notification of " + event.getType() + " for " + event.getContentUid()
                                    + " failed: " + error);
                            logger.log(Level.FINE, "Notification failure detail", error);
                        } else {
                            logger.fine("Notified " + userIds.size() + " users of " + event);
                        }
                    });
        } catch (RejectedExecutionException e) {
            logger.warning("Notification of " + event.getType() + " for " + event.getContentUid()
                    + " dropped: engine is shutting down");
        }
    }

    /**
     * Journals the success entry while the content item is still locked, so
     * entries for one item appear in commit order.
     */
    private <R> Committed<R> recordCommitted(Committed<R> committed, AuditEntry.Builder audit) {
        auditRecorder.record(audit.success(true).build());
        return committed;
    }

    private void recordFailure(AuditEntry.Builder audit, WorkflowException e) {
        logger.fine("Operation failed [" + e.getKind() + "]: " + e.getMessage());
        auditRecorder.record(audit.success(false)
                .error(e.getMessage())
                .errorKind(e.getKind())
                .build());
    }

    private void recordInterrupted(AuditEntry.Builder audit) {
        auditRecorder.record(audit.success(false)
                .error("Interrupted while waiting for the content item")
                .build());
    }

    /**
     * A committed operation's result plus the notification it triggers.
     */
    private static final class Committed<R> {
        private final R result;
        private final Set<String> recipients;
        private final WorkflowEvent event;

        Committed(R result, Set<String> recipients, WorkflowEvent event) {
            this.result = result;
            this.recipients = recipients;
            this.event = event;
        }
    }
}
