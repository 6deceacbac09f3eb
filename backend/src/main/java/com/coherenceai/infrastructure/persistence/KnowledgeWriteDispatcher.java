package com.coherenceai.infrastructure.persistence;

import com.coherenceai.domain.analysis.model.Concept;
import com.coherenceai.domain.analysis.model.NamedEntity;
import com.coherenceai.domain.analysis.model.Relationship;
import com.coherenceai.domain.fusion.model.FusionResult;
import com.coherenceai.domain.knowledge.service.KnowledgeStore;
import com.coherenceai.infrastructure.persistence.PendingKnowledgeWrite.RelationshipWrite;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fire-and-forget writes of extracted concepts and relationships to the {@link KnowledgeStore}.
 * <p>
 * {@link #dispatch(FusionResult)} hands the writes to the persistence executor and returns at once.
 * Failed writes are queued and retried by {@link #retryPending()}, at most once per tick, until
 * {@code persistence.retry.max-attempts} is reached. The queue holds at most
 * {@code persistence.retry.queue-capacity} writes; overflow is dropped. Nothing is ever reported
 * back to the caller.
 * </p>
 */
@Slf4j
@Component
public class KnowledgeWriteDispatcher {

    private final TaskExecutor executor;
    private final KnowledgeStore knowledgeStore;
    private final int maxAttempts;
    private final int retryBatchSize;

    private final BlockingQueue<PendingKnowledgeWrite> retryQueue;
    private final AtomicBoolean retrying = new AtomicBoolean(false);

    public KnowledgeWriteDispatcher(@Qualifier("knowledgeWriteExecutor") TaskExecutor executor,
                                    KnowledgeStore knowledgeStore,
                                    @Value("${persistence.retry.max-attempts:5}") int maxAttempts,
                                    @Value("${persistence.retry.batch-size:50}") int retryBatchSize,
                                    @Value("${persistence.retry.queue-capacity:10000}") int queueCapacity) {
        this.executor = executor;
        this.knowledgeStore = knowledgeStore;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBatchSize = Math.max(1, retryBatchSize);
        this.retryQueue = new LinkedBlockingQueue<>(Math.max(1, queueCapacity));
    }

    public void dispatch(FusionResult result) {
        dispatch(toWrite(result));
    }

    void dispatch(PendingKnowledgeWrite write) {
        if (write.isEmpty()) {
            return;
        }
        try {
            executor.execute(() -> attempt(write));
        } catch (TaskRejectedException e) {
            log.warn("Knowledge write executor saturated; queueing {} writes for retry", write.size());
            enqueue(write);
        }
    }

    /**
     * Retry queued writes in small batches. Runs on the scheduler thread, never on a request thread.
     * A write that fails again waits for the next tick.
     */
    @Scheduled(fixedDelayString = "${persistence.retry.interval-ms:10000}")
    public void retryPending() {
        if (!retrying.compareAndSet(false, true)) {
            log.debug("Knowledge write retry already running; skipping tick.");
            return;
        }
        try {
            List<PendingKnowledgeWrite> batch = new ArrayList<>(retryBatchSize);
            retryQueue.drainTo(batch, retryBatchSize);
            for (PendingKnowledgeWrite write : batch) {
                attempt(write);
            }
            if (!batch.isEmpty()) {
                log.info("Retried {} pending knowledge writes, {} still queued", batch.size(), retryQueue.size());
            }
        } finally {
            retrying.set(false);
        }
    }

    public int pendingCount() {
        return retryQueue.size();
    }

    void attempt(PendingKnowledgeWrite write) {
        List<Concept> concepts = write.concepts();
        for (int i = 0; i < concepts.size(); i++) {
            try {
                knowledgeStore.upsertConcept(concepts.get(i));
            } catch (RuntimeException e) {
                // Earlier upserts already counted; only the rest is retried
                handleFailure(write.remaining(concepts.subList(i, concepts.size()), write.relationships()), e);
                return;
            }
        }

        List<RelationshipWrite> relationships = write.relationships();
        for (int i = 0; i < relationships.size(); i++) {
            RelationshipWrite relationshipWrite = relationships.get(i);
            try {
                knowledgeStore.upsertRelationship(relationshipWrite.relationship(), relationshipWrite.strengthDelta());
            } catch (RuntimeException e) {
                handleFailure(write.remaining(List.of(), relationships.subList(i, relationships.size())), e);
                return;
            }
        }
        log.debug("Stored {} concepts and {} relationships", concepts.size(), relationships.size());
    }

    private void handleFailure(PendingKnowledgeWrite remaining, RuntimeException cause) {
        if (remaining.attempts() >= maxAttempts) {
            log.error("Dropping {} knowledge writes after {} attempts", remaining.size(), remaining.attempts(), cause);
            return;
        }
        log.warn("Knowledge write failed (attempt {}/{}), {} writes queued for retry: {}",
                remaining.attempts(), maxAttempts, remaining.size(), cause.getMessage());
        enqueue(remaining);
    }

    private void enqueue(PendingKnowledgeWrite write) {
        if (!retryQueue.offer(write)) {
            log.error("Knowledge write retry queue full ({} queued); dropping {} writes",
                    retryQueue.size(), write.size());
        }
    }

    /**
     * Concepts of the result plus entities that no concept already names, then every relationship.
     */
    static PendingKnowledgeWrite toWrite(FusionResult result) {
        List<Concept> concepts = new ArrayList<>(result.concepts());
        Set<String> knownNames = new HashSet<>();
        for (Concept concept : result.concepts()) {
            if (concept.name() != null) {
                knownNames.add(concept.name().toLowerCase(Locale.ROOT));
            }
        }
        for (NamedEntity entity : result.entities()) {
            if (entity.text() != null && knownNames.add(entity.text().toLowerCase(Locale.ROOT))) {
                concepts.add(Concept.fromEntity(entity));
            }
        }

        List<RelationshipWrite> relationships = new ArrayList<>();
        for (Relationship relationship : result.relationships()) {
            relationships.add(new RelationshipWrite(relationship, relationship.strength()));
        }
        return new PendingKnowledgeWrite(concepts, relationships, 0);
    }
}
