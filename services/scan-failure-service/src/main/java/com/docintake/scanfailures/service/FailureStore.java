package com.docintake.scanfailures.service;

import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import com.docintake.scanfailures.repository.SourceScanFailureRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persistent collection of failure records.
 * <p>
 * Every write is one read-modify-write transaction that locks the target row
 * ({@code SELECT ... FOR UPDATE}), so writers on the same key are serialized
 * while writers on different keys never wait on each other. Two concurrent
 * first failures for one key collide on the unique active key; the losers are
 * rolled back and replayed with linear backoff, finding and locking the winner's row.
 */
@Component
public class FailureStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FailureStore.class);

    private static final int MAX_ATTEMPTS = 3;
    private static final long BASE_BACKOFF_MILLIS = 25L;

    private final SourceScanFailureRepository repository;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public FailureStore(SourceScanFailureRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    /**
     * Updates the open episode for the key, or creates one when none exists.
     */
    public SourceScanFailureEntity upsertActive(
        UUID sourceId,
        String resourcePath,
        Supplier<SourceScanFailureEntity> creator,
        Consumer<SourceScanFailureEntity> updater
    ) {
        String activeKey = SourceScanFailureEntity.activeKeyOf(sourceId, resourcePath);
        return write("upsert " + resourcePath, () -> {
            Optional<SourceScanFailureEntity> existing = repository.findByActiveKeyForUpdate(activeKey);
            SourceScanFailureEntity target;
            if (existing.isPresent()) {
                target = existing.get();
                updater.accept(target);
            } else {
                target = creator.get();
            }
            return repository.saveAndFlush(target);
        });
    }

    /**
     * Applies the change to the open episode for the key, if there is one.
     */
    public Optional<SourceScanFailureEntity> updateActive(
        UUID sourceId,
        String resourcePath,
        Consumer<SourceScanFailureEntity> updater
    ) {
        String activeKey = SourceScanFailureEntity.activeKeyOf(sourceId, resourcePath);
        return write("update " + resourcePath, () -> repository.findByActiveKeyForUpdate(activeKey)
            .map(existing -> {
                updater.accept(existing);
                return repository.saveAndFlush(existing);
            }));
    }

    /**
     * Applies the change to the record with the given id.
     *
     * @throws FailureNotFoundException when no such record exists
     */
    public SourceScanFailureEntity updateById(UUID failureId, Consumer<SourceScanFailureEntity> updater) {
        return write("update " + failureId, () -> {
            SourceScanFailureEntity existing = repository.findByIdForUpdate(failureId)
                .orElseThrow(() -> new FailureNotFoundException(failureId));
            updater.accept(existing);
            return repository.saveAndFlush(existing);
        });
    }

    public Optional<SourceScanFailureEntity> findById(UUID failureId) {
        return read(() -> repository.findById(failureId));
    }

    public Optional<SourceScanFailureEntity> findActive(UUID sourceId, String resourcePath) {
        String activeKey = SourceScanFailureEntity.activeKeyOf(sourceId, resourcePath);
        return read(() -> repository.findByActiveKey(activeKey));
    }

    public List<SourceScanFailureEntity> findRetryCandidates(SourceType sourceType, Instant now, int limit) {
        return read(() -> repository.findRetryCandidates(sourceType, now, PageRequest.of(0, limit)));
    }

    /**
     * Reads and transforms inside one read-only transaction.
     */
    public <T> T readSnapshot(SourceType sourceType, Function<List<SourceScanFailureEntity>, T> reader) {
        return read(() -> reader.apply(repository.findAllBySourceType(sourceType)));
    }

    private <T> T write(String label, Supplier<T> work) {
        for (int attempt = 1; ; attempt++) {
            try {
                return writeTx.execute(status -> work.get());
            } catch (ConcurrencyFailureException | DataIntegrityViolationException conflict) {
                if (attempt >= MAX_ATTEMPTS) {
                    LOGGER.error("Storage conflict persisted during {} after {} attempts", label, attempt, conflict);
                    throw new StorageException("Storage conflict during " + label, conflict);
                }
                long backoff = BASE_BACKOFF_MILLIS * attempt;
                LOGGER.warn("Storage conflict during {} (attempt {}/{}), retrying in {}ms: {}",
                    label, attempt, MAX_ATTEMPTS, backoff, conflict.getMessage());
                sleepBeforeRetry(backoff, label);
            } catch (DataAccessException | TransactionException ex) {
                LOGGER.error("Storage failure during {}", label, ex);
                throw new StorageException("Storage failure during " + label, ex);
            }
        }
    }

    private static void sleepBeforeRetry(long millis, String label) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while retrying " + label, interrupted);
        }
    }

    private <T> T read(Supplier<T> work) {
        try {
            return readTx.execute(status -> work.get());
        } catch (DataAccessException | TransactionException ex) {
            LOGGER.error("Storage failure while reading source scan failures", ex);
            throw new StorageException("Storage failure while reading source scan failures", ex);
        }
    }
}
