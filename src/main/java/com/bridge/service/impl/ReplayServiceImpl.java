package com.bridge.service.impl;

import com.bridge.model.Environment;
import com.bridge.model.GeneratedOperations;
import com.bridge.model.InvocationRecord;
import com.bridge.model.ReplayOutcome;
import com.bridge.model.Result;
import com.bridge.model.SyncReport;
import com.bridge.model.error.GenerationError;
import com.bridge.service.api.InvocationTracker;
import com.bridge.service.api.Operation;
import com.bridge.service.api.OperationFactory;
import com.bridge.service.api.ReplayService;
import com.bridge.service.api.TrackingSession;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Replays a tracking session record by record, strictly in ordinal order. A failed record does
 * not stop the ones after it.
 */
@Service
@Slf4j
public class ReplayServiceImpl implements ReplayService {

    private final OperationFactory operationFactory;
    private final InvocationTracker tracker;

    public ReplayServiceImpl(OperationFactory operationFactory, InvocationTracker tracker) {
        this.operationFactory = operationFactory;
        this.tracker = tracker;
    }

    @Override
    public Mono<SyncReport> replay(Environment source, Environment target) {
        if (source == target) {
            return Mono.just(SyncReport.rejected(source, target, "Source and target must be different environments"));
        }
        TrackingSession session = tracker.session(source);
        List<InvocationRecord> records = new ArrayList<>(session.drain());
        if (records.isEmpty()) {
            return Mono.just(SyncReport.rejected(source, target, "No tracked changes in " + source.key()));
        }
        records.sort(Comparator.comparingLong(InvocationRecord::ordinal));
        log.info("Replaying {} tracked changes from {} to {}", records.size(), source.key(), target.key());

        return operationFactory.getOperations(target)
                .flatMap(generated -> replayAll(records, generated))
                .map(outcomes -> report(source, target, session, outcomes));
    }

    private Mono<List<ReplayOutcome>> replayAll(List<InvocationRecord> records,
                                                Result<GeneratedOperations, GenerationError> generated) {
        if (generated.isFailure()) {
            String error = generated.error().message();
            log.warn("Cannot replay: {}", error);
            List<ReplayOutcome> outcomes = new ArrayList<>();
            records.forEach(record -> outcomes.add(ReplayOutcome.failed(record, error)));
            return Mono.just(outcomes);
        }
        GeneratedOperations operations = generated.value();
        return Flux.fromIterable(records)
                .concatMap(record -> replayOne(record, operations.operation(record.operationName())))
                .collectList();
    }

    private Mono<ReplayOutcome> replayOne(InvocationRecord record, Optional<Operation> operation) {
        if (operation.isEmpty()) {
            log.warn("Change #{} failed: unknown operation '{}'", record.ordinal(), record.operationName());
            return Mono.just(ReplayOutcome.failed(record, "unknown operation '" + record.operationName() + "'"));
        }
        return operation.get().invoke(record.arguments())
                .map(result -> {
                    if (result.isSuccess()) {
                        log.info("Applied change #{} ({})", record.ordinal(), record.operationName());
                        return ReplayOutcome.applied(record, result.value());
                    }
                    log.warn("Change #{} ({}) failed: {}", record.ordinal(), record.operationName(), result.error().message());
                    return ReplayOutcome.failed(record, result.error().message());
                });
    }

    private SyncReport report(Environment source, Environment target, TrackingSession session,
                              List<ReplayOutcome> outcomes) {
        int applied = (int) outcomes.stream().filter(ReplayOutcome::success).count();
        int failed = outcomes.size() - applied;
        List<String> errors = outcomes.stream()
                .filter(outcome -> !outcome.success())
                .map(outcome -> outcome.record().operationName() + ": " + outcome.error())
                .toList();
        boolean success = failed == 0;
        if (success) {
            session.clear();
        }
        String message = success
                ? "Applied " + applied + " changes from " + source.key() + " to " + target.key()
                : "Applied " + applied + " of " + outcomes.size() + " changes; " + failed + " failed. "
                        + source.key() + " changes were kept for a retry";
        log.info(message);
        return new SyncReport(source, target, success, message, outcomes.size(), applied, failed, outcomes, errors);
    }
}
