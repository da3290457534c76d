package com.bridge.model;

import com.bridge.service.api.Operation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The callable operations generated for one environment, in listing order, together with the
 * capabilities that had to be left out.
 *
 * @param environment The environment the operations target.
 * @param operations  Operations keyed by capability name.
 * @param failures    Capabilities excluded from {@code operations}.
 */
public record GeneratedOperations(Environment environment,
                                  Map<String, Operation> operations,
                                  List<GenerationFailure> failures) {

    public GeneratedOperations {
        operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        failures = List.copyOf(failures);
    }

    public Optional<Operation> operation(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
