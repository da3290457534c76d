package com.bridge.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.bridge.cli.ui.Spinner;
import com.bridge.model.Environment;
import com.bridge.model.GeneratedOperations;
import com.bridge.model.Result;
import com.bridge.model.error.CapabilityError;
import com.bridge.model.error.DiscoveryError;
import com.bridge.model.error.GenerationError;
import com.bridge.model.error.TransportError;
import com.bridge.model.error.ValidationError;
import com.bridge.service.api.Operation;
import com.bridge.service.api.OperationFactory;
import com.bridge.support.Json;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CallCommandTest {

    @Mock
    private OperationFactory operationFactory;
    @Mock
    private Spinner spinner;
    @Mock
    private Operation createPost;

    private CallCommand callCommand;

    @BeforeEach
    void setUp() {
        when(spinner.spin(any())).thenAnswer(invocation -> invocation.getArgument(0, Mono.class).block());
        when(createPost.name()).thenReturn("posts-create");
        GeneratedOperations generated = new GeneratedOperations(Environment.SANDBOX,
                Map.of("posts-create", createPost), List.of());
        when(operationFactory.getOperations(Environment.SANDBOX)).thenReturn(Mono.just(Result.success(generated)));
        callCommand = new CallCommand(operationFactory, Json.MAPPER, spinner);
    }

    @Test
    void call_printsTheUnwrappedResult() {
        when(createPost.invoke(any())).thenReturn(Mono.just(Result.success(Json.json("{'id': 7}"))));

        String output = callCommand.call("posts-create", "{\"title\": \"hi\"}", "sandbox", false);

        assertThat(output).contains("\"id\"").contains("7");
        ArgumentCaptor<JsonNode> arguments = ArgumentCaptor.forClass(JsonNode.class);
        verify(createPost).invoke(arguments.capture());
        assertThat(arguments.getValue()).isEqualTo(Json.json("{'title': 'hi'}"));
    }

    @Test
    void call_withoutArguments_passesNull() {
        when(createPost.invoke(any())).thenReturn(Mono.just(Result.success(Json.json("{}"))));

        callCommand.call("posts-create", null, "sandbox", false);

        verify(createPost).invoke(null);
    }

    @Test
    void call_withInvalidJson_reportsAndDoesNotInvoke() {
        String output = callCommand.call("posts-create", "{not json", "sandbox", false);

        assertThat(output).contains("Arguments are not valid JSON");
        verify(operationFactory, never()).getOperations(any());
    }

    @Test
    void call_unknownOperation_pointsToDiscover() {
        String output = callCommand.call("posts-delete", null, "sandbox", false);

        assertThat(output).contains("Operation 'posts-delete' is not available in sandbox");
    }

    @Test
    void call_unknownEnvironment_reportsError() {
        String output = callCommand.call("posts-create", null, "staging", false);

        assertThat(output).contains("Unknown environment 'staging'");
    }

    @Test
    void call_validationFailure_isPrinted() {
        CapabilityError error = new ValidationError(ValidationError.Kind.MISSING_REQUIRED, "$.title", "title is required");
        when(createPost.invoke(any())).thenReturn(Mono.just(Result.<JsonNode, CapabilityError>failure(error)));

        String output = callCommand.call("posts-create", "{}", "sandbox", false);

        assertThat(output).contains(error.message());
    }

    @Test
    void call_generationFailure_isPrinted() {
        GenerationError error = new GenerationError(Environment.PRODUCTION, new DiscoveryError(Environment.PRODUCTION,
                new TransportError(TransportError.Reason.UNREACHABLE, "connection refused", null)));
        when(operationFactory.getOperations(Environment.PRODUCTION))
                .thenReturn(Mono.just(Result.<GeneratedOperations, GenerationError>failure(error)));

        String output = callCommand.call("posts-create", null, "production", false);

        assertThat(output).contains(error.message());
    }

    @Test
    void call_verbose_restoresTheRootLevel() {
        when(createPost.invoke(any())).thenReturn(Mono.just(Result.success(Json.json("{}"))));
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level before = root.getLevel();

        String output = callCommand.call("posts-create", null, "sandbox", true);

        assertThat(output).contains("Verbose mode enabled").contains("Verbose mode disabled");
        assertThat(root.getLevel()).isEqualTo(before);
    }
}
