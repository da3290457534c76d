package com.bridge.cli;

import static com.bridge.cli.ui.Ansi.PURPLE;
import static com.bridge.cli.ui.Ansi.RESET;

import com.bridge.cli.ui.JsonPrinter;
import com.bridge.cli.ui.Spinner;
import com.bridge.dto.request.InvokeOperationRequest;
import com.bridge.dto.response.CommandResponse;
import com.bridge.model.Environment;
import com.bridge.model.GeneratedOperations;
import com.bridge.model.Result;
import com.bridge.model.error.CapabilityError;
import com.bridge.model.error.GenerationError;
import com.bridge.service.api.Operation;
import com.bridge.service.api.OperationFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Calls a generated operation from the shell.
 */
@ShellComponent
public class CallCommand {

    private final OperationFactory operationFactory;
    private final ObjectMapper objectMapper;
    private final Spinner spinner;

    public CallCommand(OperationFactory operationFactory, ObjectMapper objectMapper, Spinner spinner) {
        this.operationFactory = operationFactory;
        this.objectMapper = objectMapper;
        this.spinner = spinner;
    }

    /**
     * Validates the arguments, calls the provider and prints the unwrapped result.
     *
     * @param name    The capability name.
     * @param args    Call arguments as a JSON object; omitted means none.
     * @param env     The environment key.
     * @param verbose Raises the root log level to DEBUG while the command runs.
     * @return the colourized result, or the error.
     */
    @ShellMethod(key = "call", value = "Invoke a capability with JSON arguments.")
    public String call(
            @ShellOption(help = "The capability name.") String name,
            @ShellOption(value = {"--args", "-a"}, help = "Arguments as a JSON object.", defaultValue = ShellOption.NULL) String args,
            @ShellOption(value = {"--env", "-e"}, help = "sandbox, production or external.", defaultValue = "sandbox") String env,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        StringBuilder out = new StringBuilder();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            out.append(PURPLE).append("-- Verbose mode enabled --").append(RESET).append("\n");
        }

        try {
            InvokeOperationRequest request = new InvokeOperationRequest(Environment.fromKey(env), name, parseArguments(args));
            out.append(invoke(request));
        } catch (JsonProcessingException e) {
            out.append(CommandResponse.error("Arguments are not valid JSON: " + e.getOriginalMessage()).toAnsiString());
        } catch (Exception e) {
            out.append(CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString());
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                out.append("\n").append(PURPLE).append("-- Verbose mode disabled --").append(RESET);
            }
        }
        return out.toString();
    }

    private String invoke(InvokeOperationRequest request) {
        Result<GeneratedOperations, GenerationError> generated =
                spinner.spin(operationFactory.getOperations(request.environment()));
        if (generated.isFailure()) {
            return CommandResponse.error(generated.error().message()).toAnsiString();
        }
        Optional<Operation> operation = generated.value().operation(request.operation());
        if (operation.isEmpty()) {
            return CommandResponse.error("Operation '" + request.operation() + "' is not available in "
                    + request.environment().key() + ". Use 'discover' to list capabilities.").toAnsiString();
        }
        Result<JsonNode, CapabilityError> result = spinner.spin(operation.get().invoke(request.arguments()));
        if (result.isFailure()) {
            return CommandResponse.error(result.error().message()).toAnsiString();
        }
        return JsonPrinter.format(result.value());
    }

    private JsonNode parseArguments(String args) throws JsonProcessingException {
        if (args == null || args.isBlank()) {
            return null;
        }
        return objectMapper.readTree(args);
    }
}
