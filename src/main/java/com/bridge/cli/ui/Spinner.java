package com.bridge.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Displays a spinning cursor in the console while a provider call is in flight.
 */
@Component
public class Spinner {

    private final Terminal terminal;
    private final char[] spinnerChars = new char[]{'|', '/', '-', '\\'};

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Subscribes to {@code task} and spins until it completes.
     *
     * @param task The call to wait for.
     * @param <T>  The type of the result.
     * @return the task's value, or {@code null} if it completed empty.
     * @throws RuntimeException if the task signals an error; runtime errors are rethrown as is.
     */
    public <T> T spin(Mono<T> task) {
        CompletableFuture<T> future = task.toFuture();
        PrintWriter writer = terminal.writer();
        int spinnerIndex = 0;

        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clearSpinnerLine(writer);
                    return result;
                } catch (TimeoutException e) {
                    writer.print("\r\u001B[33mWorking... " + spinnerChars[spinnerIndex++ % spinnerChars.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (InterruptedException e) {
            clearSpinnerLine(writer);
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the provider", e);
        } catch (ExecutionException e) {
            clearSpinnerLine(writer);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        }
    }

    private void clearSpinnerLine(PrintWriter writer) {
        writer.print("\r" + " ".repeat(20) + "\r");
        writer.flush();
    }
}
