package com.bridge.dto.response;

/**
 * The outcome of a shell command, rendered for the terminal.
 *
 * @param success Whether the command succeeded.
 * @param message What to show the operator.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * @return the message, green for success and red for failure.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m"; // Green for success, Red for failure
        return color + message + "\u001B[0m";
    }
}
