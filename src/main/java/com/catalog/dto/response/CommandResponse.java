package com.catalog.dto.response;

/**
 * The outcome of a shell command: a success flag and the message to show.
 *
 * @param success Whether the command succeeded.
 * @param message The confirmation or error text.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse failed(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * Wraps the message in ANSI color codes: green on success, red on failure.
     *
     * @return The colored message.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
