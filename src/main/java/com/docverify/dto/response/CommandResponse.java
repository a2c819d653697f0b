package com.docverify.dto.response;

/**
 * Outcome line of a shell command.
 *
 * @param success Whether the command did what was asked.
 * @param message The text shown to the user.
 */
public record CommandResponse(boolean success, String message) {

    /**
     * @return The message in green on success, red otherwise.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
