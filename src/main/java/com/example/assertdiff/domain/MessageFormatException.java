package com.example.assertdiff.domain;

/**
 * Thrown when a message template cannot be formatted with the arguments supplied for it.
 */
public class MessageFormatException extends IllegalArgumentException {
    private final String template;

    public MessageFormatException(String template, int argumentCount, Throwable cause) {
        super(
                String.format(
                        "Message template \"%s\" cannot be formatted with %d argument(s): %s",
                        template, argumentCount, cause.getMessage()),
                cause);
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
