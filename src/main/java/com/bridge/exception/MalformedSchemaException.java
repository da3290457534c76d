package com.bridge.exception;

/**
 * Raised when a capability's input schema cannot be read as a schema document at all.
 * Problems below the root degrade locally and never raise this.
 */
public class MalformedSchemaException extends BridgeException {

    /**
     * Constructs a new MalformedSchemaException.
     *
     * @param message Describes why the document is not a schema, e.g. the JSON node type found at the root.
     */
    public MalformedSchemaException(String message) {
        super(message);
    }
}
