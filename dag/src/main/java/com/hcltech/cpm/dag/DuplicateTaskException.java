package com.hcltech.cpm.dag;

public class DuplicateTaskException extends CpmException {
    public DuplicateTaskException(String identifier) {
        super(ErrorKind.DUPLICATE_IDENTIFIER, identifier, "Duplicate task identifier: " + identifier);
    }
}
