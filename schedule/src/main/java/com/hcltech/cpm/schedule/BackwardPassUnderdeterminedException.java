package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.CpmException;
import com.hcltech.cpm.dag.ErrorKind;

/** A task's successors had no late finish when it was needed. Indicates a pass-ordering bug. */
public class BackwardPassUnderdeterminedException extends CpmException {
    public BackwardPassUnderdeterminedException(String identifier, String successor) {
        super(ErrorKind.BACKWARD_PASS_UNDERDETERMINED, identifier,
                "Late finish of " + identifier + " is underdetermined: successor " + successor + " not yet computed");
    }
}
