/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core.exception;

/**
 * An internal structure of the DAG references something that is no longer
 * there. Indicates a bug, not bad input.
 */
@SuppressWarnings("serial")
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String msg) {
        super(msg);
    }
}
