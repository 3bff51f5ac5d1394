/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core.exception;

/**
 * A node failed one of the insertion rules of the DAG. Rejections are
 * recoverable: the node is simply not accepted.
 */
@SuppressWarnings("serial")
public class VerificationException extends RuntimeException {
    public VerificationException(String msg) {
        super(msg);
    }

    public VerificationException(Exception e) {
        super(e);
    }

    public VerificationException(String msg, Throwable t) {
        super(msg, t);
    }

    public static class MalformedNodeException extends VerificationException {
        public MalformedNodeException(String reason) {
            super("Malformed node: " + reason);
        }
    }

    public static class DuplicateNodeException extends VerificationException {
        public DuplicateNodeException(String nodeId) {
            super("Node already present: " + nodeId);
        }
    }

    public static class TimestampOutOfRangeException extends VerificationException {
        public TimestampOutOfRangeException(long timestamp, long now, long maxDrift) {
            super("Timestamp " + timestamp + " differs from local time " + now + " by more than " + maxDrift + " ms");
        }
    }

    public static class MissingParentException extends VerificationException {
        public MissingParentException(String nodeId, String parent) {
            super("Node " + nodeId + " references unknown parent " + parent);
        }
    }

    public static class CycleException extends VerificationException {
        public CycleException(String nodeId) {
            super("Node " + nodeId + " would close a cycle");
        }
    }

    public static class AncestryException extends VerificationException {
        public AncestryException(String nodeId, String parent) {
            super("Parent " + parent + " is not older than node " + nodeId);
        }
    }

    public static class InvalidSignatureException extends VerificationException {
        public InvalidSignatureException(String nodeId, String reason) {
            super("Invalid signature on " + nodeId + ": " + reason);
        }
    }
}
