package com.all2md.core.ast;

/**
 * Thrown when children are set on a variant that cannot hold them, or when a
 * child of the wrong kind is supplied to a container.
 */
public class UnsupportedNodeKindException extends StructuralException {

    private final String nodeType;

    public UnsupportedNodeKindException(String nodeType, String message) {
        super(nodeType + ": " + message);
        this.nodeType = nodeType;
    }

    /**
     * @return variant name of the node that rejected the operation
     */
    public String getNodeType() {
        return nodeType;
    }
}
