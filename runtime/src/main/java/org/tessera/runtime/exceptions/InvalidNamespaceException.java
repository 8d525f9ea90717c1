package org.tessera.runtime.exceptions;

import lombok.Getter;

public class InvalidNamespaceException extends ClusterException {

    @Getter
    private final String namespace;

    public InvalidNamespaceException(String namespace, int mapSize) {
        super(ResultCode.INVALID_NAMESPACE, mapSize == 0
                ? "Partition map empty"
                : "Namespace not found in partition map: " + namespace);
        this.namespace = namespace;
    }
}
