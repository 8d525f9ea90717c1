package org.tessera.runtime.query;

import lombok.Value;

/**
 * A record returned by a partition operation.
 *
 * @param <T> Type of the decoded record body.
 */
@Value
public class ScanRecord<T> {

    /** Digest identifying the record, it also decides the record's partition. */
    byte[] digest;

    T value;
}
