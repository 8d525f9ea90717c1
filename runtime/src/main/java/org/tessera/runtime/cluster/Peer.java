package org.tessera.runtime.cluster;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.tessera.util.Host;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A cluster member as listed in another node's peers response.
 */
@AllArgsConstructor
@Getter
@ToString
public class Peer {

    private final String nodeName;

    @Nullable
    private final String tlsName;

    /** Candidate addresses, in the order they should be tried. */
    private final List<Host> hosts;
}
