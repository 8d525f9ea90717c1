package org.tessera.runtime.clients;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves a host name into every address registered for it.
 */
@FunctionalInterface
public interface AddressResolver {

    AddressResolver SYSTEM = InetAddress::getAllByName;

    InetAddress[] resolve(String hostName) throws UnknownHostException;
}
