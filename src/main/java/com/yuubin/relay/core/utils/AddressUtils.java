package com.yuubin.relay.core.utils;

import java.net.InetSocketAddress;

import com.yuubin.relay.core.exceptions.ConfigException;

/**
 * Parsing of {@code host:port} addresses as used in the relay configuration
 * and in SOCKS5 task payloads.
 */
public class AddressUtils {

    private AddressUtils() {
        // Utility class
    }

    /**
     * Checks whether an address is configured at all.
     * 
     * @param address The configured address, possibly null.
     * @return True if the address is null or blank.
     */
    public static boolean isBlank(String address) {
        return address == null || address.isBlank();
    }

    /**
     * Parses {@code host:port} and resolves the host; IPv6 literals must be
     * bracketed.
     * 
     * @param address The address string.
     * @return The socket address, ready to connect to.
     * @throws ConfigException If the address is blank or malformed.
     */
    public static InetSocketAddress parse(String address) {
        InetSocketAddress unresolved = parseUnresolved(address);
        return new InetSocketAddress(unresolved.getHostString(), unresolved.getPort());
    }

    /**
     * Parses {@code host:port} without a name lookup.
     * 
     * @param address The address string.
     * @return An unresolved socket address.
     * @throws ConfigException If the address is blank or malformed.
     */
    public static InetSocketAddress parseUnresolved(String address) {
        if (isBlank(address)) {
            throw new ConfigException("Address must not be empty");
        }
        String trimmed = address.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon <= 0 || colon == trimmed.length() - 1) {
            throw new ConfigException("Address must be host:port, got '" + address + "'");
        }

        String host = trimmed.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        } else if (host.indexOf(':') >= 0) {
            throw new ConfigException("IPv6 address must be bracketed, got '" + address + "'");
        }

        int port;
        try {
            port = Integer.parseInt(trimmed.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid port in address '" + address + "'", e);
        }
        if (port < 1 || port > 65535) {
            throw new ConfigException("Port out of range in address '" + address + "'");
        }
        return InetSocketAddress.createUnresolved(host, port);
    }
}
