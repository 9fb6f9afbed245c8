package io.netloom.topology.resolve;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Stable MAC addresses derived from topology id, node and interface name, so regenerating a
 * topology never changes the addresses the guests see.
 */
final class MacAddresses {

    private MacAddresses() {
    }

    static String of(String topologyId, String nodeName, String interfaceName) {
        byte[] digest = md5(topologyId + "-" + nodeName + "-" + interfaceName);
        // unicast, locally administered
        digest[0] = (byte) ((digest[0] & 0xfe) | 0x02);
        StringBuilder mac = new StringBuilder(17);
        for (int i = 0; i < 6; i++) {
            if (i > 0) {
                mac.append(':');
            }
            mac.append(String.format("%02X", digest[i] & 0xff));
        }
        return mac.toString();
    }

    private static byte[] md5(String value) {
        try {
            return MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
