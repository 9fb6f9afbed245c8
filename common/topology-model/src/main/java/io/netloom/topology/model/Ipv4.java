package io.netloom.topology.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IPv4 address and CIDR helpers shared by validation and templates.
 */
public final class Ipv4 {

    private static final Pattern ADDRESS = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern CIDR = Pattern.compile("^(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})/(\\d{1,2})$");

    private Ipv4() {
    }

    public static boolean isAddress(String text) {
        return toInt(text).isPresent();
    }

    public static boolean isCidr(String text) {
        if (text == null) {
            return false;
        }
        Matcher matcher = CIDR.matcher(text.trim());
        return matcher.matches() && isAddress(matcher.group(1)) && Integer.parseInt(matcher.group(2)) <= 32;
    }

    /**
     * Address part of a CIDR, e.g. {@code 10.0.1.1} for {@code 10.0.1.1/24}.
     */
    public static String address(String cidr) {
        requireCidr(cidr);
        return cidr.trim().substring(0, cidr.trim().indexOf('/'));
    }

    public static int prefixLength(String cidr) {
        requireCidr(cidr);
        return Integer.parseInt(cidr.trim().substring(cidr.trim().indexOf('/') + 1));
    }

    /**
     * Network of a CIDR in CIDR form, e.g. {@code 10.0.1.0/24} for {@code 10.0.1.1/24}.
     */
    public static String network(String cidr) {
        int prefix = prefixLength(cidr);
        int address = toInt(address(cidr)).orElseThrow();
        return format(address & mask(prefix)) + "/" + prefix;
    }

    public static String netmask(String cidr) {
        return format(mask(prefixLength(cidr)));
    }

    /**
     * Whether {@code address} lies inside the network of {@code cidr}.
     */
    public static boolean contains(String cidr, String address) {
        if (!isCidr(cidr)) {
            return false;
        }
        Optional<Integer> candidate = toInt(address);
        if (candidate.isEmpty()) {
            return false;
        }
        int mask = mask(prefixLength(cidr));
        int network = toInt(address(cidr)).orElseThrow() & mask;
        return (candidate.get() & mask) == network;
    }

    private static void requireCidr(String cidr) {
        if (!isCidr(cidr)) {
            throw new IllegalArgumentException("Not an IPv4 CIDR: " + cidr);
        }
    }

    private static int mask(int prefix) {
        return prefix == 0 ? 0 : -1 << (32 - prefix);
    }

    private static Optional<Integer> toInt(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = ADDRESS.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int value = 0;
        for (int group = 1; group <= 4; group++) {
            int octet = Integer.parseInt(matcher.group(group));
            if (octet > 255) {
                return Optional.empty();
            }
            value = (value << 8) | octet;
        }
        return Optional.of(value);
    }

    private static String format(int value) {
        return ((value >>> 24) & 0xff) + "." + ((value >>> 16) & 0xff) + "." + ((value >>> 8) & 0xff) + "." + (value & 0xff);
    }
}
