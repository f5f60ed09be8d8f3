/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.util;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IPv4/IPv6 CIDR matcher used for crawler networks, trusted proxies and the
 * static geo fallback table.
 */
public final class CidrMatcher {
    private static final CidrMatcher EMPTY = new CidrMatcher(Collections.emptyList());

    private final List<CidrBlock> blocks;

    private CidrMatcher(List<CidrBlock> blocks) {
        this.blocks = blocks;
    }

    public static CidrMatcher empty() {
        return EMPTY;
    }

    /**
     * Builds a matcher from CIDR strings. A bare address is treated as a
     * single-host block.
     *
     * @throws IllegalArgumentException if any entry is not a valid CIDR
     */
    public static CidrMatcher from(List<String> cidrs) {
        List<CidrBlock> blocks = new ArrayList<>();
        if (cidrs != null) {
            for (String cidr : cidrs) {
                if (cidr == null || cidr.trim().isEmpty()) {
                    continue;
                }
                blocks.add(CidrBlock.parse(cidr.trim()));
            }
        }
        return blocks.isEmpty() ? EMPTY : new CidrMatcher(List.copyOf(blocks));
    }

    /**
     * Returns true when the address falls within any configured block.
     */
    public boolean matches(InetAddress address) {
        if (address == null) {
            return false;
        }
        for (CidrBlock block : blocks) {
            if (block.matches(address)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public int size() {
        return blocks.size();
    }

    private static final class CidrBlock {
        private final byte[] network;
        private final int prefix;

        private CidrBlock(byte[] network, int prefix) {
            this.network = network;
            this.prefix = prefix;
        }

        static CidrBlock parse(String cidr) {
            String[] parts = cidr.split("/", -1);
            if (parts.length > 2) {
                throw new IllegalArgumentException("Invalid CIDR: " + cidr);
            }
            InetAddress address = AddressLiterals.parse(parts[0])
                    .orElseThrow(() -> new IllegalArgumentException("Invalid CIDR address: " + cidr));
            byte[] network = address.getAddress();
            int maxPrefix = network.length * 8;
            int prefix = maxPrefix;
            if (parts.length == 2) {
                try {
                    prefix = Integer.parseInt(parts[1].trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid CIDR prefix: " + cidr, e);
                }
            }
            if (prefix < 0 || prefix > maxPrefix) {
                throw new IllegalArgumentException("CIDR prefix out of range: " + cidr);
            }
            return new CidrBlock(network, prefix);
        }

        boolean matches(InetAddress address) {
            byte[] target = address.getAddress();
            if (target.length != network.length) {
                return false;
            }
            int bits = prefix;
            int index = 0;
            while (bits >= 8) {
                if (network[index] != target[index]) {
                    return false;
                }
                bits -= 8;
                index++;
            }
            if (bits == 0) {
                return true;
            }
            int mask = (-1) << (8 - bits);
            return (network[index] & mask) == (target[index] & mask);
        }
    }
}
