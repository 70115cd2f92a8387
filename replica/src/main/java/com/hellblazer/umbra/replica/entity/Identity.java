/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Umbra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.umbra.replica.entity;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of a connected client as issued by the authoritative service, held in its hexadecimal form.
 * <p>
 * Comparison is case insensitive: the hex digits are normalized to lower case on construction.
 *
 * @author hal.hildebrand
 */
public final class Identity implements Comparable<Identity> {
    private final String hex;

    public Identity(String hex) {
        Objects.requireNonNull(hex, "Identity cannot be null");
        if (hex.isEmpty()) {
            throw new IllegalArgumentException("Identity cannot be empty");
        }
        for (int i = 0; i < hex.length(); i++) {
            if (!isHexDigit(hex.charAt(i))) {
                throw new IllegalArgumentException("Identity is not hexadecimal: " + hex);
            }
        }
        this.hex = hex.toLowerCase(Locale.ROOT);
    }

    public static Identity of(String hex) {
        return new Identity(hex);
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    @Override
    public int compareTo(Identity other) {
        return hex.compareTo(other.hex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identity that)) {
            return false;
        }
        return hex.equals(that.hex);
    }

    @Override
    public int hashCode() {
        return hex.hashCode();
    }

    public String toHexString() {
        return hex;
    }

    /**
     * @return the abbreviated form used in log output
     */
    public String toDebugString() {
        return hex.length() <= 8 ? hex : hex.substring(0, 8) + "...";
    }

    @Override
    public String toString() {
        return hex;
    }
}
