package com.scanops.scope;

import com.scanops.entity.Scope;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Decides whether a target lies inside a scope's host patterns or CIDR ranges.
 * Stateless; malformed scope entries simply never match.
 */
@Component
public class TargetAuthorizer {

    private static final String WILDCARD_PREFIX = "*.";

    public boolean isAuthorized(@Nullable String target, Scope scope) {
        if (target == null || scope == null) {
            return false;
        }
        String normalized = target.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return false;
        }
        return matchesHost(normalized, scope.getHosts()) || matchesCidr(normalized, scope.getCidrs());
    }

    boolean matchesHost(String target, @Nullable Collection<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String raw : patterns) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String pattern = raw.trim().toLowerCase(Locale.ROOT);
            if (pattern.equals(target)) {
                return true;
            }
            if (pattern.startsWith(WILDCARD_PREFIX)) {
                String bare = pattern.substring(WILDCARD_PREFIX.length());
                String dotted = pattern.substring(1);
                if (!bare.isEmpty() && (target.equals(bare) || target.endsWith(dotted))) {
                    return true;
                }
            }
        }
        return false;
    }

    boolean matchesCidr(String target, @Nullable Collection<String> cidrs) {
        if (cidrs == null) {
            return false;
        }
        OptionalLong address = parseIpv4(target);
        if (address.isEmpty()) {
            return false;
        }
        for (String cidr : cidrs) {
            if (cidr != null && inRange(address.getAsLong(), cidr.trim())) {
                return true;
            }
        }
        return false;
    }

    private boolean inRange(long address, String cidr) {
        int slash = cidr.indexOf('/');
        if (slash <= 0 || slash == cidr.length() - 1) {
            return false;
        }
        OptionalLong network = parseIpv4(cidr.substring(0, slash));
        if (network.isEmpty()) {
            return false;
        }
        int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException ex) {
            return false;
        }
        if (prefix < 0 || prefix > 32) {
            return false;
        }
        long mask = prefix == 0 ? 0L : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        return (address & mask) == (network.getAsLong() & mask);
    }

    static OptionalLong parseIpv4(String value) {
        String[] parts = value.split("\\.", -1);
        if (parts.length != 4) {
            return OptionalLong.empty();
        }
        long result = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return OptionalLong.empty();
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                return OptionalLong.empty();
            }
            result = (result << 8) | octet;
        }
        return OptionalLong.of(result);
    }
}
