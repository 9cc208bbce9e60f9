package com.scanops.scope;

import com.scanops.entity.Scope;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TargetAuthorizerTest {

    private final TargetAuthorizer authorizer = new TargetAuthorizer();

    @Test
    void testCidrMembership() {
        Scope scope = scope(List.of("10.0.0.0/8"), List.of());

        assertTrue(authorizer.isAuthorized("10.1.2.3", scope));
        assertFalse(authorizer.isAuthorized("11.0.0.1", scope));
    }

    @Test
    void testClassCNetwork() {
        Scope scope = scope(List.of("10.0.0.0/24"), List.of());

        assertTrue(authorizer.isAuthorized("10.0.0.5", scope));
        assertTrue(authorizer.isAuthorized("10.0.0.255", scope));
        assertFalse(authorizer.isAuthorized("10.0.1.5", scope));
    }

    @Test
    void testZeroPrefixMatchesEveryAddress() {
        Scope scope = scope(List.of("0.0.0.0/0"), List.of());

        assertTrue(authorizer.isAuthorized("203.0.113.9", scope));
        assertTrue(authorizer.isAuthorized("255.255.255.255", scope));
    }

    @Test
    void testSingleHostPrefix() {
        Scope scope = scope(List.of("192.168.1.10/32"), List.of());

        assertTrue(authorizer.isAuthorized("192.168.1.10", scope));
        assertFalse(authorizer.isAuthorized("192.168.1.11", scope));
    }

    @Test
    void testWildcardHostMatchesBareDomainAndSubdomains() {
        Scope scope = scope(List.of(), List.of("*.example.com"));

        assertTrue(authorizer.isAuthorized("example.com", scope));
        assertTrue(authorizer.isAuthorized("api.example.com", scope));
        assertTrue(authorizer.isAuthorized("a.b.example.com", scope));
        assertFalse(authorizer.isAuthorized("badexample.com", scope));
        assertFalse(authorizer.isAuthorized("evil.com", scope));
    }

    @Test
    void testHostsAreNormalized() {
        Scope scope = scope(List.of(), List.of("App.Example.com"));

        assertTrue(authorizer.isAuthorized("  APP.example.COM ", scope));
    }

    @Test
    void testMalformedCidrNeverMatchesOrThrows() {
        Scope scope = scope(List.of("10.0.0.0/33", "not-a-cidr", "10.0.0/8", "300.0.0.0/8"), List.of());

        assertFalse(authorizer.isAuthorized("10.0.0.1", scope));
    }

    @Test
    void testEmptyScopeRejectsEverything() {
        Scope scope = scope(List.of(), List.of());

        assertFalse(authorizer.isAuthorized("10.0.0.1", scope));
        assertFalse(authorizer.isAuthorized("example.com", scope));
        assertFalse(authorizer.isAuthorized(null, scope));
    }

    @Test
    void testParseIpv4RejectsOutOfRangeOctets() {
        assertTrue(TargetAuthorizer.parseIpv4("1.2.3.4").isPresent());
        assertEquals(0xC0A80101L, TargetAuthorizer.parseIpv4("192.168.1.1").getAsLong());
        assertTrue(TargetAuthorizer.parseIpv4("256.1.1.1").isEmpty());
        assertTrue(TargetAuthorizer.parseIpv4("1.2.3").isEmpty());
        assertTrue(TargetAuthorizer.parseIpv4("example.com").isEmpty());
    }

    private static Scope scope(List<String> cidrs, List<String> hosts) {
        return Scope.builder().name("test").cidrs(cidrs).hosts(hosts).active(true).build();
    }
}
