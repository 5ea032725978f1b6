package com.sharedsource.webapi.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HostNamesTest {

    @Test
    void testNormalize() {
        assertEquals("http://cms.example.com", HostNames.normalize("cms.example.com", false));
        assertEquals("http://cms.example.com", HostNames.normalize("http://cms.example.com/", false));
        assertEquals("http://cms.example.com", HostNames.normalize("HTTP://cms.example.com//", false));
        assertEquals("https://cms.example.com", HostNames.normalize("cms.example.com", true));
        assertEquals("https://cms.example.com", HostNames.normalize("http://cms.example.com", true));
    }

    @Test
    void testExplicitHttpsIsSecure() {
        String host = HostNames.normalize("https://cms.example.com", false);

        assertEquals("https://cms.example.com", host);
        assertTrue(HostNames.isSecure(host));
        assertFalse(HostNames.isSecure("http://cms.example.com"));
    }

    @Test
    void testAddressesAndPorts() {
        assertEquals("http://localhost:8080", HostNames.normalize("localhost:8080", false));
        assertEquals("http://192.168.0.10", HostNames.normalize("192.168.0.10", false));
        assertEquals("http://[::1]:8080", HostNames.normalize("[::1]:8080", false));
    }

    @Test
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> HostNames.normalize(null, false));
        assertThrows(IllegalArgumentException.class, () -> HostNames.normalize("", false));
        assertThrows(IllegalArgumentException.class, () -> HostNames.normalize("http://", false));
        assertThrows(IllegalArgumentException.class, () -> HostNames.normalize("cms example.com", false));
        assertThrows(IllegalArgumentException.class, () -> HostNames.normalize("cms.example.com/path", false));
        assertThrows(IllegalArgumentException.class, () -> HostNames.normalize("cms.example.com:70000", false));
        assertThrows(IllegalArgumentException.class, () -> HostNames.normalize("-cms.example.com", false));
        assertThrows(IllegalArgumentException.class, () -> HostNames.normalize("[zz::1]", false));
    }
}
