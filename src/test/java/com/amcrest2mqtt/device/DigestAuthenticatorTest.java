package com.amcrest2mqtt.device;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

public class DigestAuthenticatorTest {
    static final String RFC_2617_CHALLENGE = "Digest realm=\"testrealm@host.com\", qop=\"auth,auth-int\", "
            + "nonce=\"dcd98b7102dd2f0e8b11d0f600bfb0c093\", opaque=\"5ccc069c403ebaf9f0171e9517f40e41\"";

    @Test
    public void noHeaderBeforeChallenge() {
        assertNull(new DigestAuthenticator("admin", "secret").authorization("GET", "/cgi-bin/x.cgi"));
    }

    @Test
    public void rfc2617Example() {
        DigestAuthenticator authenticator = new DigestAuthenticator("Mufasa", "Circle Of Life", () -> "0a4f113b");
        assertTrue(authenticator.onChallenge(ImmutableList.of(RFC_2617_CHALLENGE)));

        String header = authenticator.authorization("GET", "/dir/index.html");

        assertEquals("Digest username=\"Mufasa\", realm=\"testrealm@host.com\", "
                + "nonce=\"dcd98b7102dd2f0e8b11d0f600bfb0c093\", uri=\"/dir/index.html\", qop=auth, nc=00000001, "
                + "cnonce=\"0a4f113b\", response=\"6629fae49393a05397450978507c4ef1\", "
                + "opaque=\"5ccc069c403ebaf9f0171e9517f40e41\", algorithm=MD5", header);
    }

    @Test
    public void nonceCountAdvancesPerRequest() {
        DigestAuthenticator authenticator = new DigestAuthenticator("Mufasa", "Circle Of Life", () -> "0a4f113b");
        authenticator.onChallenge(ImmutableList.of(RFC_2617_CHALLENGE));

        authenticator.authorization("GET", "/a");
        String second = authenticator.authorization("GET", "/b");

        assertTrue(second.contains("nc=00000002"));
    }

    @Test
    public void digestPreferredOverBasic() {
        DigestAuthenticator authenticator = new DigestAuthenticator("admin", "secret");
        authenticator.onChallenge(ImmutableList.of("Basic realm=\"cam\"", RFC_2617_CHALLENGE));

        assertTrue(authenticator.authorization("GET", "/").startsWith("Digest "));
    }

    @Test
    public void basicFallback() {
        DigestAuthenticator authenticator = new DigestAuthenticator("admin", "secret");
        assertTrue(authenticator.onChallenge(ImmutableList.of("Basic realm=\"cam\"")));

        assertEquals("Basic YWRtaW46c2VjcmV0", authenticator.authorization("GET", "/"));
    }

    @Test
    public void unknownSchemeIsRejected() {
        assertFalse(new DigestAuthenticator("admin", "secret").onChallenge(ImmutableList.of("Bearer realm=\"x\"")));
    }

    @Test
    public void md5Hex() {
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", DigestAuthenticator.md5Hex(""));
    }
}
