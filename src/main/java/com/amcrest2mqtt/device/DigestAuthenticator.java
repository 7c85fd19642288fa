package com.amcrest2mqtt.device;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.io.BaseEncoding;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * HTTP authentication for the camera CGI API: Digest (RFC 2617, MD5, qop=auth) as the devices ask for it,
 * Basic when a device challenges with Basic instead.
 * <p>
 * The last challenge is cached so subsequent requests authenticate up front; the nonce count is advanced
 * for every request made against the same nonce.
 */
public class DigestAuthenticator {
    static final Pattern CHALLENGE_PARAM = Pattern.compile("(\\w+)\\s*=\\s*(?:\"([^\"]*)\"|([^,\\s]+))");
    static final SecureRandom RANDOM = new SecureRandom();

    enum Scheme { BASIC, DIGEST }

    static final class Challenge {
        final Scheme scheme;
        final Map<String, String> params;

        Challenge(Scheme scheme, Map<String, String> params) {
            this.scheme = scheme;
            this.params = params;
        }

        @Nullable String param(String name) {
            return params.get(name);
        }
    }

    final String username;
    final String password;
    final Supplier<String> cnonceSupplier;

    @Nullable Challenge challenge;
    int nonceCount;

    public DigestAuthenticator(String username, String password) {
        this(username, password, DigestAuthenticator::randomCnonce);
    }

    @VisibleForTesting
    DigestAuthenticator(String username, String password, Supplier<String> cnonceSupplier) {
        this.username = checkNotNull(username);
        this.password = checkNotNull(password);
        this.cnonceSupplier = cnonceSupplier;
    }

    /**
     * Records the challenge from a 401 response.
     *
     * @return false if none of the offered schemes is supported
     */
    public synchronized boolean onChallenge(List<String> wwwAuthenticateHeaders) {
        Challenge basic = null;
        for (String header : wwwAuthenticateHeaders) {
            Challenge parsed = parseChallenge(header);
            if (parsed == null) {
                continue;
            }
            if (parsed.scheme == Scheme.DIGEST) {
                challenge = parsed;
                nonceCount = 0;
                return true;
            }
            basic = parsed;
        }
        if (basic != null) {
            challenge = basic;
            return true;
        }
        return false;
    }

    /** @return Authorization header value, or null until a challenge has been seen */
    public synchronized @Nullable String authorization(String method, String requestUri) {
        if (challenge == null) {
            return null;
        }
        if (challenge.scheme == Scheme.BASIC) {
            return "Basic " + Base64.getEncoder()
                    .encodeToString(String.format("%s:%s", username, password).getBytes(Charsets.UTF_8));
        }

        String realm = nullToEmpty(challenge.param("realm"));
        String nonce = nullToEmpty(challenge.param("nonce"));
        String opaque = challenge.param("opaque");
        String qop = selectQop(challenge.param("qop"));

        String ha1 = md5Hex(String.format("%s:%s:%s", username, realm, password));
        String ha2 = md5Hex(String.format("%s:%s", method, requestUri));

        StringBuilder header = new StringBuilder("Digest ");
        header.append(String.format("username=\"%s\", realm=\"%s\", nonce=\"%s\", uri=\"%s\"",
                username, realm, nonce, requestUri));

        String response;
        if (qop != null) {
            String nc = String.format("%08x", ++nonceCount);
            String cnonce = cnonceSupplier.get();
            response = md5Hex(String.format("%s:%s:%s:%s:%s:%s", ha1, nonce, nc, cnonce, qop, ha2));
            header.append(String.format(", qop=%s, nc=%s, cnonce=\"%s\"", qop, nc, cnonce));
        } else {
            response = md5Hex(String.format("%s:%s:%s", ha1, nonce, ha2));
        }
        header.append(String.format(", response=\"%s\"", response));
        if (opaque != null) {
            header.append(String.format(", opaque=\"%s\"", opaque));
        }
        header.append(", algorithm=MD5");
        return header.toString();
    }

    @VisibleForTesting
    static @Nullable Challenge parseChallenge(String header) {
        String trimmed = header.trim();
        int space = trimmed.indexOf(' ');
        String schemeName = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);

        Scheme scheme;
        if ("digest".equals(schemeName)) {
            scheme = Scheme.DIGEST;
        } else if ("basic".equals(schemeName)) {
            scheme = Scheme.BASIC;
        } else {
            return null;
        }

        Map<String, String> params = new HashMap<>();
        if (space >= 0) {
            Matcher matcher = CHALLENGE_PARAM.matcher(trimmed.substring(space + 1));
            while (matcher.find()) {
                String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
                params.put(matcher.group(1).toLowerCase(Locale.ROOT), value);
            }
        }
        return new Challenge(scheme, params);
    }

    static @Nullable String selectQop(@Nullable String offered) {
        if (offered == null) {
            return null;
        }
        for (String option : offered.split(",")) {
            if ("auth".equals(option.trim())) {
                return "auth";
            }
        }
        // auth-int only: fall back to RFC 2069 style
        return null;
    }

    static String md5Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return BaseEncoding.base16().lowerCase().encode(digest.digest(value.getBytes(Charsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    static String randomCnonce() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }

    static String nullToEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }
}
