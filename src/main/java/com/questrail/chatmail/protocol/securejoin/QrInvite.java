package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.api.InvalidQrCodeException;
import com.questrail.chatmail.identity.Fingerprint;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * QrInvite
 * -----------------------------------------------------------------------------
 * The secure-join invite carried in a QR code.
 *
 * <pre>
 * OPENPGP4FPR:&lt;fingerprint&gt;#a=&lt;addr&gt;&amp;n=&lt;name&gt;&amp;i=&lt;invitenumber&gt;&amp;s=&lt;auth&gt;
 * </pre>
 * Group invites add {@code &x=<groupid>&g=<groupname>}. Parameter values are
 * percent-encoded.
 */
public record QrInvite(
        Fingerprint fingerprint,
        String address,
        String name,
        String inviteNumber,
        String authToken,
        Optional<String> groupId,
        Optional<String> groupName
) {
    private static final String SCHEME = "OPENPGP4FPR:";

    public QrInvite {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(inviteNumber, "inviteNumber");
        Objects.requireNonNull(authToken, "authToken");
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(groupName, "groupName");
        name = name == null ? "" : name;
    }

    public boolean isGroupInvite() {
        return groupId.isPresent();
    }

    /**
     * Parses a scanned QR payload.
     *
     * @throws InvalidQrCodeException if the payload is not a complete secure-join invite
     */
    public static QrInvite parse(String payload) {
        if (payload == null) {
            throw new InvalidQrCodeException("empty QR code");
        }
        String text = payload.trim();
        if (!text.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            throw new InvalidQrCodeException("not an OPENPGP4FPR code");
        }
        String rest = text.substring(SCHEME.length());
        int hash = rest.indexOf('#');
        if (hash < 0) {
            throw new InvalidQrCodeException("QR code carries no invite parameters");
        }

        Fingerprint fingerprint;
        try {
            fingerprint = Fingerprint.parse(rest.substring(0, hash));
        } catch (IllegalArgumentException e) {
            throw new InvalidQrCodeException("bad fingerprint in QR code: " + e.getMessage());
        }

        Map<String, String> params = new HashMap<>();
        for (String pair : rest.substring(hash + 1).split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new InvalidQrCodeException("malformed QR parameter: " + pair);
            }
            String key = pair.substring(0, eq).toLowerCase(Locale.ROOT);
            params.put(key, decode(pair.substring(eq + 1)));
        }

        String address = params.get("a");
        if (address == null || address.indexOf('@') <= 0) {
            throw new InvalidQrCodeException("QR code has no valid address");
        }
        String inviteNumber = params.get("i");
        String auth = params.get("s");
        if (isBlank(inviteNumber) || isBlank(auth)) {
            throw new InvalidQrCodeException("QR code has no secure-join tokens");
        }
        String groupId = params.get("x");
        return new QrInvite(fingerprint, address, params.get("n"), inviteNumber, auth,
                Optional.ofNullable(isBlank(groupId) ? null : groupId),
                Optional.ofNullable(params.get("g")));
    }

    /**
     * Renders the invite as QR payload text.
     */
    public String format() {
        StringBuilder sb = new StringBuilder(SCHEME)
                .append(fingerprint.hex())
                .append("#a=").append(encode(address))
                .append("&n=").append(encode(name))
                .append("&i=").append(encode(inviteNumber))
                .append("&s=").append(encode(authToken));
        if (groupId.isPresent()) {
            sb.append("&x=").append(encode(groupId.get()));
            sb.append("&g=").append(encode(groupName.orElse("")));
        }
        return sb.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidQrCodeException("bad percent-encoding in QR code: " + value);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
