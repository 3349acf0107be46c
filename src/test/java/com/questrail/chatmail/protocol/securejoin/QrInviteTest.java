package com.questrail.chatmail.protocol.securejoin;

import com.questrail.chatmail.api.InvalidQrCodeException;
import com.questrail.chatmail.identity.Fingerprint;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QrInviteTest {

    private static final String FPR = "1234567890ABCDEF1234567890ABCDEF12345678";

    @Test
    void parsesContactInvite() {
        QrInvite invite = QrInvite.parse("OPENPGP4FPR:" + FPR
                + "#a=alice%40example.org&n=Alice%20A.&i=inv1&s=auth1");

        assertEquals(new Fingerprint(FPR), invite.fingerprint());
        assertEquals("alice@example.org", invite.address());
        assertEquals("Alice A.", invite.name());
        assertEquals("inv1", invite.inviteNumber());
        assertEquals("auth1", invite.authToken());
        assertFalse(invite.isGroupInvite());
    }

    @Test
    void parsesGroupInviteCaseInsensitively() {
        QrInvite invite = QrInvite.parse("openpgp4fpr:" + FPR.toLowerCase()
                + "#a=bob@example.org&i=inv2&s=auth2&x=grp42&g=Team%20%26%20Friends");

        assertTrue(invite.isGroupInvite());
        assertEquals(Optional.of("grp42"), invite.groupId());
        assertEquals(Optional.of("Team & Friends"), invite.groupName());
        assertEquals(new Fingerprint(FPR), invite.fingerprint());
        assertEquals("", invite.name());
    }

    @Test
    void formatIsParsedBackToTheSameInvite() {
        QrInvite invite = new QrInvite(new Fingerprint(FPR), "carol@example.org", "Carol + Co",
                "inv3", "auth3", Optional.of("grp7"), Optional.of("Ünïcode group"));

        assertEquals(invite, QrInvite.parse(invite.format()));
    }

    @Test
    void rejectsOtherSchemes() {
        assertThrows(InvalidQrCodeException.class, () -> QrInvite.parse("https://example.org"));
        assertThrows(InvalidQrCodeException.class, () -> QrInvite.parse(null));
    }

    @Test
    void rejectsIncompleteInvites() {
        assertThrows(InvalidQrCodeException.class,
                () -> QrInvite.parse("OPENPGP4FPR:" + FPR));
        assertThrows(InvalidQrCodeException.class,
                () -> QrInvite.parse("OPENPGP4FPR:" + FPR + "#a=alice@example.org&i=inv1"));
        assertThrows(InvalidQrCodeException.class,
                () -> QrInvite.parse("OPENPGP4FPR:" + FPR + "#a=nobody&i=inv1&s=auth1"));
        assertThrows(InvalidQrCodeException.class,
                () -> QrInvite.parse("OPENPGP4FPR:XYZ#a=alice@example.org&i=inv1&s=auth1"));
    }
}
