/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class ECKeyTest {

    private final byte[] hash = Utils.sha256("hello dag".getBytes(StandardCharsets.UTF_8));

    @Test
    public void signAndVerify() {
        ECKey key = new ECKey();
        byte[] der = key.sign(hash).encodeToDER();
        assertTrue(key.verify(hash, der));
        assertTrue(ECKey.verify(hash, der, key.getPubKey()));
    }

    @Test
    public void signatureIsCanonicalAndDeterministic() {
        ECKey key = new ECKey();
        ECKey.ECDSASignature first = key.sign(hash);
        ECKey.ECDSASignature second = key.sign(hash);
        assertTrue(first.isCanonical());
        assertEquals(first.r, second.r);
        assertEquals(first.s, second.s);
    }

    @Test
    public void wrongKeyDoesNotVerify() {
        ECKey key = new ECKey();
        ECKey other = new ECKey();
        byte[] der = key.sign(hash).encodeToDER();
        assertFalse(other.verify(hash, der));
    }

    @Test
    public void tamperedHashDoesNotVerify() {
        ECKey key = new ECKey();
        byte[] der = key.sign(hash).encodeToDER();
        byte[] tampered = hash.clone();
        tampered[0] ^= 1;
        assertFalse(key.verify(tampered, der));
    }

    @Test
    public void malformedSignatureVerifiesFalse() {
        ECKey key = new ECKey();
        assertFalse(key.verify(hash, new byte[] { 1, 2, 3 }));
    }

    @Test
    public void privateKeyRoundTrip() {
        ECKey key = new ECKey();
        ECKey restored = ECKey.fromPrivate(key.getPrivKeyBytes());
        assertEquals(key, restored);
        assertEquals(32, key.getPrivKeyBytes().length);
        assertEquals(66, key.getPublicKeyString().length());
    }

    @Test
    public void publicOnlyKeyCannotSign() {
        ECKey key = new ECKey();
        ECKey pub = ECKey.fromPublicOnly(key.getPubKey());
        assertFalse(pub.hasPrivKey());
        assertArrayEquals(key.getPubKey(), pub.getPubKey());
        assertTrue(pub.verify(hash, key.sign(hash).encodeToDER()));
        assertThrows(ECKey.MissingPrivateKeyException.class, () -> pub.sign(hash));
    }
}
