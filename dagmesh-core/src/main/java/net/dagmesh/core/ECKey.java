/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
/*
 * Copyright 2011 Google Inc.
 * Copyright 2014 Andreas Schildbach
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.dagmesh.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;

import org.bouncycastle.asn1.ASN1InputStream;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequenceGenerator;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

/**
 * <p>
 * Represents an elliptic curve public and (optionally) private key on the
 * secp256k1 curve, usable for digital signatures but not encryption. Creating a
 * new ECKey with the empty constructor will generate a new random keypair. If
 * you create a key with only the public part, you can check signatures but not
 * create them.
 * </p>
 *
 * <p>
 * Public keys are serialized in the compressed SEC form, signatures as ASN.1/DER
 * over a SHA-256 hash (ECDSA-SHA256). Signing is deterministic (RFC 6979) and
 * signatures are canonicalised to the lower S value.
 * </p>
 */
public class ECKey {
    private static final Logger log = LoggerFactory.getLogger(ECKey.class);

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    /** The parameters of the secp256k1 curve. */
    public static final ECDomainParameters CURVE = new ECDomainParameters(CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(), CURVE_PARAMS.getN(), CURVE_PARAMS.getH());

    /**
     * Equal to CURVE.getN().shiftRight(1), used for canonicalising the S value of
     * a signature.
     */
    public static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private static final SecureRandom secureRandom = new SecureRandom();

    // If "priv" is set, "pub" can always be calculated. If "pub" is set but not
    // "priv", we can only verify signatures not make them.
    protected final BigInteger priv;
    protected final ECPoint pub;

    /**
     * Generates an entirely new keypair.
     */
    public ECKey() {
        ECKeyPairGenerator generator = new ECKeyPairGenerator();
        generator.init(new ECKeyGenerationParameters(CURVE, secureRandom));
        AsymmetricCipherKeyPair keypair = generator.generateKeyPair();
        ECPrivateKeyParameters privParams = (ECPrivateKeyParameters) keypair.getPrivate();
        ECPublicKeyParameters pubParams = (ECPublicKeyParameters) keypair.getPublic();
        priv = privParams.getD();
        pub = pubParams.getQ().normalize();
    }

    protected ECKey(BigInteger priv, ECPoint pub) {
        this.priv = priv;
        this.pub = checkNotNull(pub).normalize();
    }

    /**
     * Creates an ECKey given the private key only. The public key is calculated
     * from it.
     */
    public static ECKey fromPrivate(byte[] privKeyBytes) {
        BigInteger privKey = new BigInteger(1, privKeyBytes);
        checkArgument(privKey.signum() > 0 && privKey.compareTo(CURVE.getN()) < 0, "private key out of range");
        return new ECKey(privKey, publicPointFromPrivate(privKey));
    }

    /**
     * Creates an ECKey that can only verify signatures.
     */
    public static ECKey fromPublicOnly(byte[] pubKeyBytes) {
        return new ECKey(null, CURVE.getCurve().decodePoint(pubKeyBytes));
    }

    private static ECPoint publicPointFromPrivate(BigInteger privKey) {
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), privKey);
    }

    public boolean hasPrivKey() {
        return priv != null;
    }

    /** Gets the compressed SEC encoding of the public key. */
    public byte[] getPubKey() {
        return pub.getEncoded(true);
    }

    public String getPublicKeyString() {
        return Utils.HEX.encode(getPubKey());
    }

    /** Gets the raw 32 byte private key. */
    public byte[] getPrivKeyBytes() {
        if (priv == null)
            throw new MissingPrivateKeyException();
        byte[] bytes = priv.toByteArray();
        if (bytes.length == 32)
            return bytes;
        byte[] result = new byte[32];
        int copy = Math.min(bytes.length, 32);
        System.arraycopy(bytes, bytes.length - copy, result, 32 - copy, copy);
        return result;
    }

    public String getPrivateKeyString() {
        return Utils.HEX.encode(getPrivKeyBytes());
    }

    /**
     * Signs the given hash and returns the R and S components as a canonical
     * ECDSASignature.
     */
    public ECDSASignature sign(byte[] hash) {
        if (priv == null)
            throw new MissingPrivateKeyException();
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(priv, CURVE));
        BigInteger[] components = signer.generateSignature(hash);
        return new ECDSASignature(components[0], components[1]).toCanonicalised();
    }

    /**
     * Verifies the given ECDSA signature against the hash using the public key.
     */
    public static boolean verify(byte[] hash, ECDSASignature signature, byte[] pub) {
        ECDSASigner signer = new ECDSASigner();
        ECPublicKeyParameters params = new ECPublicKeyParameters(CURVE.getCurve().decodePoint(pub), CURVE);
        signer.init(false, params);
        return signer.verifySignature(hash, signature.r, signature.s);
    }

    /**
     * Verifies a DER encoded signature. Malformed keys or signatures verify as
     * false.
     */
    public static boolean verify(byte[] hash, byte[] signature, byte[] pub) {
        try {
            return verify(hash, ECDSASignature.decodeFromDER(signature), pub);
        } catch (IllegalArgumentException e) {
            log.debug("malformed signature or key: {}", e.getMessage());
            return false;
        }
    }

    public boolean verify(byte[] hash, byte[] signature) {
        return verify(hash, signature, getPubKey());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ECKey))
            return false;
        return pub.equals(((ECKey) o).pub);
    }

    @Override
    public int hashCode() {
        return pub.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("pub", getPublicKeyString()).add("hasPriv", hasPrivKey())
                .toString();
    }

    /**
     * Groups the two components that make up a signature.
     */
    public static class ECDSASignature {
        /** The two components of the signature. */
        public final BigInteger r, s;

        public ECDSASignature(BigInteger r, BigInteger s) {
            this.r = r;
            this.s = s;
        }

        /**
         * Returns true if the S component is "low", that means it is below
         * {@link ECKey#HALF_CURVE_ORDER}.
         */
        public boolean isCanonical() {
            return s.compareTo(HALF_CURVE_ORDER) <= 0;
        }

        /**
         * Will automatically adjust the S component to be less than or equal to
         * half the curve order, if necessary.
         */
        public ECDSASignature toCanonicalised() {
            if (!isCanonical()) {
                // N - s is the other valid signature for the same (r, s) pair.
                return new ECDSASignature(r, CURVE.getN().subtract(s));
            }
            return this;
        }

        /**
         * DER is an international standard for serializing data structures which
         * is widely used in cryptography.
         */
        public byte[] encodeToDER() {
            try {
                ByteArrayOutputStream bos = new ByteArrayOutputStream(72);
                DERSequenceGenerator seq = new DERSequenceGenerator(bos);
                seq.addObject(new ASN1Integer(r));
                seq.addObject(new ASN1Integer(s));
                seq.close();
                return bos.toByteArray();
            } catch (IOException e) {
                throw new RuntimeException(e); // Cannot happen.
            }
        }

        public static ECDSASignature decodeFromDER(byte[] bytes) {
            try (ASN1InputStream decoder = new ASN1InputStream(bytes)) {
                ASN1Primitive seqObj = decoder.readObject();
                if (seqObj == null)
                    throw new IllegalArgumentException("Reached past end of ASN.1 stream.");
                ASN1Sequence seq = ASN1Sequence.getInstance(seqObj);
                if (seq.size() != 2)
                    throw new IllegalArgumentException("Expected two integers, got " + seq.size());
                ASN1Integer r = ASN1Integer.getInstance(seq.getObjectAt(0));
                ASN1Integer s = ASN1Integer.getInstance(seq.getObjectAt(1));
                return new ECDSASignature(r.getPositiveValue(), s.getPositiveValue());
            } catch (IOException | ClassCastException e) {
                throw new IllegalArgumentException(e);
            }
        }
    }

    @SuppressWarnings("serial")
    public static class MissingPrivateKeyException extends RuntimeException {
    }
}
