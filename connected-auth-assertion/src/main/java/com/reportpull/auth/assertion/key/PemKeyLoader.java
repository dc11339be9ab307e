package com.reportpull.auth.assertion.key;

import com.reportpull.auth.assertion.AssertionSigningException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.*;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;

public final class PemKeyLoader {
    private static final String PKCS8_TYPE = "PRIVATE KEY";
    private static final String PKCS1_TYPE = "RSA PRIVATE KEY";

    private PemKeyLoader() {}

    public static PrivateKey loadPrivateKey(Path path) {
        String pem;
        try {
            pem = Files.readString(path, StandardCharsets.US_ASCII);
        } catch (IOException | SecurityException e) {
            throw new AssertionSigningException("Cannot read private key file " + path, e);
        }
        return loadPrivateKey(pem);
    }

    public static PrivateKey loadPrivateKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new AssertionSigningException("Private key PEM is empty");
        }
        if (pem.contains("-----BEGIN " + PKCS1_TYPE + "-----")) {
            return loadPkcs1PrivateKey(pem);
        }
        if (!pem.contains("-----BEGIN " + PKCS8_TYPE + "-----")) {
            throw new AssertionSigningException("Unsupported PEM content, expected " + PKCS8_TYPE + " or " + PKCS1_TYPE);
        }
        try {
            String privateKeyContent = stripPemHeaders(pem, PKCS8_TYPE);
            byte[] der = Base64.getDecoder().decode(privateKeyContent.getBytes(StandardCharsets.US_ASCII));
            PKCS8EncodedKeySpec keySpec = new PKCS8EncodedKeySpec(der);
            return KeyFactory.getInstance("RSA").generatePrivate(keySpec);
        } catch (NoSuchAlgorithmException | InvalidKeySpecException | IllegalArgumentException e) {
            throw new AssertionSigningException("Failed to parse private key from PEM", e);
        }
    }

    private static PrivateKey loadPkcs1PrivateKey(String pem) {
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object parsed = parser.readObject();
            if (!(parsed instanceof PEMKeyPair keyPair)) {
                throw new AssertionSigningException("Expected an unencrypted RSA key pair in PEM, got "
                    + (parsed == null ? "nothing" : parsed.getClass().getSimpleName()));
            }
            return new JcaPEMKeyConverter().getPrivateKey(keyPair.getPrivateKeyInfo());
        } catch (AssertionSigningException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new AssertionSigningException("Failed to parse RSA private key from PEM", e);
        }
    }

    private static String stripPemHeaders(String pem, String type) {
        return pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s+", "");
    }
}
