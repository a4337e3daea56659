package io.github.drompincen.channelhub.runtime.crypto;

import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * AES-256-GCM vault. Blob layout is base64(iv[16] + tag[16] + ciphertext).
 * The key is 64 hex chars, or at least 32 plain characters of which the first 32 bytes are used.
 */
@Component
public class AesGcmCredentialVault implements CredentialVault {

    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");

    private final SecureRandom random = new SecureRandom();
    private final String configuredKey;

    public AesGcmCredentialVault(ChannelHubProperties properties) {
        this(properties.crypto().encryptionKey());
    }

    AesGcmCredentialVault(String configuredKey) {
        this.configuredKey = configuredKey;
    }

    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null) return null;
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key(), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            // JCE appends the tag after the ciphertext
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            int ctLength = sealed.length - TAG_LENGTH;

            byte[] out = new byte[IV_LENGTH + TAG_LENGTH + ctLength];
            System.arraycopy(iv, 0, out, 0, IV_LENGTH);
            System.arraycopy(sealed, ctLength, out, IV_LENGTH, TAG_LENGTH);
            System.arraycopy(sealed, 0, out, IV_LENGTH + TAG_LENGTH, ctLength);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential encryption failed", e);
        }
    }

    @Override
    public String decrypt(String blob) {
        if (blob == null) return null;
        byte[] combined = Base64.getDecoder().decode(blob);
        if (combined.length < IV_LENGTH + TAG_LENGTH) {
            throw new IllegalArgumentException("Credential blob is truncated");
        }
        byte[] iv = Arrays.copyOfRange(combined, 0, IV_LENGTH);
        byte[] tag = Arrays.copyOfRange(combined, IV_LENGTH, IV_LENGTH + TAG_LENGTH);
        byte[] ciphertext = Arrays.copyOfRange(combined, IV_LENGTH + TAG_LENGTH, combined.length);

        byte[] sealed = new byte[ciphertext.length + TAG_LENGTH];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key(), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential decryption failed", e);
        }
    }

    private SecretKeySpec key() {
        String key = configuredKey;
        if (key == null || key.isEmpty()) {
            throw new CredentialMissingException("channelhub.crypto.encryption-key is not configured");
        }
        if (key.length() >= 64 && HEX.matcher(key).matches()) {
            return new SecretKeySpec(HexFormat.of().parseHex(key.substring(0, 64)), "AES");
        }
        if (key.length() < 32) {
            throw new CredentialMissingException("channelhub.crypto.encryption-key must be at least 32 characters");
        }
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        return new SecretKeySpec(Arrays.copyOf(bytes, 32), "AES");
    }
}
