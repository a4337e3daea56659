package io.github.drompincen.channelhub.runtime.crypto;

/**
 * Turns secrets into opaque blobs for storage and back. Implementations must never log either side.
 */
public interface CredentialVault {

    String encrypt(String plaintext);

    String decrypt(String blob);
}
