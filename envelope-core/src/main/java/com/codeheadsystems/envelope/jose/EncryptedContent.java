package com.codeheadsystems.envelope.jose;

/**
 * Output of single-recipient encryption: the AES-GCM result plus what the recipient needs to
 * re-derive the key-encryption key.
 *
 * @param ciphertext         the ciphertext
 * @param iv                 the 96-bit IV
 * @param tag                the 128-bit tag
 * @param encryptedKey       the AES-KW wrapped content key
 * @param ephemeralPublicKey the sender's ephemeral public key
 * @param apu                Concat KDF PartyUInfo
 * @param apv                Concat KDF PartyVInfo
 */
public record EncryptedContent(byte[] ciphertext,
                               byte[] iv,
                               byte[] tag,
                               byte[] encryptedKey,
                               Jwk ephemeralPublicKey,
                               byte[] apu,
                               byte[] apv) {
}
