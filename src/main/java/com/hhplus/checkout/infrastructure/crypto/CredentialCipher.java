package com.hhplus.checkout.infrastructure.crypto;

import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.SystemException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * 결제 프로세서 자격 증명 암복호화 (AES-256-GCM)
 *
 * - 키: 설정값(checkout.crypto.encryption-key)에서 PBKDF2WithHmacSHA256(100,000회)으로 유도한 256bit 키
 * - 저장 형식: base64(iv) + ":" + base64(authTag) + ":" + base64(ciphertext)
 * - IV는 암호화마다 새로 생성 (12 bytes)
 */
@Component
public class CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BYTES = 16;
    private static final int PBKDF2_ITERATIONS = 100_000;
    private static final int KEY_LENGTH_BITS = 256;
    private static final byte[] SALT = "checkout-credential-salt".getBytes(StandardCharsets.UTF_8);

    private final SecretKey key;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialCipher(@Value("${checkout.crypto.encryption-key}") String encryptionKey) {
        if (encryptionKey == null || encryptionKey.isBlank()) {
            throw new IllegalStateException("checkout.crypto.encryption-key가 설정되지 않았습니다");
        }
        this.key = deriveKey(encryptionKey);
    }

    public String encrypt(String plainText) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, iv));
            byte[] sealed = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));

            // JCE는 tag를 암호문 뒤에 붙여 반환
            byte[] data = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH_BYTES, sealed.length);

            Base64.Encoder encoder = Base64.getEncoder();
            return encoder.encodeToString(iv) + ":" + encoder.encodeToString(tag) + ":" + encoder.encodeToString(data);
        } catch (GeneralSecurityException e) {
            throw new SystemException(ErrorCode.CREDENTIAL_CRYPTO_FAILED, e);
        }
    }

    /**
     * @throws SystemException 형식 오류, 키 불일치 또는 변조된 암호문
     */
    public String decrypt(String encrypted) {
        String[] parts = encrypted == null ? new String[0] : encrypted.split(":");
        if (parts.length != 3) {
            throw new SystemException(ErrorCode.CREDENTIAL_CRYPTO_FAILED, "암호문 형식이 올바르지 않습니다");
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] iv = decoder.decode(parts[0]);
            byte[] tag = decoder.decode(parts[1]);
            byte[] data = decoder.decode(parts[2]);

            byte[] sealed = new byte[data.length + tag.length];
            System.arraycopy(data, 0, sealed, 0, data.length);
            System.arraycopy(tag, 0, sealed, data.length, tag.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SystemException(ErrorCode.CREDENTIAL_CRYPTO_FAILED, e);
        }
    }

    private static SecretKey deriveKey(String secret) {
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), SALT, PBKDF2_ITERATIONS, KEY_LENGTH_BITS);
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            spec.clearPassword();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("암호화 키 유도에 실패했습니다", e);
        }
    }
}
