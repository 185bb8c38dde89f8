package com.simhub.codec;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * AES-128 CBC с PKCS#7 padding: алгоритм, который поддерживает прошивка шлюза.
 * <p>
 * Шифртекст приходит в URL-safe Base64, иногда без выравнивающих '='.
 */
public class AesCipher {

  private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";

  private final SecretKeySpec key;
  private final IvParameterSpec iv;

  public AesCipher(EncryptionSettings settings) {
    this.key = new SecretKeySpec(settings.key(), "AES");
    this.iv = new IvParameterSpec(settings.iv());
  }

  /**
   * Расшифровывает строку.
   *
   * @param encoded Base64 (URL-safe или стандартный) шифртекст.
   * @return Открытый текст в UTF-8.
   * @throws DecryptionException если Base64 некорректен, padding не сошёлся
   *     или результат не является корректным UTF-8.
   */
  public String decrypt(String encoded) {
    byte[] cipherText;
    try {
      cipherText = Base64.getDecoder().decode(toStandardBase64(encoded));
    } catch (IllegalArgumentException e) {
      throw new DecryptionException("Некорректный Base64: " + e.getMessage(), e);
    }
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, iv);
      byte[] plain = cipher.doFinal(cipherText);
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(plain))
          .toString();
    } catch (GeneralSecurityException e) {
      throw new DecryptionException("AES расшифровка не удалась: " + e.getMessage(), e);
    } catch (CharacterCodingException e) {
      throw new DecryptionException("Расшифрованные данные не являются UTF-8", e);
    }
  }

  static String toStandardBase64(String encoded) {
    StringBuilder base64 = new StringBuilder(encoded.trim().replace('-', '+').replace('_', '/'));
    while (base64.length() % 4 != 0) {
      base64.append('=');
    }
    return base64.toString();
  }
}
