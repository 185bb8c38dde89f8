package com.simhub.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Приводит три формы push-запроса шлюза (JSON-тело, form-тело, query-строка)
 * к единому {@link GatewayEvent}, при необходимости расшифровывая данные.
 * <p>
 * Поддерживаются два вида шифрования:
 * <ul>
 *   <li>всё сообщение целиком в поле {@code p}, после расшифровки это JSON-объект;</li>
 *   <li>каждое строковое поле зашифровано отдельно, поле, которое не удалось
 *       расшифровать, остаётся как есть.</li>
 * </ul>
 */
public class PayloadDecoder {

  private static final Logger logger = LoggerFactory.getLogger(PayloadDecoder.class);

  static final String ENCRYPTED_PAYLOAD_FIELD = "p";

  /** Поля, которые в form/query приходят строками, но по смыслу являются числами. */
  private static final Set<String> NUMERIC_FIELDS =
      Set.of("type", "slot", "dbm", "smsTs", "telStartTs", "telEndTs");

  private static final Pattern SIGNED_INTEGER = Pattern.compile("-?\\d{1,18}");
  private static final Pattern DIGITS = Pattern.compile("\\d{1,18}");

  private final ObjectMapper objectMapper;
  private final EncryptionSettings encryption;
  private final AesCipher cipher;

  public PayloadDecoder(ObjectMapper objectMapper, EncryptionSettings encryption) {
    this.objectMapper = objectMapper;
    this.encryption = encryption;
    this.cipher = encryption.isEnabled() ? new AesCipher(encryption) : null;
  }

  /**
   * Разбирает JSON-тело запроса.
   *
   * @param body Тело запроса.
   * @return Событие шлюза.
   * @throws DecodeException если тело не является JSON-объектом.
   * @throws DecryptionException если не удалось расшифровать поле {@code p}.
   * @throws ValidationException если нет devId или type.
   */
  public GatewayEvent decodeJson(String body) {
    return toEvent(decrypt(parseJsonObject(body, false)));
  }

  /**
   * Разбирает тело в формате application/x-www-form-urlencoded.
   */
  public GatewayEvent decodeForm(String body) {
    QueryStringDecoder decoder = new QueryStringDecoder(body == null ? "" : body, StandardCharsets.UTF_8, false);
    return decodeQuery(decoder.parameters());
  }

  /**
   * Разбирает параметры query-строки (GET-push). Для повторяющихся ключей
   * берётся первое значение.
   */
  public GatewayEvent decodeQuery(Map<String, List<String>> parameters) {
    Map<String, Object> data = new LinkedHashMap<>();
    parameters.forEach((name, values) -> {
      if (!values.isEmpty()) {
        data.put(name, values.get(0));
      }
    });
    return toEvent(coerceNumericFields(decrypt(data)));
  }

  Map<String, Object> decrypt(Map<String, Object> data) {
    if (!encryption.isEnabled()) {
      return data;
    }
    Object wrapped = data.get(ENCRYPTED_PAYLOAD_FIELD);
    if (wrapped instanceof String && !((String) wrapped).isEmpty()) {
      String json = cipher.decrypt((String) wrapped);
      logger.debug("🔓 Расшифрован JSON-payload: {}", json);
      return parseJsonObject(json, true);
    }

    Map<String, Object> decrypted = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : data.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof String && !((String) value).isEmpty()) {
        decrypted.put(entry.getKey(), decryptField(entry.getKey(), (String) value));
      } else {
        decrypted.put(entry.getKey(), value);
      }
    }
    return decrypted;
  }

  private Object decryptField(String name, String value) {
    try {
      String plain = cipher.decrypt(value);
      if (DIGITS.matcher(plain).matches()) {
        long number = Long.parseLong(plain);
        return number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE ? (Object) (int) number : (Object) number;
      }
      return plain;
    } catch (DecryptionException e) {
      // поле не было зашифровано
      logger.trace("Поле '{}' оставлено без расшифровки: {}", name, e.getMessage());
      return value;
    }
  }

  private Map<String, Object> parseJsonObject(String json, boolean decrypted) {
    JsonNode node;
    try {
      node = objectMapper.readTree(json == null ? "" : json);
    } catch (JsonProcessingException e) {
      if (decrypted) {
        throw new DecryptionException("Расшифрованный payload не является JSON", e);
      }
      throw new DecodeException("Некорректный JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      String message = "Ожидался JSON-объект";
      if (decrypted) {
        throw new DecryptionException(message);
      }
      throw new DecodeException(message);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> map = objectMapper.convertValue(node, LinkedHashMap.class);
    return map;
  }

  private static Map<String, Object> coerceNumericFields(Map<String, Object> data) {
    for (String field : NUMERIC_FIELDS) {
      Object value = data.get(field);
      if (value instanceof String && SIGNED_INTEGER.matcher(((String) value).trim()).matches()) {
        long number = Long.parseLong(((String) value).trim());
        data.put(field, number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE ? (Object) (int) number : (Object) number);
      }
    }
    return data;
  }

  private static GatewayEvent toEvent(Map<String, Object> data) {
    Object devIdValue = data.get("devId");
    String devId = devIdValue == null ? "" : devIdValue.toString().trim();
    if (devId.isEmpty()) {
      throw new ValidationException("Отсутствует обязательное поле devId");
    }
    Object typeValue = data.get("type");
    Long type = typeValue instanceof Double || typeValue instanceof Float
        ? null
        : GatewayEvent.toLong(typeValue);
    if (type == null || type < Integer.MIN_VALUE || type > Integer.MAX_VALUE) {
      throw new ValidationException("Поле type отсутствует или не является целым числом: " + typeValue);
    }
    data.put("devId", devId);
    data.put("type", type.intValue());
    return new GatewayEvent(devId, type.intValue(), data);
  }
}
