package tagwise.cache.infrastructure.serializer;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import tagwise.cache.core.port.out.PayloadSerializer;
import tagwise.cache.infrastructure.executor.LogicExecutor;
import tagwise.cache.infrastructure.executor.TaskContext;
import tagwise.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Jackson 기반 {@link PayloadSerializer}
 *
 * <p>캐시는 임의 타입의 값을 받으므로 타입 정보를 함께 기록합니다 ({@code ["com.example.Order",{...}]}). 그래야 읽을 때
 * 원래 타입으로 복원되고 {@code getItem(key, Class)}가 동작합니다.
 *
 * <ul>
 *   <li>{@code DefaultTyping.EVERYTHING} + WRAPPER_ARRAY: record/final 클래스, Long 등도 타입이 보존됨
 *   <li>JavaTimeModule: Instant, LocalDateTime 등 ISO-8601 문자열
 *   <li>FAIL_ON_EMPTY_BEANS off: 필드 없는 객체도 저장 가능
 * </ul>
 *
 * <p>직렬화 실패는 {@code CacheStoreException}으로 번역됩니다.
 */
@RequiredArgsConstructor
public class JacksonPayloadSerializer implements PayloadSerializer {

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public JacksonPayloadSerializer(LogicExecutor executor) {
    this(defaultObjectMapper(), executor);
  }

  @Override
  public String serialize(Object value) {
    return executor.executeWithTranslation(
        () -> objectMapper.writeValueAsString(value),
        ExceptionTranslator.forJson(),
        TaskContext.of("PayloadSerializer", "serialize"));
  }

  @Override
  public Object deserialize(String payload) {
    if (payload == null) {
      return null;
    }
    return executor.executeWithTranslation(
        () -> objectMapper.readValue(payload, Object.class),
        ExceptionTranslator.forJson(),
        TaskContext.of("PayloadSerializer", "deserialize"));
  }

  @SuppressWarnings("deprecation")
  public static ObjectMapper defaultObjectMapper() {
    PolymorphicTypeValidator validator =
        BasicPolymorphicTypeValidator.builder().allowIfBaseType(Object.class).build();

    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.activateDefaultTyping(
        validator, ObjectMapper.DefaultTyping.EVERYTHING, JsonTypeInfo.As.WRAPPER_ARRAY);
    return mapper;
  }
}
