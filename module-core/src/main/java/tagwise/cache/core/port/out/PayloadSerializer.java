package tagwise.cache.core.port.out;

/**
 * Port for turning cached values into the string form kept in the store and back.
 *
 * <p>Implemented by module-infra (Jackson). The cache itself treats payloads as opaque.
 */
public interface PayloadSerializer {

  String serialize(Object value);

  Object deserialize(String payload);
}
