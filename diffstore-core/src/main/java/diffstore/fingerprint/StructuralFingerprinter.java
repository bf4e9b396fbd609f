package diffstore.fingerprint;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Default {@link Fingerprinter}: 64-bit FNV-1a over a tagged walk of the value's structure.
 * Has no external dependencies.
 *
 * <p>Supported shapes:
 * <ul>
 *   <li>{@code null}, booleans, characters and strings (any {@link CharSequence})</li>
 *   <li>integral numbers: {@code Byte}, {@code Short}, {@code Integer}, {@code Long} and
 *       {@code BigInteger} hash as one kind, so {@code 1} and {@code 1L} match</li>
 *   <li>{@code Float} and {@code Double} as one kind; {@code BigDecimal} by its
 *       value with trailing zeros stripped</li>
 *   <li>{@code byte[]}, enums (by name), {@link UUID}, {@link URI}, {@code java.time}
 *       values, {@link Optional} (empty hashes as {@code null})</li>
 *   <li>ordered sequences: lists, other non-set collections and arrays</li>
 *   <li>unordered containers: sets and maps, insensitive to iteration order</li>
 *   <li>records and plain objects: their instance fields by name, ignoring
 *       {@code static} and {@code transient} ones</li>
 * </ul>
 *
 * <p>Any other JDK type (threads, streams, connections...) and any cyclic object graph
 * is rejected with a {@link FingerprintException}.
 *
 * <p>This class is thread-safe and stateless apart from a per-class field cache.
 */
public final class StructuralFingerprinter implements Fingerprinter {
  static final StructuralFingerprinter INSTANCE = new StructuralFingerprinter();

  private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
  private static final long FNV_PRIME = 0x100000001b3L;

  private static final byte NULL = 0;
  private static final byte BOOLEAN = 1;
  private static final byte INTEGER = 2;
  private static final byte FLOAT = 3;
  private static final byte DECIMAL = 4;
  private static final byte STRING = 5;
  private static final byte BYTES = 6;
  private static final byte ENUM = 7;
  private static final byte TEXTUAL = 8;
  private static final byte SEQUENCE = 9;
  private static final byte SET = 10;
  private static final byte MAP = 11;
  private static final byte STRUCT = 12;

  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private static final ClassValue<List<Field>> FIELDS = new ClassValue<>() {
    @Override
    protected List<Field> computeValue(Class<?> type) {
      return instanceFields(type);
    }
  };

  StructuralFingerprinter() {
  }

  @Override
  public Fingerprint fingerprint(Object value) {
    return new Fingerprint(hash(value, Collections.newSetFromMap(new IdentityHashMap<>())));
  }

  private long hash(Object value, Set<Object> path) {
    if (value == null) {
      return new Fnv(NULL).value();
    }
    if (value instanceof Optional<?> optional) {
      return hash(optional.orElse(null), path);
    }
    if (value instanceof Boolean b) {
      return new Fnv(BOOLEAN).update(b ? (byte) 1 : (byte) 0).value();
    }
    if (value instanceof CharSequence || value instanceof Character) {
      return new Fnv(STRING).update(value.toString()).value();
    }
    if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
      return new Fnv(INTEGER).update(((Number) value).longValue()).value();
    }
    if (value instanceof BigInteger big) {
      if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
        return new Fnv(INTEGER).update(big.longValue()).value();
      }
      return new Fnv(DECIMAL).update(big.toString()).value();
    }
    if (value instanceof Float || value instanceof Double) {
      return new Fnv(FLOAT).update(Double.doubleToLongBits(((Number) value).doubleValue())).value();
    }
    if (value instanceof BigDecimal decimal) {
      String plain = decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
      return new Fnv(DECIMAL).update(plain).value();
    }
    if (value instanceof byte[] bytes) {
      return new Fnv(BYTES).update(bytes.length).update(bytes).value();
    }
    if (value instanceof Enum<?> e) {
      return new Fnv(ENUM).update(e.getDeclaringClass().getName()).update(e.name()).value();
    }
    if (isTextual(value)) {
      return new Fnv(TEXTUAL).update(value.getClass().getName()).update(value.toString()).value();
    }

    if (!path.add(value)) {
      throw new FingerprintException("Cyclic reference through " + value.getClass().getName());
    }
    try {
      if (value instanceof Map<?, ?> map) {
        return hashMap(map, path);
      }
      if (value instanceof Set<?> set) {
        return hashSet(set, path);
      }
      if (value instanceof Collection<?> collection) {
        return hashSequence(collection, collection.size(), path);
      }
      if (value.getClass().isArray()) {
        return hashArray(value, path);
      }
      return hashStruct(value, path);
    } finally {
      path.remove(value);
    }
  }

  private long hashMap(Map<?, ?> map, Set<Object> path) {
    long combined = 0L;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      combined ^= pair(hash(entry.getKey(), path), hash(entry.getValue(), path));
    }
    return new Fnv(MAP).update(map.size()).update(combined).value();
  }

  private long hashSet(Set<?> set, Set<Object> path) {
    long combined = 0L;
    for (Object element : set) {
      combined ^= hash(element, path);
    }
    return new Fnv(SET).update(set.size()).update(combined).value();
  }

  private long hashSequence(Iterable<?> elements, int size, Set<Object> path) {
    Fnv fnv = new Fnv(SEQUENCE).update(size);
    for (Object element : elements) {
      fnv.update(hash(element, path));
    }
    return fnv.value();
  }

  private long hashArray(Object array, Set<Object> path) {
    int length = Array.getLength(array);
    List<Object> elements = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      elements.add(Array.get(array, i));
    }
    return hashSequence(elements, length, path);
  }

  private long hashStruct(Object value, Set<Object> path) {
    Class<?> type = value.getClass();
    if (isPlatformClass(type) || type.isSynthetic() || type.isHidden()) {
      throw new FingerprintException("Unsupported type for fingerprinting: " + type.getName());
    }
    List<Field> fields = FIELDS.get(type);
    long combined = 0L;
    for (Field field : fields) {
      Object fieldValue;
      try {
        fieldValue = field.get(value);
      } catch (IllegalAccessException e) {
        throw new FingerprintException("Cannot read field " + type.getName() + "." + field.getName(), e);
      }
      combined ^= pair(new Fnv(STRING).update(field.getName()).value(), hash(fieldValue, path));
    }
    return new Fnv(STRUCT).update(fields.size()).update(combined).value();
  }

  private static long pair(long first, long second) {
    return new Fnv(SEQUENCE).update(2).update(first).update(second).value();
  }

  private static boolean isTextual(Object value) {
    if (value instanceof UUID || value instanceof URI || value instanceof ZoneId) {
      return true;
    }
    return (value instanceof TemporalAccessor || value instanceof TemporalAmount)
        && value.getClass().getName().startsWith("java.time.");
  }

  private static boolean isPlatformClass(Class<?> type) {
    String name = type.getName();
    return name.startsWith("java.") || name.startsWith("javax.")
        || name.startsWith("jdk.") || name.startsWith("sun.") || name.startsWith("com.sun.");
  }

  private static List<Field> instanceFields(Class<?> type) {
    List<Field> fields = new ArrayList<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Field field : c.getDeclaredFields()) {
        int modifiers = field.getModifiers();
        if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
          continue;
        }
        try {
          field.setAccessible(true);
        } catch (InaccessibleObjectException | SecurityException e) {
          throw new FingerprintException("Cannot access field " + c.getName() + "." + field.getName(), e);
        }
        fields.add(field);
      }
    }
    return List.copyOf(fields);
  }

  /** FNV-1a 64 accumulator seeded with a kind tag. */
  private static final class Fnv {
    private long hash = FNV_OFFSET_BASIS;

    private Fnv(byte kind) {
      update(kind);
    }

    private Fnv update(byte b) {
      hash ^= (b & 0xff);
      hash *= FNV_PRIME;
      return this;
    }

    private Fnv update(int v) {
      for (int i = 0; i < Integer.BYTES; i++) {
        update((byte) (v >>> (8 * i)));
      }
      return this;
    }

    private Fnv update(long v) {
      for (int i = 0; i < Long.BYTES; i++) {
        update((byte) (v >>> (8 * i)));
      }
      return this;
    }

    private Fnv update(byte[] bytes) {
      for (byte b : bytes) {
        update(b);
      }
      return this;
    }

    private Fnv update(String s) {
      byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
      return update(bytes.length).update(bytes);
    }

    private long value() {
      return hash;
    }
  }
}
