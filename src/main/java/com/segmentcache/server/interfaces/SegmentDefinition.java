package com.segmentcache.server.interfaces;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.TypeAdapter;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Describes how to compute the members of a segment.
 * <p>
 * A definition is exactly one of three kinds, identified by {@link #getKind()}:
 * <ul>
 * <li> {@link RawQuery}: a SQL query whose first column yields member identifiers. </li>
 * <li> {@link StaticList}: a literal list of identifiers. </li>
 * <li> {@link ManagerLookup}: a call to a named method on a registered manager object, which returns
 * identifiers or objects that have identifiers. </li>
 * </ul>
 * The set of kinds is closed; this class cannot be subclassed outside of this file.
 * <p>
 * Definitions are immutable, and can be converted to and from JSON with {@link #toJson()} and
 * {@link #fromJson(String)}:
 * <pre><code>
 *     {"kind":"rawQuery","query":"select id from users where active = 1"}
 *     {"kind":"staticList","members":["1","2","3"]}
 *     {"kind":"managerLookup","source":"users","method":"findByPlan","arguments":["gold"]}
 * </code></pre>
 */
@JsonAdapter(SegmentDefinition.DefinitionTypeAdapter.class)
public abstract class SegmentDefinition {
  private static final Gson gson = new GsonBuilder()
      .serializeNulls()
      .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE) // whole numbers read back as Long
      .create();

  /**
   * The kinds of definition.
   */
  public static enum Kind {
    /** See {@link RawQuery}. */
    RAW_QUERY("rawQuery"),
    /** See {@link StaticList}. */
    STATIC_LIST("staticList"),
    /** See {@link ManagerLookup}. */
    MANAGER_LOOKUP("managerLookup");

    private final String jsonName;

    private Kind(String jsonName) {
      this.jsonName = jsonName;
    }

    String getJsonName() {
      return jsonName;
    }

    static Kind forJsonName(String name) {
      for (Kind k: values()) {
        if (k.jsonName.equals(name)) {
          return k;
        }
      }
      return null;
    }
  }

  private SegmentDefinition() {}

  /**
   * Creates a raw query definition. The query is passed to the database verbatim; no escaping or
   * validation is done, so it must only come from a trusted author.
   *
   * @param query the SQL query
   * @return a definition
   */
  public static RawQuery rawQuery(String query) {
    return new RawQuery(checkNotNull(query, "query must not be null"));
  }

  /**
   * Creates a static list definition.
   *
   * @param members the member identifiers
   * @return a definition
   */
  public static StaticList staticList(String... members) {
    return staticList(Arrays.asList(members));
  }

  /**
   * Creates a static list definition.
   *
   * @param members the member identifiers
   * @return a definition
   */
  public static StaticList staticList(List<String> members) {
    return new StaticList(checkNotNull(members, "members must not be null"));
  }

  /**
   * Creates a manager lookup definition.
   * <p>
   * Arguments must be representable in JSON, since the definition is stored and hashed in that
   * form: each one must be null, a {@link CharSequence} (kept as a {@code String}), a
   * {@link Boolean}, or one of the standard numeric types ({@code Integer}, {@code Long},
   * {@code Short}, {@code Byte}, {@code Double}, {@code Float}, {@code BigInteger},
   * {@code BigDecimal}). Floating-point arguments must be finite.
   *
   * @param source the name that the manager object was registered under
   * @param method the name of a public method on the manager
   * @param arguments arguments to pass to the method
   * @return a definition
   * @throws IllegalArgumentException if an argument is of any other type
   */
  public static ManagerLookup managerLookup(String source, String method, Object... arguments) {
    List<Object> args = new ArrayList<>();
    if (arguments != null) {
      for (Object arg: arguments) {
        args.add(checkArgumentValue(arg));
      }
    }
    return new ManagerLookup(checkNotNull(source, "source must not be null"),
        checkNotNull(method, "method must not be null"),
        args);
  }

  private static Object checkArgumentValue(Object arg) {
    if (arg == null || arg instanceof Boolean || arg instanceof Integer || arg instanceof Long ||
        arg instanceof Short || arg instanceof Byte || arg instanceof BigInteger || arg instanceof BigDecimal) {
      return arg;
    }
    if (arg instanceof CharSequence) {
      return arg.toString();
    }
    if (arg instanceof Double || arg instanceof Float) {
      double d = ((Number)arg).doubleValue();
      checkArgument(!Double.isNaN(d) && !Double.isInfinite(d), "manager lookup argument must be a finite number, was %s", arg);
      return arg;
    }
    throw new IllegalArgumentException("manager lookup argument must be a string, number, boolean or null, was " +
        arg.getClass().getName());
  }

  /**
   * Returns the kind of definition.
   *
   * @return the kind
   */
  public abstract Kind getKind();

  /**
   * Serializes the definition to JSON.
   *
   * @return a JSON string
   */
  public String toJson() {
    return gson.toJson(this, SegmentDefinition.class);
  }

  /**
   * Parses a definition from JSON.
   *
   * @param json a JSON string as produced by {@link #toJson()}
   * @return the definition
   * @throws IllegalArgumentException if the JSON is malformed or describes an unknown kind
   */
  public static SegmentDefinition fromJson(String json) {
    try {
      SegmentDefinition def = gson.fromJson(json, SegmentDefinition.class);
      if (def == null) {
        throw new IllegalArgumentException("segment definition JSON was empty");
      }
      return def;
    } catch (JsonParseException | IllegalStateException e) {
      throw new IllegalArgumentException("invalid segment definition JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Returns a content hash of this definition. Two definitions have the same hash if and only if
   * they have the same JSON representation.
   *
   * @return a base64-encoded SHA-256 digest
   */
  public String contentHash() {
    byte[] digest = DigestUtils.sha256(toJson().getBytes(StandardCharsets.UTF_8));
    return Base64.getEncoder().encodeToString(digest);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SegmentDefinition && toJson().equals(((SegmentDefinition)o).toJson());
  }

  @Override
  public int hashCode() {
    return toJson().hashCode();
  }

  @Override
  public String toString() {
    return toJson();
  }

  /**
   * A definition whose members are the first column of each row returned by a SQL query.
   */
  public static final class RawQuery extends SegmentDefinition {
    private final String query;

    private RawQuery(String query) {
      this.query = query;
    }

    @Override
    public Kind getKind() {
      return Kind.RAW_QUERY;
    }

    /**
     * The SQL query.
     * @return the query string
     */
    public String getQuery() {
      return query;
    }
  }

  /**
   * A definition whose members are a literal list. Duplicates are dropped; the order of first
   * appearance is kept.
   */
  public static final class StaticList extends SegmentDefinition {
    private final List<String> members;

    private StaticList(List<String> members) {
      this.members = ImmutableList.copyOf(new LinkedHashSet<>(members));
    }

    @Override
    public Kind getKind() {
      return Kind.STATIC_LIST;
    }

    /**
     * The member identifiers.
     * @return an immutable list with no duplicates
     */
    public List<String> getMembers() {
      return members;
    }
  }

  /**
   * A definition whose members are returned by a method on a named manager object.
   */
  public static final class ManagerLookup extends SegmentDefinition {
    private final String source;
    private final String method;
    private final List<Object> arguments;

    private ManagerLookup(String source, String method, List<Object> arguments) {
      this.source = source;
      this.method = method;
      this.arguments = new ArrayList<>(arguments); // may contain nulls, so not an ImmutableList
    }

    @Override
    public Kind getKind() {
      return Kind.MANAGER_LOOKUP;
    }

    /**
     * The name of the registered manager.
     * @return the source name
     */
    public String getSource() {
      return source;
    }

    /**
     * The name of the method to call.
     * @return the method name
     */
    public String getMethod() {
      return method;
    }

    /**
     * The arguments to pass to the method.
     * @return a copy of the argument list
     */
    public List<Object> getArguments() {
      return new ArrayList<>(arguments);
    }
  }

  static final class DefinitionTypeAdapter extends TypeAdapter<SegmentDefinition> {
    @Override
    public void write(JsonWriter out, SegmentDefinition def) throws IOException {
      if (def == null) {
        out.nullValue();
        return;
      }
      out.beginObject();
      out.name("kind").value(def.getKind().getJsonName());
      switch (def.getKind()) {
      case RAW_QUERY:
        out.name("query").value(((RawQuery)def).query);
        break;
      case STATIC_LIST:
        out.name("members").beginArray();
        for (String m: ((StaticList)def).members) {
          out.value(m);
        }
        out.endArray();
        break;
      case MANAGER_LOOKUP:
        ManagerLookup lookup = (ManagerLookup)def;
        out.name("source").value(lookup.source);
        out.name("method").value(lookup.method);
        out.name("arguments").beginArray();
        for (Object arg: lookup.arguments) {
          if (arg == null) {
            out.nullValue();
          } else if (arg instanceof String) {
            out.value((String)arg);
          } else if (arg instanceof Boolean) {
            out.value(((Boolean)arg).booleanValue());
          } else {
            out.value((Number)arg);
          }
        }
        out.endArray();
        break;
      }
      out.endObject();
    }

    @Override
    public SegmentDefinition read(JsonReader in) throws IOException {
      if (in.peek() == JsonToken.NULL) {
        in.nextNull();
        return null;
      }
      String kindName = null, query = null, source = null, method = null;
      List<String> members = new ArrayList<>();
      List<Object> arguments = new ArrayList<>();
      in.beginObject();
      while (in.hasNext()) {
        switch (in.nextName()) {
        case "kind":
          kindName = in.nextString();
          break;
        case "query":
          query = in.nextString();
          break;
        case "members":
          in.beginArray();
          while (in.hasNext()) {
            members.add(in.nextString());
          }
          in.endArray();
          break;
        case "source":
          source = in.nextString();
          break;
        case "method":
          method = in.nextString();
          break;
        case "arguments":
          in.beginArray();
          while (in.hasNext()) {
            JsonElement e = gson.fromJson(in, JsonElement.class);
            if (e.isJsonObject() || e.isJsonArray()) {
              throw new JsonParseException("managerLookup arguments must be strings, numbers, booleans or null");
            }
            try {
              arguments.add(checkArgumentValue(gson.fromJson(e, Object.class)));
            } catch (IllegalArgumentException ex) {
              throw new JsonParseException(ex.getMessage(), ex);
            }
          }
          in.endArray();
          break;
        default:
          in.skipValue();
        }
      }
      in.endObject();

      Kind kind = Kind.forJsonName(kindName);
      if (kind == null) {
        throw new JsonParseException("unknown segment definition kind: " + kindName);
      }
      switch (kind) {
      case RAW_QUERY:
        if (query == null) {
          throw new JsonParseException("rawQuery definition requires \"query\"");
        }
        return new RawQuery(query);
      case STATIC_LIST:
        return new StaticList(members);
      default:
        if (source == null || method == null) {
          throw new JsonParseException("managerLookup definition requires \"source\" and \"method\"");
        }
        return new ManagerLookup(source, method, arguments);
      }
    }
  }
}
