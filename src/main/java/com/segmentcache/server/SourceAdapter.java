package com.segmentcache.server;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Primitives;
import com.launchdarkly.logging.LDLogger;
import com.segmentcache.server.interfaces.SegmentDefinition;
import com.segmentcache.server.interfaces.SegmentDefinition.ManagerLookup;
import com.segmentcache.server.interfaces.SegmentDefinition.RawQuery;
import com.segmentcache.server.interfaces.SegmentDefinition.StaticList;
import com.segmentcache.server.interfaces.SegmentMember;
import com.segmentcache.server.subsystems.SegmentSources;
import com.segmentcache.server.subsystems.SourceException;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import javax.sql.DataSource;

import static com.segmentcache.server.subsystems.SourceException.Kind.CONNECTION_FAILED;
import static com.segmentcache.server.subsystems.SourceException.Kind.EMPTY_RESULT_AMBIGUOUS;
import static com.segmentcache.server.subsystems.SourceException.Kind.METHOD_NOT_FOUND;
import static com.segmentcache.server.subsystems.SourceException.Kind.QUERY_MALFORMED;

/**
 * Turns a segment definition into the list of member identifiers it currently describes.
 * <p>
 * The adapter has no state of its own besides the configured sources, so it is safe to call from
 * any number of refresh threads at once. Results may contain duplicates; the store de-duplicates.
 */
final class SourceAdapter {
  // SQLSTATE class for connection exceptions
  private static final String SQLSTATE_CONNECTION_CLASS = "08";

  private final SegmentSources sources;
  private final LDLogger logger;

  SourceAdapter(SegmentSources sources, LDLogger logger) {
    this.sources = sources;
    this.logger = logger;
  }

  List<String> evaluate(SegmentDefinition definition) throws SourceException {
    switch (definition.getKind()) {
    case RAW_QUERY:
      return runQuery(((RawQuery)definition).getQuery());
    case STATIC_LIST:
      return ((StaticList)definition).getMembers();
    case MANAGER_LOOKUP:
      return runLookup((ManagerLookup)definition);
    default:
      throw new IllegalArgumentException("unknown definition kind: " + definition.getKind());
    }
  }

  private List<String> runQuery(String query) throws SourceException {
    DataSource dataSource = sources.getExecDataSource();
    if (dataSource == null) {
      throw new SourceException(CONNECTION_FAILED,
          "no SQL connection named \"" + sources.getExecConnection() + "\" is configured");
    }

    Connection connection;
    try {
      connection = dataSource.getConnection();
    } catch (SQLException e) {
      throw new SourceException(CONNECTION_FAILED,
          "could not connect to \"" + sources.getExecConnection() + "\": " + e.getMessage(), e);
    }

    try (Connection c = connection) {
      boolean wasReadOnly = c.isReadOnly();
      c.setReadOnly(true);
      try (Statement statement = c.createStatement()) {
        if (!statement.execute(query)) {
          throw new SourceException(EMPTY_RESULT_AMBIGUOUS, "query did not produce a result set");
        }
        List<String> ret = new ArrayList<>();
        try (ResultSet rs = statement.getResultSet()) {
          while (rs.next()) {
            Object value = rs.getObject(1);
            if (value != null) {
              ret.add(identifierFromValue(value));
            }
          }
        }
        logger.debug("Query on \"{}\" returned {} rows", sources.getExecConnection(), ret.size());
        return ret;
      } finally {
        c.setReadOnly(wasReadOnly);
      }
    } catch (SQLException e) {
      throw fromSqlException(e);
    }
  }

  private static SourceException fromSqlException(SQLException e) {
    String state = e.getSQLState();
    if (state != null && state.startsWith(SQLSTATE_CONNECTION_CLASS)) {
      return new SourceException(CONNECTION_FAILED, "connection failed during query: " + e.getMessage(), e);
    }
    return new SourceException(QUERY_MALFORMED, "query failed: " + e.getMessage(), e);
  }

  private List<String> runLookup(ManagerLookup lookup) throws SourceException {
    Object manager = sources.getManagers().get(lookup.getSource());
    if (manager == null) {
      throw new SourceException(METHOD_NOT_FOUND, "no manager named \"" + lookup.getSource() + "\" is registered");
    }
    List<Object> args = lookup.getArguments();

    boolean nameFound = false;
    for (Method m: manager.getClass().getMethods()) {
      if (!m.getName().equals(lookup.getMethod())) {
        continue;
      }
      nameFound = true;
      if (Modifier.isStatic(m.getModifiers()) || m.getParameterCount() != args.size()) {
        continue;
      }
      Object[] coerced = coerceArguments(m.getParameterTypes(), args);
      if (coerced == null) {
        continue;
      }
      logger.debug("Calling {}.{} with {} argument(s)", lookup.getSource(), lookup.getMethod(), args.size());
      Object result = invoke(manager, m, coerced, lookup);
      if (result == null) {
        throw new SourceException(EMPTY_RESULT_AMBIGUOUS,
            lookup.getSource() + "." + lookup.getMethod() + " returned null");
      }
      return identifiersFromResult(result, lookup);
    }

    throw new SourceException(METHOD_NOT_FOUND, nameFound ?
        ("no method " + lookup.getSource() + "." + lookup.getMethod() + " accepts arguments " + args) :
        ("manager \"" + lookup.getSource() + "\" has no public method \"" + lookup.getMethod() + "\""));
  }

  private static Object invoke(Object manager, Method m, Object[] args, ManagerLookup lookup) throws SourceException {
    try {
      if (!Modifier.isPublic(m.getDeclaringClass().getModifiers())) {
        m.setAccessible(true);
      }
      return m.invoke(manager, args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof SQLException) {
        throw fromSqlException((SQLException)cause);
      }
      throw new SourceException(QUERY_MALFORMED,
          lookup.getSource() + "." + lookup.getMethod() + " failed: " + cause, cause);
    } catch (IllegalAccessException | RuntimeException e) {
      throw new SourceException(METHOD_NOT_FOUND,
          "cannot call " + lookup.getSource() + "." + lookup.getMethod() + ": " + e, e);
    }
  }

  // Returns null if the arguments cannot be passed to parameters of these types.
  private static Object[] coerceArguments(Class<?>[] types, List<Object> args) {
    Object[] ret = new Object[types.length];
    for (int i = 0; i < types.length; i++) {
      Object arg = args.get(i);
      Class<?> type = Primitives.wrap(types[i]);
      if (arg == null) {
        if (types[i].isPrimitive()) {
          return null;
        }
        ret[i] = null;
      } else if (type.isInstance(arg)) {
        ret[i] = arg;
      } else if (arg instanceof Number && Number.class.isAssignableFrom(type)) {
        Object n = coerceNumber((Number)arg, type);
        if (n == null) {
          return null;
        }
        ret[i] = n;
      } else if (type == String.class && arg instanceof CharSequence) {
        ret[i] = arg.toString();
      } else {
        return null;
      }
    }
    return ret;
  }

  // Definitions read back from JSON hold numbers as Long or Double.
  private static Object coerceNumber(Number n, Class<?> type) {
    double d = n.doubleValue();
    boolean integral = d == Math.rint(d) && !Double.isInfinite(d);
    if (type == Double.class) {
      return d;
    }
    if (type == Float.class) {
      return n.floatValue();
    }
    if (!integral) {
      return null;
    }
    if (type == Long.class) {
      return n.longValue();
    }
    if (type == Integer.class && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
      return n.intValue();
    }
    if (type == Short.class && d >= Short.MIN_VALUE && d <= Short.MAX_VALUE) {
      return n.shortValue();
    }
    if (type == Byte.class && d >= Byte.MIN_VALUE && d <= Byte.MAX_VALUE) {
      return n.byteValue();
    }
    return null;
  }

  private static List<String> identifiersFromResult(Object result, ManagerLookup lookup) throws SourceException {
    Iterator<?> elements;
    Stream<?> stream = null;
    if (result instanceof Iterable<?>) {
      elements = ((Iterable<?>)result).iterator();
    } else if (result instanceof Stream<?>) {
      stream = (Stream<?>)result;
      elements = stream.iterator();
    } else if (result instanceof Iterator<?>) {
      elements = (Iterator<?>)result;
    } else if (result.getClass().isArray()) {
      int length = Array.getLength(result);
      List<Object> items = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        items.add(Array.get(result, i));
      }
      elements = items.iterator();
    } else {
      throw new SourceException(METHOD_NOT_FOUND, lookup.getSource() + "." + lookup.getMethod() +
          " returned " + result.getClass().getName() + ", which is not a collection");
    }

    try {
      ImmutableList.Builder<String> ret = ImmutableList.builder();
      while (elements.hasNext()) {
        Object element = elements.next();
        if (element != null) {
          ret.add(identifierFromElement(element));
        }
      }
      return ret.build();
    } finally {
      if (stream != null) {
        stream.close();
      }
    }
  }

  private static String identifierFromElement(Object element) throws SourceException {
    if (element instanceof CharSequence || element instanceof Number) {
      return identifierFromValue(element);
    }
    if (element instanceof SegmentMember) {
      return ((SegmentMember)element).getSegmentMemberId();
    }
    Object id;
    try {
      Method getter = element.getClass().getMethod("getId");
      if (!Modifier.isPublic(getter.getDeclaringClass().getModifiers())) {
        getter.setAccessible(true);
      }
      id = getter.invoke(element);
    } catch (NoSuchMethodException e) {
      id = idField(element);
    } catch (IllegalAccessException | InvocationTargetException | RuntimeException e) {
      throw new SourceException(METHOD_NOT_FOUND,
          "cannot read the identifier of " + element.getClass().getName() + ": " + e, e);
    }
    if (id == null) {
      throw new SourceException(METHOD_NOT_FOUND, "element of type " + element.getClass().getName() +
          " has a null identifier");
    }
    return identifierFromValue(id);
  }

  private static Object idField(Object element) throws SourceException {
    try {
      Field f = element.getClass().getField("id");
      if (!Modifier.isPublic(f.getDeclaringClass().getModifiers())) {
        f.setAccessible(true);
      }
      return f.get(element);
    } catch (NoSuchFieldException | IllegalAccessException | RuntimeException e) {
      throw new SourceException(METHOD_NOT_FOUND, "element of type " + element.getClass().getName() +
          " has no getId() method or id field", e);
    }
  }

  static String identifierFromValue(Object value) {
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number)value).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
        return String.valueOf((long)d);
      }
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal)value).stripTrailingZeros().toPlainString();
    }
    return value.toString();
  }
}
