package com.segmentcache.server.integrations;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.launchdarkly.logging.LDLogger;
import com.segmentcache.server.interfaces.SetOperation;
import com.segmentcache.server.subsystems.MemberSetStore;
import com.segmentcache.server.subsystems.MemberSetStoreTypes.MemberSetVersion;
import com.segmentcache.server.subsystems.StoreUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.ScanParams;
import redis.clients.jedis.ScanResult;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.util.JedisURIHelper;

/**
 * Redis layout, for a segment with key {@code id} and a prefix {@code p}:
 * <ul>
 * <li>{@code p:id:members:N} - a set holding the members of version N</li>
 * <li>{@code p:id:meta:N} - a hash with the count, creation time and definition hash of version N;
 * it is written last, so its presence means version N is complete</li>
 * <li>{@code p:id:current} - the number of the current version</li>
 * <li>{@code p:id:seq} - counter used to allocate version numbers</li>
 * <li>{@code p:id:versions} - a set of every version number that still has data</li>
 * </ul>
 */
final class RedisMemberSetStoreImpl implements MemberSetStore {
  static final int MEMBER_CHUNK_SIZE = 10000;

  private static final String META_COUNT = "count";
  private static final String META_CREATED_AT = "createdAt";
  private static final String META_DEFINITION_HASH = "definitionHash";

  // Reads the pointer and tests membership in one atomic step, so a concurrent promote or gc can
  // never make us look at a half-deleted version.
  private static final String IS_MEMBER_SCRIPT =
      "local v = redis.call('GET', KEYS[1]) " +
      "if not v then return 0 end " +
      "return redis.call('SISMEMBER', ARGV[1] .. v, ARGV[2])";

  private final JedisPool pool;
  private final String prefix;
  private final LDLogger logger;
  private PromoteListener promoteListener;

  RedisMemberSetStoreImpl(RedisMemberSetStoreBuilder builder, LDLogger logger) {
    this.logger = logger;

    // There is no builder for JedisPool, just a large number of constructor overloads. The
    // overloads that accept a URI do not accept the other parameters we need to set, so we need
    // to decompose the URI.
    String host = builder.uri.getHost();
    int port = builder.uri.getPort();
    String password = builder.password == null ? JedisURIHelper.getPassword(builder.uri) : builder.password;
    int database = builder.database == null ? JedisURIHelper.getDBIndex(builder.uri): builder.database.intValue();
    boolean tls = builder.tls || builder.uri.getScheme().equals("rediss");

    String extra = tls ? " with TLS" : "";
    if (password != null) {
      extra = extra + (extra.isEmpty() ? " with" : " and") + " password";
    }
    logger.info("Using Redis member set store at {}:{}/{}{}", host, port, database, extra);

    JedisPoolConfig poolConfig = (builder.poolConfig != null) ? builder.poolConfig : new JedisPoolConfig();
    this.pool = new JedisPool(poolConfig,
        host,
        port,
        (int)builder.connectTimeout.toMillis(),
        (int)builder.socketTimeout.toMillis(),
        password,
        database,
        null, // clientName
        tls,
        null, // sslSocketFactory
        null, // sslParameters
        null  // hostnameVerifier
        );

    this.prefix = (builder.prefix == null || builder.prefix.isEmpty()) ?
        RedisMemberSetStoreBuilder.DEFAULT_PREFIX :
        builder.prefix;
  }

  @Override
  public long writeNewVersion(String segmentId, Set<String> members, String definitionHash) {
    try (Jedis jedis = pool.getResource()) {
      long version = jedis.incr(seqKey(segmentId));
      String membersKey = membersKey(segmentId, version);
      jedis.sadd(versionsKey(segmentId), String.valueOf(version));

      Pipeline p = jedis.pipelined();
      for (List<String> chunk: Iterables.partition(members, MEMBER_CHUNK_SIZE)) {
        p.sadd(membersKey, chunk.toArray(new String[chunk.size()]));
      }
      p.sync();

      Map<String, String> meta = ImmutableMap.of(
          META_COUNT, String.valueOf(members.size()),
          META_CREATED_AT, String.valueOf(System.currentTimeMillis()),
          META_DEFINITION_HASH, definitionHash == null ? "" : definitionHash
          );
      jedis.hmset(metaKey(segmentId, version), meta);

      logger.debug("Wrote version {} of segment \"{}\" with {} members", version, segmentId, members.size());
      return version;
    } catch (JedisException e) {
      throw storeError("write a new version of", segmentId, e);
    }
  }

  @Override
  public boolean promote(String segmentId, long version) {
    try {
      while (true) {
        Jedis jedis = null;
        try {
          jedis = pool.getResource();
          String currentKey = currentKey(segmentId);
          jedis.watch(currentKey);

          if (!jedis.exists(metaKey(segmentId, version))) {
            throw new IllegalArgumentException("version " + version + " of segment \"" + segmentId +
                "\" was never written");
          }

          if (promoteListener != null) {
            promoteListener.aboutToPromote(segmentId, version);
          }

          long oldVersion = parseVersion(jedis.get(currentKey));
          if (oldVersion >= version) {
            logger.debug("Attempted to promote segment \"{}\" to version {} but current version is {}",
                segmentId, version, oldVersion);
            return false;
          }

          Transaction tx = jedis.multi();
          tx.set(currentKey, String.valueOf(version));
          List<Object> result = tx.exec();
          if (result == null || result.isEmpty()) {
            // if exec failed, it means the watch was triggered and we should retry
            logger.debug("Concurrent modification detected, retrying");
            continue;
          }

          return true;
        } finally {
          if (jedis != null) {
            jedis.unwatch();
            jedis.close();
          }
        }
      }
    } catch (JedisException e) {
      throw storeError("promote", segmentId, e);
    }
  }

  @Override
  public MemberSetVersion getCurrentVersion(String segmentId) {
    try (Jedis jedis = pool.getResource()) {
      long version = parseVersion(jedis.get(currentKey(segmentId)));
      if (version == 0) {
        return null;
      }
      Map<String, String> meta = jedis.hgetAll(metaKey(segmentId, version));
      if (meta == null || meta.isEmpty()) {
        logger.warn("Metadata for version {} of segment \"{}\" is missing", version, segmentId);
        return null;
      }
      String hash = meta.get(META_DEFINITION_HASH);
      return new MemberSetVersion(
          segmentId,
          version,
          parseLong(meta.get(META_COUNT)),
          parseLong(meta.get(META_CREATED_AT)),
          hash == null || hash.isEmpty() ? null : hash
          );
    } catch (JedisException e) {
      throw storeError("read the current version of", segmentId, e);
    }
  }

  @Override
  public boolean isMember(String segmentId, String member) {
    try (Jedis jedis = pool.getResource()) {
      Object result = jedis.eval(IS_MEMBER_SCRIPT,
          ImmutableList.of(currentKey(segmentId)),
          ImmutableList.of(membersKeyPrefix(segmentId), member));
      return result instanceof Long && ((Long)result).longValue() == 1;
    } catch (JedisException e) {
      throw storeError("check membership in", segmentId, e);
    }
  }

  @Override
  public Set<String> getMembers(String segmentId) {
    try (Jedis jedis = pool.getResource()) {
      long version = parseVersion(jedis.get(currentKey(segmentId)));
      if (version == 0) {
        return ImmutableSet.of();
      }
      String membersKey = membersKey(segmentId, version);
      ImmutableSet.Builder<String> ret = ImmutableSet.builder();
      ScanParams params = new ScanParams().count(MEMBER_CHUNK_SIZE);
      String cursor = ScanParams.SCAN_POINTER_START;
      do {
        ScanResult<String> page = jedis.sscan(membersKey, cursor, params);
        ret.addAll(page.getResult());
        cursor = page.getStringCursor();
      } while (!cursor.equals(ScanParams.SCAN_POINTER_START));
      return ret.build();
    } catch (JedisException e) {
      throw storeError("read the members of", segmentId, e);
    }
  }

  @Override
  public Set<String> setAlgebra(SetOperation op, List<String> segmentIds) {
    if (segmentIds.isEmpty()) {
      return ImmutableSet.of();
    }
    try (Jedis jedis = pool.getResource()) {
      String[] currentKeys = new String[segmentIds.size()];
      for (int i = 0; i < currentKeys.length; i++) {
        currentKeys[i] = currentKey(segmentIds.get(i));
      }
      List<String> pointers = jedis.mget(currentKeys);

      // null entries stand for segments that have no current version
      List<String> memberKeys = new ArrayList<>();
      for (int i = 0; i < pointers.size(); i++) {
        long version = parseVersion(pointers.get(i));
        memberKeys.add(version == 0 ? null : membersKey(segmentIds.get(i), version));
      }

      switch (op) {
      case UNION: {
        String[] keys = Iterables.toArray(Iterables.filter(memberKeys, k -> k != null), String.class);
        return keys.length == 0 ? ImmutableSet.of() : ImmutableSet.copyOf(jedis.sunion(keys));
      }
      case INTERSECT: {
        if (memberKeys.contains(null)) {
          return ImmutableSet.of();
        }
        return ImmutableSet.copyOf(jedis.sinter(memberKeys.toArray(new String[memberKeys.size()])));
      }
      case DIFFERENCE: {
        if (memberKeys.get(0) == null) {
          return ImmutableSet.of();
        }
        String[] keys = Iterables.toArray(Iterables.filter(memberKeys, k -> k != null), String.class);
        return ImmutableSet.copyOf(jedis.sdiff(keys));
      }
      default:
        throw new IllegalArgumentException("unsupported operation: " + op);
      }
    } catch (JedisException e) {
      throw storeError("combine", String.join(",", segmentIds), e);
    }
  }

  @Override
  public void gc(String segmentId, long keepVersion) {
    try (Jedis jedis = pool.getResource()) {
      long current = parseVersion(jedis.get(currentKey(segmentId)));
      int deleted = 0;
      for (String v: jedis.smembers(versionsKey(segmentId))) {
        long version = parseVersion(v);
        if (version < keepVersion && version != current) {
          deleteVersion(jedis, segmentId, version);
          deleted++;
        }
      }
      if (deleted > 0) {
        logger.debug("Deleted {} old version(s) of segment \"{}\"", deleted, segmentId);
      }
    } catch (JedisException e) {
      throw storeError("clean up", segmentId, e);
    }
  }

  @Override
  public void discardVersion(String segmentId, long version) {
    try (Jedis jedis = pool.getResource()) {
      if (parseVersion(jedis.get(currentKey(segmentId))) == version) {
        return;
      }
      deleteVersion(jedis, segmentId, version);
    } catch (JedisException e) {
      throw storeError("discard a version of", segmentId, e);
    }
  }

  @Override
  public void deleteSegment(String segmentId) {
    try (Jedis jedis = pool.getResource()) {
      List<String> keys = new ArrayList<>();
      for (String v: jedis.smembers(versionsKey(segmentId))) {
        long version = parseVersion(v);
        keys.add(membersKey(segmentId, version));
        keys.add(metaKey(segmentId, version));
      }
      keys.add(currentKey(segmentId));
      keys.add(seqKey(segmentId));
      keys.add(versionsKey(segmentId));
      jedis.del(keys.toArray(new String[keys.size()]));
    } catch (JedisException e) {
      throw storeError("delete", segmentId, e);
    }
  }

  @Override
  public void close() {
    logger.info("Closing Redis member set store");
    pool.destroy();
  }

  @VisibleForTesting
  void setPromoteListener(PromoteListener promoteListener) {
    this.promoteListener = promoteListener;
  }

  private void deleteVersion(Jedis jedis, String segmentId, long version) {
    Transaction tx = jedis.multi();
    tx.del(membersKey(segmentId, version), metaKey(segmentId, version));
    tx.srem(versionsKey(segmentId), String.valueOf(version));
    tx.exec();
  }

  private StoreUnavailableException storeError(String action, String segmentId, JedisException e) {
    logger.warn("Failed to {} segment \"{}\" in Redis: {}", action, segmentId, e.toString());
    return new StoreUnavailableException("Redis error while trying to " + action + " segment \"" +
        segmentId + "\"", e);
  }

  private String segmentKey(String segmentId) {
    return prefix + ":" + segmentId;
  }

  private String membersKeyPrefix(String segmentId) {
    return segmentKey(segmentId) + ":members:";
  }

  private String membersKey(String segmentId, long version) {
    return membersKeyPrefix(segmentId) + version;
  }

  private String metaKey(String segmentId, long version) {
    return segmentKey(segmentId) + ":meta:" + version;
  }

  private String currentKey(String segmentId) {
    return segmentKey(segmentId) + ":current";
  }

  private String seqKey(String segmentId) {
    return segmentKey(segmentId) + ":seq";
  }

  private String versionsKey(String segmentId) {
    return segmentKey(segmentId) + ":versions";
  }

  private static long parseVersion(String s) {
    return s == null ? 0 : Long.parseLong(s);
  }

  private static long parseLong(String s) {
    return s == null || s.isEmpty() ? 0 : Long.parseLong(s);
  }

  static interface PromoteListener {
    void aboutToPromote(String segmentId, long version);
  }
}
