package com.segmentcache.server;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.segmentcache.server.interfaces.SetOperation;
import com.segmentcache.server.subsystems.MemberSetStore;
import com.segmentcache.server.subsystems.MemberSetStoreTypes.MemberSetVersion;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A thread-safe, versioned member set store kept in memory. This is the default implementation of
 * {@link MemberSetStore}.
 * <p>
 * All state lives in one immutable map that writers replace under a lock. Readers take a single
 * volatile read of that map, so they always see a complete and consistent snapshot, and a promote
 * becomes visible to every reader at once. A reader still holding an old snapshot can keep using a
 * collected version, since nothing is ever mutated in place.
 * <p>
 * Applications should use the factory method {@link Components#inMemoryStore()}.
 */
class InMemoryMemberSetStore implements MemberSetStore {
  private volatile ImmutableMap<String, SegmentVersions> allData = ImmutableMap.of();
  private final Object writeLock = new Object();

  @Override
  public long writeNewVersion(String segmentId, Set<String> members, String definitionHash) {
    ImmutableSet<String> memberSet = ImmutableSet.copyOf(members);
    synchronized (writeLock) {
      SegmentVersions old = allData.get(segmentId);
      long version = (old == null ? 0 : old.lastAllocated) + 1;
      StoredVersion stored = new StoredVersion(
          new MemberSetVersion(segmentId, version, memberSet.size(), System.currentTimeMillis(), definitionHash),
          memberSet);
      ImmutableMap.Builder<Long, StoredVersion> versions = ImmutableMap.builder();
      if (old != null) {
        versions.putAll(old.versions);
      }
      versions.put(version, stored);
      replace(segmentId, new SegmentVersions(versions.build(), old == null ? 0 : old.current, version));
      return version;
    }
  }

  @Override
  public boolean promote(String segmentId, long version) {
    synchronized (writeLock) {
      SegmentVersions old = allData.get(segmentId);
      if (old == null || !old.versions.containsKey(version)) {
        throw new IllegalArgumentException("version " + version + " of segment \"" + segmentId +
            "\" was never written");
      }
      if (old.current >= version) {
        return false;
      }
      replace(segmentId, new SegmentVersions(old.versions, version, old.lastAllocated));
      return true;
    }
  }

  @Override
  public MemberSetVersion getCurrentVersion(String segmentId) {
    StoredVersion v = currentOf(allData, segmentId);
    return v == null ? null : v.metadata;
  }

  @Override
  public boolean isMember(String segmentId, String member) {
    StoredVersion v = currentOf(allData, segmentId);
    return v != null && v.members.contains(member);
  }

  @Override
  public Set<String> getMembers(String segmentId) {
    StoredVersion v = currentOf(allData, segmentId);
    return v == null ? ImmutableSet.of() : v.members;
  }

  @Override
  public Set<String> setAlgebra(SetOperation op, List<String> segmentIds) {
    if (segmentIds.isEmpty()) {
      return ImmutableSet.of();
    }
    ImmutableMap<String, SegmentVersions> snapshot = allData;
    Set<String> result = membersOf(snapshot, segmentIds.get(0));
    for (String id: segmentIds.subList(1, segmentIds.size())) {
      Set<String> other = membersOf(snapshot, id);
      switch (op) {
      case UNION:
        result = Sets.union(result, other);
        break;
      case INTERSECT:
        result = Sets.intersection(result, other);
        break;
      case DIFFERENCE:
        result = Sets.difference(result, other);
        break;
      default:
        throw new IllegalArgumentException("unsupported operation: " + op);
      }
    }
    return ImmutableSet.copyOf(result);
  }

  @Override
  public void gc(String segmentId, long keepVersion) {
    synchronized (writeLock) {
      SegmentVersions old = allData.get(segmentId);
      if (old == null) {
        return;
      }
      ImmutableMap.Builder<Long, StoredVersion> versions = ImmutableMap.builder();
      for (Map.Entry<Long, StoredVersion> e: old.versions.entrySet()) {
        long v = e.getKey();
        if (v >= keepVersion || v == old.current) {
          versions.put(e);
        }
      }
      replace(segmentId, new SegmentVersions(versions.build(), old.current, old.lastAllocated));
    }
  }

  @Override
  public void discardVersion(String segmentId, long version) {
    synchronized (writeLock) {
      SegmentVersions old = allData.get(segmentId);
      if (old == null || old.current == version || !old.versions.containsKey(version)) {
        return;
      }
      ImmutableMap.Builder<Long, StoredVersion> versions = ImmutableMap.builder();
      for (Map.Entry<Long, StoredVersion> e: old.versions.entrySet()) {
        if (e.getKey() != version) {
          versions.put(e);
        }
      }
      replace(segmentId, new SegmentVersions(versions.build(), old.current, old.lastAllocated));
    }
  }

  @Override
  public void deleteSegment(String segmentId) {
    synchronized (writeLock) {
      if (!allData.containsKey(segmentId)) {
        return;
      }
      ImmutableMap.Builder<String, SegmentVersions> newData = ImmutableMap.builder();
      for (Map.Entry<String, SegmentVersions> e: allData.entrySet()) {
        if (!e.getKey().equals(segmentId)) {
          newData.put(e);
        }
      }
      this.allData = newData.build();
    }
  }

  /**
   * Does nothing; this class does not have any resources to release
   *
   * @throws IOException will never happen
   */
  @Override
  public void close() throws IOException {
    return;
  }

  // Must be called while holding writeLock.
  private void replace(String segmentId, SegmentVersions segment) {
    // ImmutableMap.Builder doesn't support overwriting an existing key
    ImmutableMap.Builder<String, SegmentVersions> newData = ImmutableMap.builder();
    for (Map.Entry<String, SegmentVersions> e: allData.entrySet()) {
      if (!e.getKey().equals(segmentId)) {
        newData.put(e);
      }
    }
    newData.put(segmentId, segment);
    this.allData = newData.build(); // replaces the entire map atomically
  }

  private static StoredVersion currentOf(ImmutableMap<String, SegmentVersions> data, String segmentId) {
    SegmentVersions s = data.get(segmentId);
    return s == null || s.current == 0 ? null : s.versions.get(s.current);
  }

  private static Set<String> membersOf(ImmutableMap<String, SegmentVersions> data, String segmentId) {
    StoredVersion v = currentOf(data, segmentId);
    return v == null ? ImmutableSet.of() : v.members;
  }

  private static final class StoredVersion {
    final MemberSetVersion metadata;
    final ImmutableSet<String> members;

    StoredVersion(MemberSetVersion metadata, ImmutableSet<String> members) {
      this.metadata = metadata;
      this.members = members;
    }
  }

  private static final class SegmentVersions {
    final ImmutableMap<Long, StoredVersion> versions;
    final long current; // 0 if nothing was promoted yet
    final long lastAllocated;

    SegmentVersions(ImmutableMap<Long, StoredVersion> versions, long current, long lastAllocated) {
      this.versions = versions;
      this.current = current;
      this.lastAllocated = lastAllocated;
    }
  }
}
