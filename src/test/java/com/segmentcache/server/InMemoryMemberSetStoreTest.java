package com.segmentcache.server;

import com.google.common.collect.ImmutableSet;
import com.segmentcache.server.subsystems.MemberSetStore;

import org.junit.Test;

import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

@SuppressWarnings("javadoc")
public class InMemoryMemberSetStoreTest extends MemberSetStoreTestBase {

  @Override
  protected MemberSetStore makeStore() {
    return new InMemoryMemberSetStore();
  }

  @Test
  public void membersReadBeforeCollectionStayUsable() {
    long v1 = store.writeNewVersion("s", ImmutableSet.of("a"), "h");
    store.promote("s", v1);
    Set<String> held = store.getMembers("s");

    long v2 = store.writeNewVersion("s", ImmutableSet.of("b"), "h");
    store.promote("s", v2);
    store.gc("s", v2);

    assertThat(held, contains("a"));
    assertThat(store.getMembers("s"), contains("b"));
  }
}
