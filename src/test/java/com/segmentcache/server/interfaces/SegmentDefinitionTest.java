package com.segmentcache.server.interfaces;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class SegmentDefinitionTest {
  @Test
  public void rawQueryJson() {
    SegmentDefinition def = SegmentDefinition.rawQuery("select id from users where active = 1");
    assertEquals(SegmentDefinition.Kind.RAW_QUERY, def.getKind());
    assertEquals("{\"kind\":\"rawQuery\",\"query\":\"select id from users where active = 1\"}", def.toJson());
    assertEquals(def, SegmentDefinition.fromJson(def.toJson()));
  }

  @Test
  public void staticListJson() {
    SegmentDefinition def = SegmentDefinition.staticList("1", "2");
    assertEquals("{\"kind\":\"staticList\",\"members\":[\"1\",\"2\"]}", def.toJson());
    assertEquals(def, SegmentDefinition.fromJson(def.toJson()));
  }

  @Test
  public void managerLookupJson() {
    SegmentDefinition def = SegmentDefinition.managerLookup("users", "find", "gold", 30, true, null);
    assertEquals("{\"kind\":\"managerLookup\",\"source\":\"users\",\"method\":\"find\"," +
        "\"arguments\":[\"gold\",30,true,null]}", def.toJson());

    SegmentDefinition parsed = SegmentDefinition.fromJson(def.toJson());
    assertEquals(def, parsed);
    assertEquals(def.contentHash(), parsed.contentHash());
    assertEquals(Arrays.asList("gold", 30L, true, null), ((SegmentDefinition.ManagerLookup)parsed).getArguments());
  }

  @Test
  public void fractionalArgumentsStayFractional() {
    SegmentDefinition parsed = SegmentDefinition.fromJson(
        SegmentDefinition.managerLookup("users", "score", 2.5).toJson());
    assertEquals(ImmutableList.of(2.5d), ((SegmentDefinition.ManagerLookup)parsed).getArguments());
  }

  @Test
  public void unknownPropertiesAreIgnored() {
    assertEquals(SegmentDefinition.staticList("a"),
        SegmentDefinition.fromJson("{\"kind\":\"staticList\",\"members\":[\"a\"],\"note\":{\"x\":1}}"));
  }

  @Test
  public void invalidJson() {
    String[] bad = {
        "",
        "not json",
        "[1,2]",
        "{\"kind\":\"sometimes\"}",
        "{\"members\":[\"a\"]}",
        "{\"kind\":\"rawQuery\"}",
        "{\"kind\":\"managerLookup\",\"source\":\"users\"}"
    };
    for (String json: bad) {
      try {
        SegmentDefinition.fromJson(json);
        fail("expected IllegalArgumentException for: " + json);
      } catch (IllegalArgumentException e) {
        assertThat(e.getMessage(), notNullValue());
      }
    }
  }

  @Test
  public void staticListDropsDuplicatesKeepingFirstOccurrence() {
    SegmentDefinition.StaticList def = SegmentDefinition.staticList("b", "a", "b");
    assertThat(def.getMembers(), contains("b", "a"));
    assertEquals(SegmentDefinition.staticList("b", "a"), def);
  }

  @Test
  public void contentHash() {
    SegmentDefinition a = SegmentDefinition.staticList("1", "2");
    assertEquals(a.contentHash(), SegmentDefinition.staticList("1", "2").contentHash());
    assertNotEquals(a.contentHash(), SegmentDefinition.staticList("2", "1").contentHash());
    assertNotEquals(a.contentHash(), SegmentDefinition.rawQuery("select 1").contentHash());
    assertNotEquals(a, SegmentDefinition.staticList("2", "1"));
  }

  @Test
  public void argumentsCannotBeChangedFromOutside() {
    SegmentDefinition.ManagerLookup def = SegmentDefinition.managerLookup("users", "find", "gold");
    def.getArguments().clear();
    assertEquals(ImmutableList.of("gold"), def.getArguments());
  }

  @Test(expected = NullPointerException.class)
  public void nullQuery() {
    SegmentDefinition.rawQuery(null);
  }

  @Test
  public void managerLookupRejectsArgumentsThatHaveNoJsonForm() {
    for (Object arg: new Object[] { LocalDate.of(2024, 1, 1), new Object(), Arrays.asList("a"), Double.NaN,
        Float.POSITIVE_INFINITY }) {
      try {
        SegmentDefinition.managerLookup("signups", "since", arg);
        fail("expected IllegalArgumentException for " + arg);
      } catch (IllegalArgumentException e) {
        assertThat(e.getMessage(), notNullValue());
      }
    }
  }

  @Test
  public void managerLookupArgumentsAlwaysHashAndCompare() {
    SegmentDefinition def = SegmentDefinition.managerLookup("users", "find",
        new StringBuilder("gold"), new BigDecimal("1.50"), (short)2, 2.5f);
    assertEquals("{\"kind\":\"managerLookup\",\"source\":\"users\",\"method\":\"find\"," +
        "\"arguments\":[\"gold\",1.50,2,2.5]}", def.toJson());
    assertThat(def.contentHash(), notNullValue());
    assertEquals(def, SegmentDefinition.managerLookup("users", "find", "gold", new BigDecimal("1.50"), (short)2, 2.5f));
    assertEquals(ImmutableList.of("gold", new BigDecimal("1.50"), (short)2, 2.5f),
        ((SegmentDefinition.ManagerLookup)def).getArguments());
  }

  @Test
  public void structuredArgumentsInJsonAreRejected() {
    for (String args: new String[] { "[{\"year\":2024}]", "[[1,2]]" }) {
      try {
        SegmentDefinition.fromJson("{\"kind\":\"managerLookup\",\"source\":\"users\",\"method\":\"find\"," +
            "\"arguments\":" + args + "}");
        fail("expected IllegalArgumentException for " + args);
      } catch (IllegalArgumentException e) {
        assertThat(e.getMessage(), notNullValue());
      }
    }
  }
}
