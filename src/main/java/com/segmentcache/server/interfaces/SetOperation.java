package com.segmentcache.server.interfaces;

/**
 * Operations for combining the member sets of several segments.
 */
public enum SetOperation {
  /**
   * Identifiers that are in any of the segments.
   */
  UNION,

  /**
   * Identifiers that are in all of the segments.
   */
  INTERSECT,

  /**
   * Identifiers that are in the first segment and in none of the others.
   */
  DIFFERENCE
}
