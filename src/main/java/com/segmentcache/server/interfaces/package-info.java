/**
 * Types that are part of the public API of the segment cache, other than the client and its
 * configuration.
 */
package com.segmentcache.server.interfaces;
