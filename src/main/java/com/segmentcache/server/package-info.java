/**
 * The main package for the segment cache, containing the client and configuration classes.
 * <p>
 * You will most often use {@link com.segmentcache.server.SegmentsClient} (the client) and
 * {@link com.segmentcache.server.SegmentsConfig} (configuration options for the client).
 * <p>
 * Other commonly used types such as {@link com.segmentcache.server.interfaces.SegmentDefinition} are in
 * the {@code com.segmentcache.server.interfaces} package. Pluggable components such as the Redis store
 * are in {@code com.segmentcache.server.integrations}.
 */
package com.segmentcache.server;
