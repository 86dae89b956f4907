/**
 * This package contains integration tools for connecting the segment cache to other software
 * components, and configuration builders for its standard components.
 * <p>
 * In the current main segment cache distribution, it includes the Redis member set store
 * ({@link com.segmentcache.server.integrations.Redis}) and pooled SQL connections
 * ({@link com.segmentcache.server.integrations.SqlSources}).
 */
package com.segmentcache.server.integrations;
