/**
 * Interfaces for implementation of pluggable components of the segment cache.
 * <p>
 * Most applications will not need to refer to these types. You will use them if you are creating a
 * plugin component, such as a member set store backed by a different database. They are also used
 * as interfaces for the built-in components, so that plugin components can be used interchangeably
 * with those.
 */
package com.segmentcache.server.subsystems;
