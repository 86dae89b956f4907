package com.segmentcache.server.subsystems;

/**
 * The common interface for component factories and configuration builders.
 * <p>
 * Any configuration option that is backed by a pluggable component, such as the member set store or
 * the logging configuration, takes an instance of this interface. The library calls
 * {@link #build(ClientContext)} once, when the {@link com.segmentcache.server.SegmentsClient} is
 * created.
 *
 * @param <T> the type of the component or configuration object being constructed
 */
public interface ComponentConfigurer<T> {
  /**
   * Called internally by the library to create an implementation instance. Applications should not
   * need to call this method.
   *
   * @param clientContext provides configuration properties and other components from the client
   * @return an instance of the component type
   */
  T build(ClientContext clientContext);
}
