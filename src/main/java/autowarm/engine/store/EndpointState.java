package autowarm.engine.store;

/**
 * Cached health verdict of a storage endpoint.
 */
public enum EndpointState {
    /** Not probed yet */
    UNKNOWN,
    HEALTHY,
    UNHEALTHY
}
