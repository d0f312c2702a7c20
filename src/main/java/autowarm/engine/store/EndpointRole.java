package autowarm.engine.store;

public enum EndpointRole {
    PRIMARY,
    REPLICA
}
