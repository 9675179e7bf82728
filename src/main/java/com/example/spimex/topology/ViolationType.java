package com.example.spimex.topology;

/**
 * Conformance rules checked against a deployment descriptor
 */
public enum ViolationType {

    /**
     * depends_on names a service that is not declared
     */
    DANGLING_DEPENDENCY,

    /**
     * A named mount references a volume missing from the top-level volumes
     */
    UNDECLARED_VOLUME,

    /**
     * A named volume is mounted by more than one service
     */
    SHARED_VOLUME,

    /**
     * The store's data directory is not on a named volume
     */
    STORE_NOT_PERSISTENT,

    /**
     * Broker consumers do not point at the declared broker, or disagree with each other
     */
    BROKER_HOST_MISMATCH,

    /**
     * Database consumers mix the DSN and the discrete DB_* form
     */
    INCONSISTENT_CONNECTION_SHAPE,

    /**
     * Database consumers disagree on host, database or credentials
     */
    CONNECTION_PARAMETER_MISMATCH,

    /**
     * The API does not declare a dependency on the store it migrates
     */
    MISSING_STORE_DEPENDENCY,

    /**
     * More than one scheduler instance would run
     */
    SCHEDULER_NOT_SINGLETON
}
