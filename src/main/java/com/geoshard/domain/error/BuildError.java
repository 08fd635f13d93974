package com.geoshard.domain.error;

/**
 * Sealed type representing expected failures of a shard build at the application layer.
 * Broken build invariants are not modelled here; they are thrown.
 */
public sealed interface BuildError {

    /**
     * Wraps a configuration problem detected before or during the build.
     */
    record InvalidConfiguration(ValidationError error) implements BuildError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
