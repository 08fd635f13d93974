package com.geoshard.application.port.out;

import com.geoshard.domain.model.User;

import java.util.stream.Stream;

/**
 * Port for the records that load the shards.
 * A build opens the source once and drives the stream to exhaustion; the caller closes it.
 */
@FunctionalInterface
public interface UserSource {

    Stream<? extends User> open();

    static UserSource empty() {
        return Stream::empty;
    }
}
