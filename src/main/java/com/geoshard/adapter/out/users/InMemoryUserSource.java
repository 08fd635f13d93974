package com.geoshard.adapter.out.users;

import com.geoshard.application.port.out.UserSource;
import com.geoshard.domain.model.User;

import java.util.List;
import java.util.stream.Stream;

/**
 * Users already held in memory. Can be opened any number of times.
 */
public record InMemoryUserSource(List<? extends User> users) implements UserSource {

    public InMemoryUserSource {
        users = List.copyOf(users);
    }

    public static InMemoryUserSource of(List<? extends User> users) {
        return new InMemoryUserSource(users);
    }

    @Override
    public Stream<? extends User> open() {
        return users.stream();
    }
}
