package com.geoshard.adapter.out.users;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoshard.application.port.out.UserSource;
import com.geoshard.domain.model.Coordinate;
import com.geoshard.domain.model.LocatedUser;
import com.geoshard.domain.model.User;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Streams users from a newline-delimited JSON file without loading it into memory.
 * Blank lines are skipped; a malformed line or an out-of-range coordinate aborts the stream.
 */
public class JsonLinesUserSource implements UserSource {

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonLinesUserSource(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stream<? extends User> open() {
        try {
            return Files.lines(file, StandardCharsets.UTF_8)
                .filter(line -> !line.isBlank())
                .map(this::parse);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open user file " + file, e);
        }
    }

    private LocatedUser parse(String line) {
        UserLine userLine;
        try {
            userLine = objectMapper.readValue(line, UserLine.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed user record in " + file + ": " + line, e);
        }
        if (userLine.latitude() == null || userLine.longitude() == null) {
            throw new IllegalArgumentException("User record without lat/lng in " + file + ": " + line);
        }
        var coordinate = Coordinate.parse(userLine.latitude(), userLine.longitude());
        if (coordinate.isFailure()) {
            throw new IllegalArgumentException(coordinate.errorOrNull().message() + " in " + file + ": " + line);
        }
        long weight = userLine.weight() != null ? userLine.weight() : 1L;
        return new LocatedUser(userLine.id(), coordinate.getOrThrow(), weight);
    }
}
