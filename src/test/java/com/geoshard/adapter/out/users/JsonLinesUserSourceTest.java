package com.geoshard.adapter.out.users;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoshard.domain.model.Coordinate;
import com.geoshard.domain.model.LocatedUser;
import com.geoshard.domain.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonLinesUserSource")
class JsonLinesUserSourceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private List<User> readAll(String content) throws IOException {
        Path file = tempDir.resolve("users.jsonl");
        Files.writeString(file, content);
        try (Stream<? extends User> users = new JsonLinesUserSource(file, objectMapper).open()) {
            return users.map(User.class::cast).toList();
        }
    }

    @Test
    @DisplayName("Should read one user per line, skipping blank lines")
    void shouldReadUsers() throws IOException {
        // Given
        String content = """
            {"id": "u-1", "lat": 40.7128, "lng": -74.0060}

            {"id": "u-2", "latitude": 48.8566, "longitude": 2.3522, "weight": 5}
            {"lat": -33.8688, "lon": 151.2093}
            """;

        // When
        List<User> users = readAll(content);

        // Then
        assertEquals(3, users.size());
        LocatedUser first = (LocatedUser) users.get(0);
        assertEquals("u-1", first.id());
        assertEquals(Coordinate.of(40.7128, -74.0060), first.location());
        assertEquals(1L, first.weight());
        assertEquals(5L, ((LocatedUser) users.get(1)).weight());
        assertNull(((LocatedUser) users.get(2)).id());
    }

    @Test
    @DisplayName("Should reject a line that is not JSON")
    void shouldRejectMalformedLine() {
        assertThrows(IllegalArgumentException.class, () -> readAll("not json\n"));
    }

    @Test
    @DisplayName("Should reject a record without coordinates")
    void shouldRejectMissingCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> readAll("{\"id\": \"u-1\", \"lat\": 10.0}\n"));
    }

    @Test
    @DisplayName("Should reject an out-of-range coordinate")
    void shouldRejectOutOfRangeCoordinate() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> readAll("{\"id\": \"u-1\", \"lat\": 95.0, \"lng\": 10.0}\n"));
        assertTrue(ex.getMessage().startsWith("Latitude must be between -90 and 90"));
    }

    @Test
    @DisplayName("Should fail to open a missing file")
    void shouldFailOnMissingFile() {
        JsonLinesUserSource source = new JsonLinesUserSource(tempDir.resolve("absent.jsonl"), objectMapper);

        assertThrows(UncheckedIOException.class, source::open);
    }

    @Test
    @DisplayName("Should be able to open the file more than once")
    void shouldReopen() throws IOException {
        Path file = tempDir.resolve("users.jsonl");
        Files.writeString(file, "{\"lat\": 1.0, \"lng\": 2.0}\n{\"lat\": 3.0, \"lng\": 4.0}\n");
        JsonLinesUserSource source = new JsonLinesUserSource(file, objectMapper);

        try (Stream<? extends User> first = source.open(); Stream<? extends User> second = source.open()) {
            assertEquals(2, first.count());
            assertEquals(2, second.count());
        }
    }
}
