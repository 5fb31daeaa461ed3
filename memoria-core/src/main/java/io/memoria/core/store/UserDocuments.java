package io.memoria.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Per-user JSON documents under {@code <root>/<iin>/}.
 */
final class UserDocuments {
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_.@-]+");

    private final Path root;
    private final ObjectMapper mapper;

    UserDocuments(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    Path userDir(String iin) {
        return root.resolve(safeKey(iin, "iin"));
    }

    Path document(String iin, String fileName) {
        return userDir(iin).resolve(fileName);
    }

    <T> List<T> readList(Path path, TypeReference<List<T>> type) throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String json = Files.readString(path);
        if (json.isBlank()) {
            return List.of();
        }
        List<T> values = mapper.readValue(json, type);
        return values == null ? List.of() : values;
    }

    void writeList(Path path, List<?> values) throws IOException {
        Files.createDirectories(path.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(values);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    static String safeKey(String value, String field) {
        if (value == null || !SAFE_KEY.matcher(value).matches() || value.startsWith(".")) {
            throw new IllegalArgumentException(field + " contains unsupported characters: " + value);
        }
        return value;
    }
}
