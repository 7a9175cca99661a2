package org.oldskooler.computedhash.snapshot;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes and deserializes model snapshots to/from JSON.
 */
public class ModelSnapshotSerializer {
    private final Gson gson;

    public ModelSnapshotSerializer() {
        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .disableHtmlEscaping()
                .serializeNulls()
                .create();
    }

    public String toJson(ModelSnapshot snapshot) {
        return gson.toJson(snapshot);
    }

    /**
     * @throws IllegalArgumentException if the JSON is not a model snapshot
     */
    public ModelSnapshot fromJson(String json) {
        try {
            ModelSnapshot snapshot = gson.fromJson(json, ModelSnapshot.class);
            if (snapshot == null) {
                throw new IllegalArgumentException("Empty model snapshot");
            }
            return snapshot;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid model snapshot: " + e.getMessage(), e);
        }
    }

    public void write(ModelSnapshot snapshot, Path file) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(snapshot, w);
        }
    }

    /**
     * @return the stored snapshot, or {@link ModelSnapshot#empty()} when the file does not exist yet
     */
    public ModelSnapshot read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return ModelSnapshot.empty();
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ModelSnapshot snapshot = gson.fromJson(r, ModelSnapshot.class);
            return snapshot == null ? ModelSnapshot.empty() : snapshot;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid model snapshot in " + file + ": " + e.getMessage(), e);
        }
    }
}
