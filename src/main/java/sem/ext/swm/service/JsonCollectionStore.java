package sem.ext.swm.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sem.ext.swm.model.CollectionKind;
import sem.ext.swm.model.CollectionMember;
import sem.ext.swm.model.ImageCollection;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes each collection to {@code <folder>/<id>.json}.
 *
 * <p>Summary fields are written for downstream renderers but ignored when reading back;
 * they are recomputed from the members.</p>
 *
 * @since 0.1.0
 */
public class JsonCollectionStore implements CollectionStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonCollectionStore.class);
    private static final String EXTENSION = ".json";

    private final Path folder;
    private final Gson gson;

    public JsonCollectionStore(Path folder) {
        this.folder = Objects.requireNonNull(folder, "folder");
        this.gson = new GsonBuilder()
                .registerTypeAdapter(ImageCollection.class, new ImageCollectionAdapter())
                .setPrettyPrinting()
                .create();
    }

    @Override
    public boolean save(String id, ImageCollection collection) {
        if (id == null || id.isBlank() || collection == null) {
            logger.warn("Cannot save collection: missing id or collection");
            return false;
        }
        Path file = fileFor(id);
        try {
            Files.createDirectories(folder);
            Files.writeString(file, gson.toJson(collection, ImageCollection.class), StandardCharsets.UTF_8);
            logger.info("Saved {} collection {} to {}", collection.getKind().getWorkflowName(), id, file);
            return true;
        } catch (IOException e) {
            logger.error("Failed to save collection {} to {}", id, file, e);
            return false;
        }
    }

    /**
     * @return the stored collection, or empty when missing or unreadable
     */
    public Optional<ImageCollection> load(String id) {
        Path file = fileFor(id);
        if (!Files.isRegularFile(file)) {
            logger.debug("No stored collection {}", id);
            return Optional.empty();
        }
        return read(file);
    }

    /**
     * @return every readable collection in the folder, ordered by file name
     */
    public List<ImageCollection> loadAll() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(folder)) {
            return new ArrayList<>();
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, "*" + EXTENSION)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            logger.error("Failed to list collections in {}", folder, e);
            return new ArrayList<>();
        }
        files.sort(Path::compareTo);

        List<ImageCollection> collections = new ArrayList<>();
        for (Path file : files) {
            read(file).ifPresent(collections::add);
        }
        logger.info("Loaded {} collections from {}", collections.size(), folder);
        return collections;
    }

    /**
     * @return the file a collection id is stored in
     */
    public Path fileFor(String id) {
        return folder.resolve(safeFileName(id) + EXTENSION);
    }

    /**
     * Percent-encodes every byte outside {@code [A-Za-z0-9._-]}, so distinct ids never
     * share a file.
     */
    static String safeFileName(String id) {
        StringBuilder name = new StringBuilder(id.length());
        for (byte b : id.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xff);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == '-') {
                name.append(c);
            } else {
                name.append('%').append(String.format("%02X", b & 0xff));
            }
        }
        return name.toString();
    }

    private Optional<ImageCollection> read(Path file) {
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.ofNullable(gson.fromJson(json, ImageCollection.class));
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to read collection from {}", file, e);
            return Optional.empty();
        }
    }

    /**
     * Writes members plus derived summary; reads only what the constructor needs.
     */
    private static class ImageCollectionAdapter
            implements JsonSerializer<ImageCollection>, JsonDeserializer<ImageCollection> {

        @Override
        public JsonElement serialize(ImageCollection collection, Type type, JsonSerializationContext context) {
            JsonObject json = new JsonObject();
            json.addProperty("id", collection.getId());
            json.addProperty("type", collection.getKind().getWorkflowName());
            json.addProperty("description", collection.getDescription());
            json.addProperty("sample_position_x", collection.getReferenceX());
            json.addProperty("sample_position_y", collection.getReferenceY());
            json.addProperty("field_of_view_width", collection.getReferenceFieldOfViewWidth());
            json.addProperty("field_of_view_height", collection.getReferenceFieldOfViewHeight());
            json.addProperty("high_voltage", collection.getHighVoltageKv());
            json.add("modes", context.serialize(collection.getModes()));
            json.add("magnifications", context.serialize(collection.getMagnifications()));
            json.add("varying_parameters", context.serialize(collection.getVaryingParameters()));

            JsonArray members = new JsonArray();
            for (CollectionMember member : collection.getMembers()) {
                members.add(context.serialize(member, CollectionMember.class));
            }
            json.add("members", members);
            return json;
        }

        @Override
        public ImageCollection deserialize(JsonElement element, Type type, JsonDeserializationContext context) {
            JsonObject json = element.getAsJsonObject();
            String id = json.get("id").getAsString();
            CollectionKind kind = kindOf(json.get("type").getAsString());
            String description = json.has("description") && !json.get("description").isJsonNull()
                    ? json.get("description").getAsString() : null;

            List<CollectionMember> members = new ArrayList<>();
            for (JsonElement member : json.getAsJsonArray("members")) {
                members.add(context.deserialize(member, CollectionMember.class));
            }
            return new ImageCollection(id, kind, members, description);
        }

        private static CollectionKind kindOf(String workflowName) {
            for (CollectionKind kind : CollectionKind.values()) {
                if (kind.getWorkflowName().equals(workflowName)) {
                    return kind;
                }
            }
            throw new JsonParseException("Unknown collection type: " + workflowName);
        }
    }
}
