package com.acme.werp.store;

import com.acme.werp.util.FsUtil;
import com.acme.werp.util.Slugs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;

/**
 * One collection backed by a JSON file: either an array of records or an object keyed by id.
 * Commits rewrite the whole file atomically, always as an object keyed by id.
 */
public class JsonFileRecordStore extends InMemoryRecordStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileRecordStore.class);

    private final Path file;
    private final String path;
    private final ObjectMapper mapper;

    public JsonFileRecordStore(Path file, String path, ObjectMapper mapper) throws IOException {
        this.file = file;
        this.path = path;
        this.mapper = mapper;
        if (Files.exists(file)) load();
    }

    public Path file() { return file; }

    private void load() throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        int n = 0;
        if (root == null || root.isNull() || root.isMissingNode()) {
            logger.info("{} is empty", file);
        } else if (root.isArray()) {
            for (JsonNode item : root) {
                if (!item.isObject()) continue;
                put(path, idOf(null, (ObjectNode) item), (ObjectNode) item);
                n++;
            }
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = root.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isObject()) continue;
                put(path, idOf(e.getKey(), (ObjectNode) e.getValue()), (ObjectNode) e.getValue());
                n++;
            }
        } else {
            throw new IOException("Unsupported JSON root in " + file + ": " + root.getNodeType());
        }
        logger.info("Loaded {} records from {}", n, file);
    }

    private static String idOf(String key, ObjectNode item) {
        if (key != null && !key.isBlank()) return key;
        JsonNode id = item.get("id");
        if (id != null && id.isTextual() && !id.asText().isBlank()) return id.asText();
        JsonNode name = item.get("vesselName");
        return Slugs.fromVesselName(name == null ? null : name.asText());
    }

    @Override
    protected void persist(String collection, SortedMap<String, ObjectNode> next) throws StoreWriteException {
        if (!path.equals(collection)) return;
        ObjectNode root = mapper.createObjectNode();
        next.forEach(root::set);
        try {
            FsUtil.writeAtomically(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root));
        } catch (IOException e) {
            throw new StoreWriteException("Cannot write " + file + ": " + e.getMessage(), e);
        }
    }
}
