package com.gemflush.orchestrator.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.publish.CandidateEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Manual storage on the local filesystem, two JSON files per entry:
 *
 *   entity-{businessId}-{epochMillis}-{random}.json           entity + annotations
 *   entity-{businessId}-{epochMillis}-{random}.metadata.json  StoredManualEntity
 *
 * The entity file is written first, so a metadata file never points at a
 * missing entity.
 */
@Component
public class FileManualEntityStore implements ManualEntityStore {

    private static final Logger log = LoggerFactory.getLogger(FileManualEntityStore.class);

    private static final String METADATA_SUFFIX = ".metadata.json";

    private final Path         directory;
    private final ObjectMapper json;
    private final Clock        clock;

    @Autowired
    public FileManualEntityStore(CfpProperties props, ObjectMapper json, Clock clock) {
        this(Paths.get(props.getStorage().getDirectory()), json, clock);
    }

    FileManualEntityStore(Path directory, ObjectMapper json, Clock clock) {
        this.directory = directory;
        this.json      = json;
        this.clock     = clock;
    }

    @Override
    public StoredManualEntity store(UUID businessId, String businessName, CandidateEntity entity,
                                    boolean canPublish, StoredNotability notability,
                                    Map<String, Object> annotations) {
        Instant now = clock.instant();
        String base = "entity-" + businessId + "-" + now.toEpochMilli() + "-"
                + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x100000, 0xFFFFFF));
        String entityFile = base + ".json";
        String metadataFile = base + METADATA_SUFFIX;

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("entity", entity);
        document.put("annotations", annotations == null ? Map.of() : annotations);

        StoredManualEntity stored = new StoredManualEntity(
                businessId, businessName, entityFile, metadataFile, canPublish, notability, now);
        try {
            Files.createDirectories(directory);
            json.writerWithDefaultPrettyPrinter().writeValue(directory.resolve(entityFile).toFile(), document);
            json.writerWithDefaultPrettyPrinter().writeValue(directory.resolve(metadataFile).toFile(), stored);
        } catch (IOException e) {
            throw new ManualStorageException("Failed to store entity for business " + businessId, e);
        }
        log.info("Stored entity for manual review: business={} file={} canPublish={}",
                businessId, entityFile, canPublish);
        return stored;
    }

    @Override
    public List<StoredManualEntity> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<StoredManualEntity> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + METADATA_SUFFIX)) {
            for (Path file : stream) {
                try {
                    entries.add(json.readValue(file.toFile(), StoredManualEntity.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable manual-publish metadata {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ManualStorageException("Failed to list " + directory, e);
        }
        entries.sort(Comparator.comparing(StoredManualEntity::storedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return entries;
    }

    @Override
    public List<StoredManualEntity> listForBusiness(UUID businessId) {
        return list().stream().filter(e -> businessId.equals(e.businessId())).toList();
    }

    @Override
    public JsonNode load(StoredManualEntity ref) {
        Path file = resolve(ref.entityFileName());
        if (!Files.exists(file)) {
            throw new ManualStorageException("Stored entity not found: " + ref.entityFileName());
        }
        try {
            return json.readTree(file.toFile());
        } catch (IOException e) {
            throw new ManualStorageException("Failed to read " + ref.entityFileName(), e);
        }
    }

    @Override
    public void delete(StoredManualEntity ref) {
        try {
            Files.deleteIfExists(resolve(ref.entityFileName()));
            Files.deleteIfExists(resolve(ref.metadataFileName()));
        } catch (IOException e) {
            throw new ManualStorageException("Failed to delete " + ref.entityFileName(), e);
        }
        log.info("Deleted stored entity {}", ref.entityFileName());
    }

    /** Keeps lookups inside the storage directory. */
    private Path resolve(String fileName) {
        Path file = directory.resolve(fileName).normalize();
        if (!file.startsWith(directory.normalize()) || fileName.contains("/") || fileName.contains("\\")) {
            throw new ManualStorageException("Invalid stored entity file name: " + fileName);
        }
        return file;
    }
}
