package org.gathermine.merge;

import org.gathermine.model.Category;
import org.gathermine.table.TableData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;

/**
 * The addon's SavedVariables file, merged in place.
 * <p>
 * The file is always rewritten as a whole. An existing file is copied to
 * {@code <path>.backup_<yyyyMMdd_HHmmss>} before it is overwritten.
 */
public class SavedVariablesFile {

    private static final Logger log = LoggerFactory.getLogger(SavedVariablesFile.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path path;
    private final DocumentCodec codec;
    private final Clock clock;

    /**
     * @param path the SavedVariables file
     * @param codec the codec for the addon prefix
     * @param clock the clock used for the backup time stamp
     */
    public SavedVariablesFile(Path path, DocumentCodec codec, Clock clock) {
        this.path = path;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Merges new tables into the file.
     *
     * @param newTables the new tables per category
     * @return what was merged and where the backup went
     * @throws IOException if the file cannot be read, backed up or written
     */
    public MergeResult merge(Map<Category, TableData> newTables) throws IOException {
        PersistedDocument existing = read();
        Path backup = backup();
        PersistedDocument merged = MergeEngine.merge(existing, newTables);
        write(merged);

        Map<Category, Integer> zones = new EnumMap<>(Category.class);
        newTables.forEach((category, data) -> zones.put(category, data.zones().size()));
        log.info("Merged {} categories into {}", newTables.size(), path);
        return new MergeResult(path, backup, zones);
    }

    /**
     * Reads the current document.
     *
     * @return the document, or an empty one if the file does not exist yet
     * @throws IOException if the file exists but cannot be read
     */
    public PersistedDocument read() throws IOException {
        if (!Files.exists(path)) {
            log.info("No SavedVariables file at {}, creating a new one", path);
            return codec.empty();
        }
        String text = Files.readString(path, StandardCharsets.UTF_8);
        log.debug("Read existing SavedVariables file {}", path);
        return codec.read(text, path.getFileName().toString());
    }

    /**
     * Copies the current file next to itself with a time stamp suffix.
     *
     * @return the backup path, or {@code null} if there was no file to back up
     * @throws IOException if the copy fails
     */
    public Path backup() throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        String stamp = LocalDateTime.now(clock).format(BACKUP_STAMP);
        Path backup = path.resolveSibling(path.getFileName() + ".backup_" + stamp);
        Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        log.info("Backup created: {}", backup);
        return backup;
    }

    /**
     * Replaces the file with a rendered document.
     *
     * @param document the document to write
     * @throws IOException if the file cannot be written
     */
    public void write(PersistedDocument document) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(codec.render(document));
        }
    }

    /**
     * Outcome of a merge.
     *
     * @param target The file that was written.
     * @param backup The backup copy, or {@code null} if the file did not exist before.
     * @param zonesPerCategory Number of zones merged per category.
     */
    public record MergeResult(
            Path target,
            Path backup,
            Map<Category, Integer> zonesPerCategory
    ) {
    }
}
