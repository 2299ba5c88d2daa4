package org.academic.store.persistence;

import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * One table's backing file: a 4-byte record count followed by that many fixed-size records.
 * No header, checksum or version tag. Writes always replace the whole file.
 */
public class BinaryTableFile<T> {

    private static final Logger LOG = Logger.getLogger(BinaryTableFile.class);

    private final String tableName;
    private final Path path;
    private final RecordLayout<T> layout;

    public BinaryTableFile(String tableName, Path path, RecordLayout<T> layout) {
        this.tableName = tableName;
        this.path = path;
        this.layout = layout;
    }

    /**
     * Reads every record in the file. A missing file is an empty table.
     * On a truncated or unreadable file the records decoded so far are returned.
     *
     * @param capacity upper bound on the number of records accepted
     */
    public List<T> load(int capacity) {
        List<T> records = new ArrayList<>();
        if (!Files.exists(path)) {
            LOG.infof("File %s not found - %s table starts empty", path, tableName);
            return records;
        }

        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            int count = in.readInt();
            if (count < 0) {
                LOG.errorf("❌ %s declares a negative record count (%d) - %s table starts empty", path, count, tableName);
                return records;
            }
            if (count > capacity) {
                LOG.warnf("⚠️ %s declares %d %s records, only the first %d fit the table", path, count, tableName, capacity);
                count = capacity;
            }
            for (int i = 0; i < count; i++) {
                records.add(layout.read(in));
            }
            LOG.infof("Loaded %d %s records from %s", records.size(), tableName, path);
        } catch (EOFException e) {
            LOG.errorf("❌ %s is truncated - kept %d complete %s records", path, records.size(), tableName);
        } catch (IOException e) {
            LOG.errorf(e, "❌ Failed to read %s: %s - kept %d %s records", path, e.getMessage(), records.size(), tableName);
        }
        return records;
    }

    /**
     * Overwrites the file with {@code records}, creating the parent directory when needed.
     */
    public void write(Collection<T> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
            out.writeInt(records.size());
            for (T record : records) {
                layout.write(out, record);
            }
        }
        LOG.debugf("Wrote %d %s records to %s", records.size(), tableName, path);
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    public Path getPath() {
        return path;
    }

    public String getTableName() {
        return tableName;
    }
}
