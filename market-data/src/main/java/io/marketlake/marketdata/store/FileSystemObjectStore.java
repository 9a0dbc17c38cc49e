package io.marketlake.marketdata.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Objects are files under {@code root/bucket/key}. Writes go to a hidden temp file in the target directory and
 * are moved into place.
 */
public class FileSystemObjectStore implements ObjectStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);
    private static final String TMP_SUFFIX = ".tmp";

    private final Path base;

    public FileSystemObjectStore(Path root, String bucket) throws IOException {
        this.base = root.resolve(bucket).toAbsolutePath().normalize();
        Files.createDirectories(base);
    }

    public Path base() { return base; }

    @Override
    public void put(String key, byte[] bytes) throws IOException {
        Path target = resolve(key);
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), TMP_SUFFIX);
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Stored {} ({} bytes)", key, bytes.length);
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public InputStream open(String key) throws IOException {
        Path p = resolve(key);
        if (!Files.isRegularFile(p)) throw new NoSuchFileException(key);
        return Files.newInputStream(p);
    }

    @Override
    public List<ObjectRead> getMany(List<String> patterns) throws IOException {
        List<ObjectRead> out = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            out.add(new ObjectRead(pattern, match(pattern)));
        }
        return out;
    }

    private List<StoredObject> match(String pattern) throws IOException {
        if (!isGlob(pattern)) {
            Path p = resolve(pattern);
            return Files.isRegularFile(p) ? List.of(new StoredObject(pattern, Files.size(p))) : List.of();
        }
        Path start = resolve(literalPrefix(pattern));
        if (!Files.isDirectory(start)) return List.of();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        List<StoredObject> found = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(start)) {
            for (Path p : (Iterable<Path>) walk::iterator) {
                if (!Files.isRegularFile(p) || p.getFileName().toString().endsWith(TMP_SUFFIX)) continue;
                Path rel = base.relativize(p);
                if (matcher.matches(rel)) {
                    found.add(new StoredObject(toKey(rel), Files.size(p)));
                }
            }
        }
        found.sort((a, b) -> a.key().compareTo(b.key()));
        return found;
    }

    private Path resolve(String key) {
        if (key.startsWith("/") || key.contains("..")) throw new IllegalArgumentException("Illegal key: " + key);
        Path p = base.resolve(key).normalize();
        if (!p.startsWith(base)) throw new IllegalArgumentException("Key escapes the bucket: " + key);
        return p;
    }

    private static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0 || pattern.indexOf('{') >= 0;
    }

    // Directory part of the pattern before its first wildcard segment.
    private static String literalPrefix(String pattern) {
        String[] parts = pattern.split("/");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length - 1; i++) {
            if (isGlob(parts[i])) break;
            if (sb.length() > 0) sb.append('/');
            sb.append(parts[i]);
        }
        return sb.toString();
    }

    private static String toKey(Path rel) {
        StringBuilder sb = new StringBuilder();
        for (Path part : rel) {
            if (sb.length() > 0) sb.append('/');
            sb.append(part);
        }
        return sb.toString();
    }
}
