package com.pagelens.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagelens.core.model.AnalysisResult;
import com.pagelens.core.model.CacheEntry;
import com.pagelens.core.service.export.AnalysisJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * fingerprint 하나당 JSON 파일 하나(<dir>/<fp>.json).
 * 파일 형식: {fingerprint, created_at, expires_at, payload:{AnalysisJson 형태}}
 * 읽을 수 없는 파일은 지우고 미스로 처리, 디렉터리 자체 I/O 실패는 CacheBackendException.
 */
public final class FileResultCache implements ResultCache {
    private static final Logger LOG = LoggerFactory.getLogger(FileResultCache.class);
    private static final String EXT = ".json";

    private final Path dir;
    private final ObjectMapper mapper = AnalysisJson.mapper();

    public FileResultCache(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new CacheBackendException("cannot create cache dir " + dir, e);
        }
    }

    @Override
    public synchronized Optional<CacheEntry> get(String fingerprint) {
        Path file = fileFor(fingerprint);
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheBackendException("cannot read " + file, e);
        }
        try {
            JsonNode root = mapper.readTree(json);
            AnalysisResult payload = AnalysisJson.fromJson(mapper.writeValueAsString(root.get("payload")));
            return Optional.of(new CacheEntry(
                    root.path("fingerprint").asText(fingerprint),
                    payload,
                    Instant.parse(root.path("created_at").asText()),
                    Instant.parse(root.path("expires_at").asText())));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Dropping unreadable cache file {}: {}", file, e.toString());
            deleteQuietly(file);
            return Optional.empty();
        }
    }

    @Override
    public synchronized void put(CacheEntry entry) {
        Path file = fileFor(entry.fingerprint());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            ObjectNode root = mapper.createObjectNode();
            root.put("fingerprint", entry.fingerprint());
            root.put("created_at", entry.createdAt().toString());
            root.put("expires_at", entry.expiresAt().toString());
            root.set("payload", mapper.readTree(AnalysisJson.toJson(entry.payload())));
            Files.writeString(tmp, mapper.writeValueAsString(root), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new CacheBackendException("cannot write " + file, e);
        }
    }

    @Override
    public synchronized boolean remove(String fingerprint) {
        try {
            return Files.deleteIfExists(fileFor(fingerprint));
        } catch (IOException e) {
            throw new CacheBackendException("cannot delete " + fingerprint, e);
        }
    }

    @Override
    public synchronized boolean removeIfUnchanged(CacheEntry expected) {
        Optional<CacheEntry> cur = get(expected.fingerprint());
        if (cur.isEmpty() || !cur.get().sameVersion(expected)) return false;
        return remove(expected.fingerprint());
    }

    @Override
    public synchronized void clear() {
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + EXT)) {
            for (Path p : ds) Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new CacheBackendException("cannot clear " + dir, e);
        }
    }

    @Override
    public synchronized int evictExpired(Instant now) {
        int n = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + EXT)) {
            for (Path p : ds) {
                String name = p.getFileName().toString();
                String fp = name.substring(0, name.length() - EXT.length());
                Optional<CacheEntry> e = get(fp);
                if (e.isPresent() && e.get().isExpired(now) && Files.deleteIfExists(p)) n++;
            }
        } catch (IOException e) {
            throw new CacheBackendException("cannot sweep " + dir, e);
        }
        return n;
    }

    @Override
    public synchronized int size() {
        int n = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + EXT)) {
            for (Path ignored : ds) n++;
        } catch (IOException e) {
            throw new CacheBackendException("cannot list " + dir, e);
        }
        return n;
    }

    public Path getDir() { return dir; }

    private Path fileFor(String fingerprint) {
        // 경로 구분자 금지
        if (fingerprint.indexOf('/') >= 0 || fingerprint.indexOf('\\') >= 0 || fingerprint.contains("..")) {
            throw new IllegalArgumentException("fingerprint must not contain path separators");
        }
        return dir.resolve(fingerprint + EXT);
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.debug("Could not delete {}: {}", p, e.toString());
        }
    }
}
