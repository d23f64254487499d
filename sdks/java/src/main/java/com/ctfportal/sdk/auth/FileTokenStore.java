package com.ctfportal.sdk.auth;

import com.ctfportal.sdk.exceptions.PortalException;
import com.ctfportal.sdk.models.TokenPair;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token store that survives restarts by keeping the pair in a small JSON file.
 *
 * <p>The file holds an object with the keys {@code ctf_access} and
 * {@code ctf_refresh}. Writes go through a temporary file and an atomic move, and
 * {@link #clear()} deletes the file.</p>
 */
public class FileTokenStore implements TokenStore {

    private static final Logger logger = LoggerFactory.getLogger(FileTokenStore.class);

    static final String ACCESS_KEY = "ctf_access";
    static final String REFRESH_KEY = "ctf_refresh";

    private final Path file;
    private final ObjectMapper objectMapper;
    private TokenPair current;

    public FileTokenStore(Path file) {
        this(file, new ObjectMapper());
    }

    public FileTokenStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.current = load();
    }

    @Override
    public synchronized String getAccess() {
        return current.getAccess();
    }

    @Override
    public synchronized String getRefresh() {
        return current.getRefresh();
    }

    @Override
    public synchronized void setAccess(String token) {
        write(current.withAccess(token));
    }

    @Override
    public synchronized void setRefresh(String token) {
        write(current.withRefresh(token));
    }

    @Override
    public synchronized void store(TokenPair pair) {
        write(pair != null ? pair : new TokenPair(null, null));
    }

    @Override
    public synchronized TokenPair snapshot() {
        return current;
    }

    @Override
    public synchronized void clear() {
        current = new TokenPair(null, null);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PortalException("Failed to delete token file " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private TokenPair load() {
        if (!Files.exists(file)) {
            return new TokenPair(null, null);
        }
        try {
            Map<String, String> raw = objectMapper.readValue(file.toFile(), new TypeReference<Map<String, String>>() {});
            logger.debug("Loaded tokens from {}", file);
            return new TokenPair(raw.get(ACCESS_KEY), raw.get(REFRESH_KEY));
        } catch (IOException e) {
            throw new PortalException("Failed to read token file " + file, e);
        }
    }

    private void write(TokenPair pair) {
        Map<String, String> raw = new LinkedHashMap<>();
        if (pair.getAccess() != null) {
            raw.put(ACCESS_KEY, pair.getAccess());
        }
        if (pair.getRefresh() != null) {
            raw.put(REFRESH_KEY, pair.getRefresh());
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), raw);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PortalException("Failed to write token file " + file, e);
        }
        current = pair;
    }
}
