package com.edge.mosaic.core.cache;

import com.edge.mosaic.core.feature.FeatureSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * 基于文件目录的特征缓存
 * <p>
 * 每个键对应目录下一个 JSON 文件（文件名为键的 SHA-256）。
 * 先写临时文件再原子替换，读到的文件一定是完整写入的。
 * 任何 IO 错误都记录 WARN 并按未命中处理。
 */
public class FileFeatureCache implements FeatureCache {
    private static final Logger logger = LoggerFactory.getLogger(FileFeatureCache.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileFeatureCache(Path directory) {
        this(directory, new ObjectMapper());
    }

    public FileFeatureCache(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<FeatureSet> get(String key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            FeatureSet features = objectMapper.readValue(file.toFile(), FeatureSet.class);
            logger.debug("Feature cache hit: {} ({} keypoints)", file.getFileName(), features.size());
            return Optional.of(features);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to read feature cache entry {}: {}, recomputing", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, FeatureSet features) {
        Path file = fileFor(key);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "entry-", ".tmp");
            objectMapper.writeValue(temp.toFile(), features);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
            logger.debug("Feature cache stored: {} ({} keypoints)", file.getFileName(), features.size());
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to write feature cache entry {}: {}", file, e.getMessage());
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    logger.debug("Could not remove temp file {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    Path fileFor(String key) {
        return directory.resolve(digest(key) + SUFFIX);
    }

    private static String digest(String key) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
