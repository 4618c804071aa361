package me.golemcore.relay.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.outbound.PersistenceException;
import me.golemcore.relay.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores all data in a workspace directory:
 * <ul>
 * <li>conversations/ - one JSON window per scope
 * <li>policy/ - the permission policy snapshot
 * </ul>
 *
 * <p>
 * Base path configured via {@code bot.storage.local.base-path}, defaults to
 * {@code ${user.home}/.golemcore/relay}.
 *
 * @see me.golemcore.relay.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> WORKSPACE_DIRECTORIES = List.of(
            JsonConversationRepository.CONVERSATIONS_DIR,
            JsonConversationRepository.POLICY_DIR);

    private final BotProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            for (String dir : WORKSPACE_DIRECTORIES) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new PersistenceException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> writeAtomically(directory, path, content, backup));
    }

    private void writeAtomically(String directory, String path, String content, boolean backup) {
        Path targetPath = resolvePath(directory, path);
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

        try {
            Path parent = targetPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            if (backup && Files.exists(targetPath)) {
                Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                log.debug("[Storage] Created backup: {}", backupPath);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw new PersistenceException("Atomic write failed: " + directory + "/" + path, e);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
