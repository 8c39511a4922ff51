package com.image.ai.pipeline.storage;

import com.image.ai.pipeline.exception.BlobStoreException;
import com.image.ai.pipeline.model.ThumbnailVariant;
import com.image.ai.shared.util.constants.AppConstants;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Blob store on the local file system. Originals live under
 * {@code originals/{id}.{ext}}, thumbnails under
 * {@code thumbnails/{id}_{variant}.jpg}; references are paths relative to the
 * configured root.
 */
@Slf4j
@Component
public class FileSystemBlobStore implements BlobStore {

    static final String ORIGINALS_DIR = "originals";
    static final String THUMBNAILS_DIR = "thumbnails";
    static final String THUMBNAIL_EXTENSION = "jpg";

    private final Path root;

    public FileSystemBlobStore(@Value(AppConstants.PROP_STORAGE_ROOT) String root) {
        this.root = Path.of(root).toAbsolutePath().normalize();
    }

    @PostConstruct
    public void ensureDirectories() {
        try {
            Files.createDirectories(root.resolve(ORIGINALS_DIR));
            Files.createDirectories(root.resolve(THUMBNAILS_DIR));
            log.info("Blob store initialized at {}", root);
        } catch (IOException e) {
            throw new BlobStoreException("Cannot create blob directories under " + root, e);
        }
    }

    @Override
    public String storeOriginal(String itemId, String extension, byte[] bytes) {
        return write(ORIGINALS_DIR + "/" + sanitize(itemId) + "." + sanitize(extension), bytes);
    }

    @Override
    public String storeThumbnail(String itemId, ThumbnailVariant variant, byte[] bytes) {
        String name = sanitize(itemId) + "_" + variant.variantName() + "." + THUMBNAIL_EXTENSION;
        return write(THUMBNAILS_DIR + "/" + name, bytes);
    }

    @Override
    public byte[] read(String ref) {
        Path path = resolve(ref);
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new BlobStoreException("Cannot read blob " + ref, e);
        }
    }

    @Override
    public Optional<Resource> open(String ref) {
        if (ref == null || ref.isBlank()) {
            return Optional.empty();
        }
        Path path = resolve(ref);
        return Files.isRegularFile(path) ? Optional.of(new FileSystemResource(path)) : Optional.empty();
    }

    @Override
    public long size(String ref) {
        try {
            return Files.size(resolve(ref));
        } catch (IOException e) {
            throw new BlobStoreException("Cannot stat blob " + ref, e);
        }
    }

    @Override
    public void delete(String ref) {
        try {
            if (Files.deleteIfExists(resolve(ref))) {
                log.debug("Deleted blob {}", ref);
            }
        } catch (IOException e) {
            throw new BlobStoreException("Cannot delete blob " + ref, e);
        }
    }

    private String write(String ref, byte[] bytes) {
        Path target = resolve(ref);
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), ".upload-", ".part");
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored blob {} ({} bytes)", ref, bytes.length);
            return ref;
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new BlobStoreException("Cannot write blob " + ref, e);
        }
    }

    private Path resolve(String ref) {
        Path path = root.resolve(ref).normalize();
        if (!path.startsWith(root)) {
            throw new BlobStoreException("Blob reference escapes the store root: " + ref);
        }
        return path;
    }

    private static String sanitize(String segment) {
        return segment.replace("/", "_").replace("\\", "_").replace("..", "_");
    }
}
