package io.github.nicechester.bibleapi.source;

import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Documents stored as blobs in a Google Cloud Storage bucket, optionally under a prefix.
 */
@Slf4j
public class GcsDocumentSource implements DocumentSource {

    private final Storage storage;
    private final String bucketName;
    private final String prefix;

    public GcsDocumentSource(Storage storage, String bucketName, String prefix) {
        if (bucketName == null || bucketName.isBlank()) {
            throw new BibleSourceException("bible.source.gcs.bucket is required for the gcs source");
        }
        this.storage = storage;
        this.bucketName = bucketName;
        this.prefix = prefix == null ? "" : prefix;
        log.info("Reading Bible documents from {}", describe());
    }

    @Override
    public List<String> listSourceIds() {
        try {
            Page<Blob> blobs = prefix.isEmpty()
                ? storage.list(bucketName)
                : storage.list(bucketName, Storage.BlobListOption.prefix(prefix));

            List<String> names = new ArrayList<>();
            for (Blob blob : blobs.iterateAll()) {
                if (!blob.isDirectory()) {
                    names.add(blob.getName());
                }
            }
            log.debug("Listed {} blobs in {}", names.size(), describe());
            return names;
        } catch (StorageException e) {
            throw new BibleSourceException("Failed to list blobs in " + describe(), e);
        }
    }

    @Override
    public Optional<byte[]> read(String sourceId) {
        try {
            Blob blob = storage.get(BlobId.of(bucketName, sourceId));
            if (blob == null || !blob.exists()) {
                return Optional.empty();
            }
            return Optional.of(blob.getContent());
        } catch (StorageException e) {
            log.warn("Failed to download gs://{}/{}: {}", bucketName, sourceId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String describe() {
        return "gs://" + bucketName + "/" + prefix;
    }
}
