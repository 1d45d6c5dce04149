package com.example.chatfunctions.blob;

import com.example.chatfunctions.error.UpstreamServiceException;
import com.example.chatfunctions.model.ObjectRef;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Service
public class GcsBlobStore implements BlobStore {

    private static final String SERVICE = "blob-store";

    private final Storage storage;

    public GcsBlobStore(Storage storage) {
        this.storage = storage;
    }

    @Override
    public Path download(ObjectRef ref, Path destination) {
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            storage.downloadTo(BlobId.of(ref.getBucket(), ref.getPath()), destination);
            return destination;
        } catch (StorageException | IOException e) {
            throw new UpstreamServiceException(SERVICE, "download of " + ref + " failed", e);
        }
    }

    @Override
    public Long upload(Path source, ObjectRef ref, String contentType, Map<String, String> metadata) {
        BlobInfo.Builder info = BlobInfo.newBuilder(BlobId.of(ref.getBucket(), ref.getPath()));
        if (contentType != null) info.setContentType(contentType);
        if (metadata != null && !metadata.isEmpty()) info.setMetadata(metadata);
        try {
            Blob blob = storage.createFrom(info.build(), source);
            return blob.getGeneration();
        } catch (StorageException | IOException e) {
            throw new UpstreamServiceException(SERVICE, "upload to " + ref + " failed", e);
        }
    }
}
