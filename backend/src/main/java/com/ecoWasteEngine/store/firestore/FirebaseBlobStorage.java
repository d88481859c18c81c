package com.ecoWasteEngine.store.firestore;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.Bucket;
import com.google.firebase.cloud.StorageClient;
import com.ecoWasteEngine.exception.StorageException;
import com.ecoWasteEngine.store.BlobStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/** Stores waste images in the Firebase Storage bucket; the handle is the object name. */
@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "firestore", matchIfMissing = true)
public class FirebaseBlobStorage implements BlobStorage {

    private static final String FOLDER = "waste-images/";
    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", ".jpg",
            "image/png", ".png",
            "image/webp", ".webp",
            "image/heic", ".heic");

    @Override
    public String put(byte[] bytes, String contentType) {
        String fileName = FOLDER + UUID.randomUUID() + EXTENSIONS.getOrDefault(contentType, "");
        try {
            Bucket bucket = StorageClient.getInstance().bucket();
            bucket.create(fileName, bytes, contentType);
            return fileName;
        } catch (RuntimeException e) {
            throw new StorageException("Cannot upload image " + fileName, e);
        }
    }

    @Override
    public byte[] get(String handle) {
        try {
            Blob blob = StorageClient.getInstance().bucket().get(handle);
            if (blob == null) {
                throw new StorageException("No image stored under " + handle, null);
            }
            return blob.getContent();
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Cannot read image " + handle, e);
        }
    }
}
