package com.ecoWasteEngine.store.memory;

import com.ecoWasteEngine.exception.StorageException;
import com.ecoWasteEngine.store.BlobStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "memory")
public class InMemoryBlobStorage implements BlobStorage {

    private static final String SCHEME = "mem://";

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public String put(byte[] bytes, String contentType) {
        String handle = SCHEME + UUID.randomUUID();
        blobs.put(handle, bytes.clone());
        return handle;
    }

    @Override
    public byte[] get(String handle) {
        byte[] bytes = blobs.get(handle);
        if (bytes == null) {
            throw new StorageException("No blob for handle " + handle, null);
        }
        return bytes.clone();
    }
}
