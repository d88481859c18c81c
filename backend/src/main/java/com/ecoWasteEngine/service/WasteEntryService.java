package com.ecoWasteEngine.service;

import com.ecoWasteEngine.exception.ResourceNotFoundException;
import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.store.WasteEntryStore;
import lombok.RequiredArgsConstructor;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class WasteEntryService {

    private final WasteEntryStore entryStore;

    /** Entries are private to their submitter */
    public WasteEntry getEntry(String id, String requesterId) {
        WasteEntry entry = entryStore.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Waste entry", id));
        if (!entry.getSubmitterId().equals(requesterId)) {
            throw new AccessDeniedException("Entry " + id + " belongs to another user");
        }
        return entry;
    }

    public List<WasteEntry> listEntries(String submitterId, int limit) {
        return entryStore.findBySubmitter(submitterId, limit);
    }
}
