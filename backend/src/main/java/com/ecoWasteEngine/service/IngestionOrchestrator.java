package com.ecoWasteEngine.service;

import com.ecoWasteEngine.classifier.ClassifierAdapter;
import com.ecoWasteEngine.classifier.ClassifierPrediction;
import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.exception.ClassifierUnavailableException;
import com.ecoWasteEngine.exception.ServiceException;
import com.ecoWasteEngine.exception.StorageException;
import com.ecoWasteEngine.exception.ValidationException;
import com.ecoWasteEngine.model.Classification;
import com.ecoWasteEngine.model.EntryStatusChange;
import com.ecoWasteEngine.model.StepResult;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import com.ecoWasteEngine.policy.ConfidencePolicyEngine;
import com.ecoWasteEngine.policy.DisposalDecision;
import com.ecoWasteEngine.store.BlobStorage;
import com.ecoWasteEngine.store.FingerprintCache;
import com.ecoWasteEngine.store.WasteEntryStore;
import com.google.cloud.Timestamp;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns an uploaded photo into a finalized waste entry.
 *
 * <p>Order of work: validate, claim the dedup key, store the image, create the
 * PENDING entry, classify, finalize, queue the reward. Only validation, image
 * storage and the entry insert can fail the call. Classification, finalization
 * and rewards are best-effort; an entry whose finalization failed stays PENDING
 * until {@link #resumePending(WasteEntry)} picks it up again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private static final long REPLAY_POLL_MS = 25;
    /** A released claim is re-contested once before giving up */
    private static final int CLAIM_ROUNDS = 2;

    private final FingerprintCache fingerprintCache;
    private final BlobStorage blobStorage;
    private final WasteEntryStore entryStore;
    private final ClassifierAdapter classifierAdapter;
    private final ConfidencePolicyEngine policyEngine;
    private final RewardDispatcher rewardDispatcher;
    private final WasteEngineProperties properties;
    private final Clock clock;

    public SubmissionResult submit(String submitterId, byte[] image, String contentType) {
        String normalizedType = validate(submitterId, image, contentType);
        String contentHash = ContentFingerprint.sha256Hex(image);
        String dedupKey = ContentFingerprint.dedupKey(submitterId, contentHash);

        for (int round = 0; round < CLAIM_ROUNDS; round++) {
            String entryId = UUID.randomUUID().toString();
            FingerprintCache.Claim claim = fingerprintCache.claim(
                    dedupKey, entryId, properties.getIngestion().getDedupWindow());
            if (claim.isOwner()) {
                return ingest(entryId, dedupKey, submitterId, contentHash, image, normalizedType);
            }
            Optional<WasteEntry> existing = awaitEntry(dedupKey, claim.getEntryId());
            if (existing.isPresent()) {
                log.info("[Ingestion] Duplicate submission from {} replayed as entry {}",
                        submitterId, existing.get().getId());
                return SubmissionResult.builder()
                        .entry(existing.get())
                        .replayed(true)
                        .rewardQueued(false)
                        .build();
            }
        }
        throw new ServiceException("An identical submission is still being processed, retry shortly");
    }

    private SubmissionResult ingest(String entryId, String dedupKey, String submitterId, String contentHash,
            byte[] image, String contentType) {
        String imageRef;
        WasteEntry entry;
        try {
            imageRef = blobStorage.put(image, contentType);
            Timestamp now = Timestamps.now(clock);
            List<EntryStatusChange> history = new ArrayList<>();
            history.add(EntryStatusChange.builder().status(WasteEntryStatus.PENDING).at(now).build());
            entry = entryStore.create(WasteEntry.builder()
                    .id(entryId)
                    .submitterId(submitterId)
                    .fingerprint(contentHash)
                    .imageRef(imageRef)
                    .contentType(contentType)
                    .status(WasteEntryStatus.PENDING)
                    .createdAt(now)
                    .statusHistory(history)
                    .build());
        } catch (RuntimeException e) {
            fingerprintCache.release(dedupKey, entryId);
            if (e instanceof StorageException || e instanceof ServiceException) {
                throw e;
            }
            throw new StorageException("Could not persist submission " + entryId, e);
        }
        log.info("[Ingestion] Entry {} created for {} ({} bytes)", entryId, submitterId, image.length);

        return complete(entry, image, contentType);
    }

    /**
     * Classifies and finalizes an entry that stayed PENDING, reading the image
     * back from blob storage. An unreadable image finalizes as UNCLASSIFIED.
     */
    public SubmissionResult resumePending(WasteEntry entry) {
        byte[] image;
        try {
            image = blobStorage.get(entry.getImageRef());
        } catch (RuntimeException e) {
            log.warn("[Ingestion] Image of pending entry {} is unreadable: {}", entry.getId(), e.getMessage());
            image = null;
        }
        return complete(entry, image, entry.getContentType());
    }

    /** Everything after the PENDING insert; never throws. */
    private SubmissionResult complete(WasteEntry entry, byte[] image, String contentType) {
        StepResult<WasteEntry> finalized = classifyAndFinalize(entry, image, contentType);
        if (!finalized.isSuccess()) {
            log.error("[Ingestion] Entry {} could not be finalized and stays PENDING for re-drive",
                    entry.getId(), finalized.getError().orElse(null));
            return SubmissionResult.builder()
                    .entry(entry)
                    .replayed(false)
                    .rewardQueued(false)
                    .build();
        }

        WasteEntry done = finalized.getValue();
        boolean rewardQueued = false;
        if (done.getStatus() == WasteEntryStatus.CLASSIFIED) {
            StepResult<?> reward = rewardDispatcher.dispatch(
                    done.getSubmitterId(), done.getId(), done.getClassification().getCategory());
            rewardQueued = reward.isSuccess();
        }
        return SubmissionResult.builder()
                .entry(done)
                .replayed(false)
                .rewardQueued(rewardQueued)
                .build();
    }

    private StepResult<WasteEntry> classifyAndFinalize(WasteEntry entry, byte[] image, String contentType) {
        StepResult<Classification> classification = image == null
                ? StepResult.failed(new ClassifierUnavailableException("No image to classify", null))
                : classifierAdapter.classify(image, contentType).map(this::toClassification);
        if (classification.isSuccess()) {
            Classification c = classification.getValue();
            log.info("[Ingestion] Entry {} classified as {}/{} ({}, {})", entry.getId(),
                    c.getCategory(), c.getSubCategory(), c.getConfidence(), c.getConfidenceTier());
            return finalizeEntry(entry.getId(), WasteEntryStatus.CLASSIFIED, c);
        }
        log.warn("[Ingestion] Entry {} left unclassified: {}", entry.getId(),
                classification.getError().map(Throwable::getMessage).orElse("unknown"));
        return finalizeEntry(entry.getId(), WasteEntryStatus.UNCLASSIFIED, null);
    }

    private StepResult<WasteEntry> finalizeEntry(String entryId, WasteEntryStatus status, Classification c) {
        try {
            return StepResult.ok(entryStore.finalizeEntry(entryId, status, c));
        } catch (RuntimeException e) {
            return StepResult.failed(e);
        }
    }

    private Classification toClassification(ClassifierPrediction prediction) {
        DisposalDecision decision = policyEngine.decide(
                prediction.getConfidence(), prediction.getCategory(), prediction.getSubCategory());
        return Classification.builder()
                .category(prediction.getCategory())
                .subCategory(prediction.getSubCategory())
                .confidence(prediction.getConfidence())
                .confidenceTier(decision.getTier())
                .recommendedBin(decision.getRecommendedBin())
                .handlingInstructions(new ArrayList<>(decision.getInstructions()))
                .manualReviewRequired(decision.isManualReviewRequired())
                .modelName(prediction.getModelName())
                .build();
    }

    /**
     * Waits for the entry behind a lost claim to become readable. Returns empty
     * early when the claim disappears, which means the first submission failed.
     */
    private Optional<WasteEntry> awaitEntry(String dedupKey, String entryId) {
        long deadline = System.nanoTime() + properties.getIngestion().getReplayWait().toNanos();
        while (true) {
            Optional<WasteEntry> entry = entryStore.findById(entryId);
            if (entry.isPresent()) {
                return entry;
            }
            Optional<String> holder = fingerprintCache.lookup(dedupKey);
            if (holder.isEmpty() || !Objects.equals(holder.get(), entryId)) {
                return Optional.empty();
            }
            if (System.nanoTime() - deadline > 0) {
                throw new ServiceException("Entry " + entryId + " did not appear within the replay wait");
            }
            try {
                Thread.sleep(REPLAY_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ServiceException("Interrupted while waiting for entry " + entryId, e);
            }
        }
    }

    private String validate(String submitterId, byte[] image, String contentType) {
        if (submitterId == null || submitterId.isBlank()) {
            throw new ValidationException("Submitter is required");
        }
        if (image == null || image.length == 0) {
            throw new ValidationException("Image is empty");
        }
        long max = properties.getIngestion().getMaxImageBytes();
        if (image.length > max) {
            throw ValidationException.payloadTooLarge(image.length, max);
        }
        if (contentType == null || contentType.isBlank()) {
            throw new ValidationException("Content type is required");
        }
        String normalized = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        List<String> accepted = properties.getIngestion().getAcceptedContentTypes();
        boolean ok = accepted.contains(normalized)
                || (accepted.contains("image/*") && normalized.startsWith("image/"));
        if (!ok) {
            throw new ValidationException("Unsupported content type: " + contentType);
        }
        return normalized;
    }
}
