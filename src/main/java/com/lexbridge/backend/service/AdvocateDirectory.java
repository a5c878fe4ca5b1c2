package com.lexbridge.backend.service;

import com.lexbridge.backend.exception.ConflictException;
import com.lexbridge.backend.exception.ConflictReason;
import com.lexbridge.backend.exception.NotFoundException;
import com.lexbridge.backend.exception.ValidationException;
import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.AdvocateProfileEdit;
import com.lexbridge.backend.store.AdvocateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the advocate directory plus the writes it allows: registration,
 * profile edits by the advocate and case-load increments on acceptance.
 */
@Slf4j
@Service
public class AdvocateDirectory {

    private final AdvocateStore advocateStore;

    public AdvocateDirectory(AdvocateStore advocateStore) {
        this.advocateStore = advocateStore;
    }

    /** Every advocate keyed by id, in store order. */
    public Map<String, AdvocateCapability> snapshot() {
        Map<String, AdvocateCapability> snapshot = new LinkedHashMap<>();
        for (AdvocateCapability advocate : advocateStore.findAll()) {
            snapshot.put(advocate.getId(), advocate);
        }
        return snapshot;
    }

    public Optional<AdvocateCapability> find(String advocateId) {
        return advocateId == null ? Optional.empty() : advocateStore.findById(advocateId);
    }

    public AdvocateCapability get(String advocateId) {
        return find(advocateId).orElseThrow(() -> NotFoundException.advocateNotFound(advocateId));
    }

    /** Stores a complete record, typically from the seed file. */
    public AdvocateCapability register(AdvocateCapability advocate) {
        validate(advocate);
        AdvocateCapability created = advocateStore.create(withCleanLists(advocate).toBuilder()
                .currentCaseLoad(Math.max(0, advocate.getCurrentCaseLoad()))
                .updatedAt(Instant.now())
                .build());
        log.info("Registered advocate {} ({})", created.getId(), created.getDisplayName());
        return created;
    }

    /**
     * Creates the caller's own record under their account id. The platform-owned
     * fields start out empty: no rating, no reviews, unverified, no case load.
     */
    public AdvocateCapability createProfile(String advocateId, AdvocateProfileEdit profile) {
        if (profile == null || isBlank(profile.getEnrollmentNumber())) {
            throw new ValidationException("enrollmentNumber is required");
        }
        if (advocateStore.findById(advocateId).isPresent()) {
            throw new ConflictException(ConflictReason.PROFILE_ALREADY_EXISTS,
                    "Advocate profile already exists for " + advocateId);
        }
        String enrollmentNumber = profile.getEnrollmentNumber().trim();
        if (advocateStore.findByEnrollmentNumber(enrollmentNumber).isPresent()) {
            throw new ConflictException(ConflictReason.ENROLLMENT_NUMBER_TAKEN,
                    "Enrollment number already registered: " + enrollmentNumber);
        }
        AdvocateCapability base = AdvocateCapability.builder()
                .id(advocateId)
                .enrollmentNumber(enrollmentNumber)
                .build();
        AdvocateCapability record = applyEdit(base, profile).toBuilder()
                .enrollmentNumber(enrollmentNumber)
                .updatedAt(Instant.now())
                .build();
        validate(record);
        AdvocateCapability created = advocateStore.create(record);
        log.info("Advocate {} created their profile ({})", created.getId(), enrollmentNumber);
        return created;
    }

    /**
     * Applies the non-null fields of {@code edit} to the stored record. Fields the
     * edit leaves out keep their stored values.
     */
    public AdvocateCapability updateProfile(String advocateId, AdvocateProfileEdit edit) {
        AdvocateCapability current = get(advocateId);
        if (edit == null) {
            throw new ValidationException("Advocate profile is required");
        }
        if (edit.getEnrollmentNumber() != null
                && !edit.getEnrollmentNumber().trim().equals(current.getEnrollmentNumber())) {
            throw new ValidationException("enrollmentNumber cannot be changed");
        }
        AdvocateCapability updated = applyEdit(current, edit).toBuilder()
                .updatedAt(Instant.now())
                .build();
        validate(updated);
        log.info("Advocate {} updated their profile", advocateId);
        return advocateStore.updateProfile(updated);
    }

    public AdvocateCapability setAvailability(String advocateId, boolean available) {
        AdvocateCapability updated = updateProfile(advocateId,
                AdvocateProfileEdit.builder().available(available).build());
        log.info("Advocate {} is now {}", advocateId, available ? "available" : "unavailable");
        return updated;
    }

    public void incrementCaseLoad(String advocateId) {
        if (!advocateStore.incrementCaseLoad(advocateId)) {
            throw NotFoundException.advocateNotFound(advocateId);
        }
    }

    private static AdvocateCapability applyEdit(AdvocateCapability current, AdvocateProfileEdit edit) {
        AdvocateCapability.AdvocateCapabilityBuilder builder = current.toBuilder();
        if (edit.getDisplayName() != null) {
            builder.displayName(edit.getDisplayName());
        }
        if (edit.getStates() != null) {
            builder.states(edit.getStates());
        }
        if (edit.getDistricts() != null) {
            builder.districts(edit.getDistricts());
        }
        if (edit.getHomeCourt() != null) {
            builder.homeCourt(edit.getHomeCourt());
        }
        if (edit.getSpecializations() != null) {
            builder.specializations(edit.getSpecializations());
        }
        if (edit.getSubSpecializations() != null) {
            builder.subSpecializations(edit.getSubSpecializations());
        }
        if (edit.getYearsOfPractice() != null) {
            builder.yearsOfPractice(edit.getYearsOfPractice());
        }
        if (edit.getLandmarkCases() != null) {
            builder.landmarkCases(edit.getLandmarkCases());
        }
        if (edit.getLandmarkCaseCount() != null) {
            builder.landmarkCaseCount(edit.getLandmarkCaseCount());
        }
        if (edit.getFeeTier() != null) {
            builder.feeTier(edit.getFeeTier());
        }
        if (edit.getConsultationFee() != null) {
            builder.consultationFee(edit.getConsultationFee());
        }
        if (edit.getLanguages() != null) {
            builder.languages(edit.getLanguages());
        }
        if (edit.getOfficeAddress() != null) {
            builder.officeAddress(edit.getOfficeAddress());
        }
        if (edit.getMaxCaseLoad() != null) {
            builder.maxCaseLoad(edit.getMaxCaseLoad());
        }
        if (edit.getAvailable() != null) {
            builder.available(edit.getAvailable());
        }
        return withCleanLists(builder.build());
    }

    /** Drops null and blank entries so scoring never sees them. */
    private static AdvocateCapability withCleanLists(AdvocateCapability advocate) {
        return advocate.toBuilder()
                .states(cleaned(advocate.getStates()))
                .districts(cleaned(advocate.getDistricts()))
                .specializations(withoutNulls(advocate.getSpecializations()))
                .subSpecializations(cleaned(advocate.getSubSpecializations()))
                .languages(cleaned(advocate.getLanguages()))
                .build();
    }

    private static List<String> cleaned(List<String> values) {
        if (values == null) {
            return null;
        }
        List<String> result = new ArrayList<>(values.size());
        for (String value : values) {
            if (!isBlank(value)) {
                result.add(value.trim());
            }
        }
        return result;
    }

    private static <T> List<T> withoutNulls(List<T> values) {
        if (values == null) {
            return null;
        }
        List<T> result = new ArrayList<>(values.size());
        for (T value : values) {
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void validate(AdvocateCapability advocate) {
        if (advocate == null) {
            throw new ValidationException("Advocate profile is required");
        }
        if (advocate.getMaxCaseLoad() < 0) {
            throw new ValidationException("maxCaseLoad must not be negative");
        }
        if (advocate.getYearsOfPractice() < 0) {
            throw new ValidationException("yearsOfPractice must not be negative");
        }
        if (advocate.getRating() < 0 || advocate.getRating() > 5) {
            throw new ValidationException("rating must be between 0 and 5");
        }
        Double successRate = advocate.getSuccessRate();
        if (successRate != null && (successRate < 0 || successRate > 100)) {
            throw new ValidationException("successRate must be between 0 and 100");
        }
    }
}
