package com.lexbridge.backend.store;

import com.lexbridge.backend.models.AdvocateCapability;

import java.util.List;
import java.util.Optional;

public interface AdvocateStore {

    AdvocateCapability create(AdvocateCapability advocate);

    Optional<AdvocateCapability> findById(String id);

    Optional<AdvocateCapability> findByEnrollmentNumber(String enrollmentNumber);

    List<AdvocateCapability> findAll();

    long count();

    /** Replaces the profile fields. The case load is left as stored. */
    AdvocateCapability updateProfile(AdvocateCapability advocate);

    /** Atomically adds one to the current case load; false when the advocate is unknown. */
    boolean incrementCaseLoad(String id);
}
