package com.lexbridge.backend.support;

import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.store.AdvocateStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryAdvocateStore implements AdvocateStore {

    private final Map<String, AdvocateCapability> advocates = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized AdvocateCapability create(AdvocateCapability advocate) {
        String id = advocate.getId() != null ? advocate.getId() : "adv-" + sequence.incrementAndGet();
        AdvocateCapability stored = advocate.toBuilder().id(id).build();
        advocates.put(id, stored);
        return stored.toBuilder().build();
    }

    @Override
    public synchronized Optional<AdvocateCapability> findById(String id) {
        return Optional.ofNullable(advocates.get(id)).map(a -> a.toBuilder().build());
    }

    @Override
    public synchronized Optional<AdvocateCapability> findByEnrollmentNumber(String enrollmentNumber) {
        return advocates.values().stream()
                .filter(a -> enrollmentNumber != null && enrollmentNumber.equals(a.getEnrollmentNumber()))
                .findFirst()
                .map(a -> a.toBuilder().build());
    }

    @Override
    public synchronized List<AdvocateCapability> findAll() {
        List<AdvocateCapability> all = new ArrayList<>();
        advocates.values().forEach(a -> all.add(a.toBuilder().build()));
        return all;
    }

    @Override
    public synchronized long count() {
        return advocates.size();
    }

    @Override
    public synchronized AdvocateCapability updateProfile(AdvocateCapability advocate) {
        AdvocateCapability current = advocates.get(advocate.getId());
        AdvocateCapability stored = advocate.toBuilder().currentCaseLoad(current.getCurrentCaseLoad()).build();
        advocates.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public synchronized boolean incrementCaseLoad(String id) {
        AdvocateCapability current = advocates.get(id);
        if (current == null) {
            return false;
        }
        advocates.put(id, current.toBuilder().currentCaseLoad(current.getCurrentCaseLoad() + 1).build());
        return true;
    }

    /** Test hook: removes an advocate behind the service's back. */
    public synchronized void remove(String id) {
        advocates.remove(id);
    }
}
