package dev.mars.pgprojection.core.slicing;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.pgprojection.api.Event;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The slices of one tenant in one processing pass, in first-seen order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class TenantSliceGroup<TDoc, TId> {

    private final String tenantId;
    private final Map<TId, EventSlice<TDoc, TId>> slices = new LinkedHashMap<>();

    public TenantSliceGroup(String tenantId) {
        this.tenantId = Objects.requireNonNull(tenantId, "Tenant ID cannot be null");
    }

    public String getTenantId() {
        return tenantId;
    }

    public void addEvent(TId id, Event<?> event) {
        slices.computeIfAbsent(id, key -> new EventSlice<>(key, tenantId)).addEvent(event);
    }

    public void addSlice(EventSlice<TDoc, TId> slice) {
        if (!tenantId.equals(slice.getTenantId())) {
            throw new IllegalArgumentException("Slice tenant " + slice.getTenantId() + " does not match " + tenantId);
        }
        slices.put(slice.getId(), slice);
    }

    public EventSlice<TDoc, TId> getSlice(TId id) {
        return slices.get(id);
    }

    public List<EventSlice<TDoc, TId>> getSlices() {
        return new ArrayList<>(slices.values());
    }

    public int size() {
        return slices.size();
    }

    @Override
    public String toString() {
        return "TenantSliceGroup{tenant=" + tenantId + ", slices=" + slices.size() + '}';
    }
}
