package io.lineprof.stats.route;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.lineprof.stats.accumulate.CodePointOrder;
import io.lineprof.stats.profile.ValueProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/// Group key to profile mapping for one profiling pass.
///
/// Entries are created the first time a key is seen and are never removed. The table is
/// owned by a single pass and is not thread-safe.
///
/// @param <P> the profile type every group holds
public final class GroupTable<P extends ValueProfile> {

    private static final Comparator<Entry<?>> DESCENDING_BY_RAW_KEY =
        Comparator.comparing((Entry<?> e) -> e.key().raw(), CodePointOrder.INSTANCE).reversed();

    private final char delimiter;
    private final Supplier<P> profileFactory;
    private final Map<String, Entry<P>> groups = new HashMap<>();

    /// One group with its key and profile
    /// @param key the group key
    /// @param profile the group's accumulators
    /// @param <P> the profile type
    public record Entry<P extends ValueProfile>(GroupKey key, P profile) {
    }

    /// @param delimiter the delimiter used to split keys into components
    /// @param profileFactory creates a fresh profile for each new group
    public GroupTable(char delimiter, Supplier<P> profileFactory) {
        this.delimiter = delimiter;
        this.profileFactory = profileFactory;
    }

    /// Get the profile for a key, creating it on first use.
    ///
    /// @param rawKey the key text
    /// @return the group's profile
    public P profileFor(String rawKey) {
        return groups.computeIfAbsent(rawKey, k -> new Entry<>(GroupKey.of(k, delimiter), profileFactory.get()))
            .profile();
    }

    /// Get the profile of the `<INVALID>` sentinel group, creating it on first use.
    ///
    /// @return the sentinel group's profile
    public P invalidProfile() {
        return groups.computeIfAbsent(GroupKey.INVALID_NAME, k -> new Entry<>(GroupKey.INVALID, profileFactory.get()))
            .profile();
    }

    /// @param rawKey the key text
    /// @return the profile, if the key was seen
    public Optional<P> get(String rawKey) {
        Entry<P> entry = groups.get(rawKey);
        return entry == null ? Optional.empty() : Optional.of(entry.profile());
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /// @return all groups, ordered by descending raw key
    public List<Entry<P>> snapshot() {
        List<Entry<P>> entries = new ArrayList<>(groups.values());
        entries.sort(DESCENDING_BY_RAW_KEY);
        return entries;
    }
}
