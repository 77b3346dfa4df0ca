/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.errsim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry used when error injection is enabled.
 * <p>
 * <b>Locking:</b> every operation on the name map runs under one coarse lock.
 * These are rare, test-time calls. Per-point activation state is not guarded
 * by this lock; production threads reach it through {@link LivePoint#check(String)}
 * without touching the registry. The registry lock may be held while taking a
 * point's match-key lock, never the other way round.
 * <p>
 * The registry does not own its points. Each point lives in the static field
 * that defined it; the map only associates names with them.
 */
final class LiveRegistry implements ErrsimRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(LiveRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, LivePoint> points = new HashMap<>();
    private final ErrsimConfig config;

    LiveRegistry(ErrsimConfig config) {
        this.config = config;
    }

    @Override
    public ErrsimPoint define(String name) {
        LivePoint point = new LivePoint(PointNames.validate(name, config.strictNames()), config.logFires());
        register(point);
        return point;
    }

    void register(LivePoint point) {
        LivePoint previous;
        lock.lock();
        try {
            previous = points.put(point.name(), point);
        } finally {
            lock.unlock();
        }
        if (previous != null && previous != point) {
            LOG.warn("[ERRSIM] Point '{}' registered twice, the later definition wins", point.name());
        } else {
            LOG.debug("[ERRSIM] Registered point {}", point.name());
        }
    }

    @Override
    public void activate(String name, int faultCode, String matchKey, int times) {
        lock.lock();
        try {
            LivePoint point = points.get(name);
            if (point == null) {
                LOG.warn("[ERRSIM] activate: unknown point '{}'", name);
                return;
            }
            if (faultCode == 0 || times == 0) {
                LOG.warn("[ERRSIM] activate: point '{}' given faultCode={} times={}, leaving it inactive",
                        name, faultCode, times);
                point.reset();
                return;
            }
            String key = matchKey == null ? "" : matchKey;
            int budget = times < 0 ? -1 : times;
            point.activate(faultCode, key, budget);
            LOG.debug("[ERRSIM] Activated {}: faultCode={}, matchKey='{}', times={}", name, faultCode, key, budget);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset(String name) {
        lock.lock();
        try {
            LivePoint point = points.get(name);
            if (point == null) {
                LOG.debug("[ERRSIM] reset: unknown point '{}', ignoring", name);
                return;
            }
            point.reset();
            LOG.debug("[ERRSIM] Reset {}", name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void resetAll() {
        lock.lock();
        try {
            for (LivePoint point : points.values()) {
                point.reset();
            }
            LOG.debug("[ERRSIM] Reset all {} points", points.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ErrsimPoint> get(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(points.get(name));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SortedSet<String> names() {
        lock.lock();
        try {
            return Collections.unmodifiableSortedSet(new TreeSet<>(points.keySet()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
