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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Injection point used when error injection is enabled.
 * <p>
 * <b>State:</b>
 * <ul>
 *   <li>{@code faultCode}: 0 when inactive; published last on activation</li>
 *   <li>{@code remaining}: -1 unbounded, 0 inactive or exhausted, &gt;0 firings left</li>
 *   <li>{@code matchKey}: empty matches every key; guarded by this point's own lock</li>
 * </ul>
 * The fault code and counter are lock-free so that concurrent production calls
 * never contend with each other. Only {@link LiveRegistry} activates or resets a
 * point; {@link #check(String)} only counts the budget down.
 * <p>
 * The single-load fast path applies after a reset. A point whose finite budget is
 * exhausted keeps its fault code until the next activate or reset, so its checks
 * still take the match-key lock and read the counter before returning 0.
 */
final class LivePoint implements ErrsimPoint {

    private static final Logger LOG = LoggerFactory.getLogger(LivePoint.class);

    private final String name;
    private final boolean logFires;

    private final AtomicInteger faultCode = new AtomicInteger(0);
    private final AtomicInteger remaining = new AtomicInteger(0);
    private final AtomicLong fired = new AtomicLong(0);

    private final ReentrantLock matchKeyLock = new ReentrantLock();
    private String matchKey = "";

    LivePoint(String name, boolean logFires) {
        this.name = name;
        this.logFires = logFires;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int check(String key) {
        // Fast path: a single volatile read when inactive
        int code = faultCode.get();
        if (code == 0) {
            return 0;
        }

        String callKey = key == null ? "" : key;
        matchKeyLock.lock();
        try {
            if (!matchKey.isEmpty() && !matchKey.equals(callKey)) {
                return 0;
            }
        } finally {
            matchKeyLock.unlock();
        }

        if (!consumeFiring()) {
            return 0;
        }

        fired.incrementAndGet();
        if (logFires) {
            LOG.info("[ERRSIM] Injecting error {} at point {}{}",
                    code, name, callKey.isEmpty() ? "" : " for key=" + callKey);
        }
        return code;
    }

    /**
     * Takes one firing from the budget.
     * <p>
     * The counter only moves from n to n-1 while n &gt; 0, so it never goes
     * negative and concurrent callers racing for the last firing get exactly
     * one winner. Losers see 0 and do not fire.
     */
    private boolean consumeFiring() {
        while (true) {
            int left = remaining.get();
            if (left == 0) {
                return false;
            }
            if (left < 0) {
                return true;
            }
            if (remaining.compareAndSet(left, left - 1)) {
                if (left == 1) {
                    LOG.debug("[ERRSIM] Point {} exhausted its budget", name);
                }
                return true;
            }
        }
    }

    /**
     * Installs a new activation. Key and budget become visible before the code
     * is published, so a reader that sees the new code also sees its key and budget.
     */
    void activate(int code, String key, int times) {
        matchKeyLock.lock();
        try {
            matchKey = key;
        } finally {
            matchKeyLock.unlock();
        }
        remaining.set(times);
        faultCode.set(code);
    }

    void reset() {
        faultCode.set(0);
        remaining.set(0);
        matchKeyLock.lock();
        try {
            matchKey = "";
        } finally {
            matchKeyLock.unlock();
        }
    }

    String matchKey() {
        matchKeyLock.lock();
        try {
            return matchKey;
        } finally {
            matchKeyLock.unlock();
        }
    }

    @Override
    public State state() {
        int left = remaining.get();
        if (faultCode.get() == 0 || left == 0) {
            return State.INACTIVE;
        }
        return left < 0 ? State.ACTIVE_INFINITE : State.ACTIVE_FINITE;
    }

    @Override
    public int remaining() {
        int left = remaining.get();
        if (faultCode.get() == 0) {
            return 0;
        }
        return left < 0 ? -1 : left;
    }

    @Override
    public long fireCount() {
        return fired.get();
    }

    @Override
    public String toString() {
        return "LivePoint{" +
                "name=" + name +
                ", faultCode=" + faultCode.get() +
                ", remaining=" + remaining.get() +
                ", matchKey='" + matchKey() + '\'' +
                '}';
    }
}
