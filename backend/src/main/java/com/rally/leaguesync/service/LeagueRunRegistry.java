package com.rally.leaguesync.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks the run currently holding each league. Acquisition never blocks: a second run for a
 * league that is already running is rejected.
 */
@Component
public class LeagueRunRegistry {

    private final ConcurrentMap<String, RunHandle> active = new ConcurrentHashMap<>();

    public static final class RunHandle implements AutoCloseable {
        private final String leagueKey;
        private final LeagueRunRegistry owner;
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

        private RunHandle(String leagueKey, LeagueRunRegistry owner) {
            this.leagueKey = leagueKey;
            this.owner = owner;
        }

        public String getLeagueKey() { return leagueKey; }
        public boolean isCancelRequested() { return cancelRequested.get(); }
        void requestCancel() { cancelRequested.set(true); }

        @Override
        public void close() { owner.active.remove(leagueKey, this); }
    }

    public RunHandle acquire(String leagueKey) {
        String key = normalize(leagueKey);
        RunHandle handle = new RunHandle(key, this);
        if (active.putIfAbsent(key, handle) != null) {
            throw new RunInProgressException(leagueKey);
        }
        return handle;
    }

    /** @return true when a run was active and has been asked to stop at the next batch boundary */
    public boolean cancel(String leagueKey) {
        RunHandle handle = active.get(normalize(leagueKey));
        if (handle == null) return false;
        handle.requestCancel();
        return true;
    }

    public boolean isRunning(String leagueKey) {
        return active.containsKey(normalize(leagueKey));
    }

    private static String normalize(String leagueKey) {
        return leagueKey == null ? "" : leagueKey.trim().toUpperCase(Locale.ROOT);
    }
}
