package io.codescalpel.license;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.logging.Logger;

/**
 * Persists the last successful remote verification so that a short verifier
 * outage does not lock out a paying user.
 *
 * <p>Stored as JSON, by default in {@code ~/.config/code-scalpel/license_cache.json}:
 * <pre>{@code
 * {
 *   "last_verified_at": "2026-01-12T09:30:00Z",
 *   "last_verified_at_epoch": 1768210200.0,
 *   "license_hash": "<sha-256 of the token>",
 *   "valid": true,
 *   "exp": 1799746200,
 *   "tier": "pro",
 *   "features": [],
 *   "customer_id": "cus_123",
 *   "organization": "Acme",
 *   "seats": 5,
 *   "error": null
 * }
 * }</pre>
 *
 * <p>The file is read once per instance and mirrored in memory. The mirror is
 * guarded by a lock that is never held during file I/O. The cache is advisory:
 * failing to write it is logged and otherwise ignored, and concurrent writers
 * from several processes resolve as last-write-wins.
 */
public class VerificationCache {

    private static final Logger LOG = Logger.getLogger(VerificationCache.class.getName());

    private static final Gson GSON = new GsonBuilder()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        .serializeNulls()
        .setPrettyPrinting()
        .create();

    private final Path cacheFile;
    private final CacheWriter writer;
    private final Clock clock;

    private final Object lock = new Object();
    private CacheRecord mirror;

    public VerificationCache(Path cacheFile, Clock clock) {
        this(cacheFile, CacheWriter.atomicWithFallback(), clock);
    }

    public VerificationCache(Path cacheFile, CacheWriter writer, Clock clock) {
        this.cacheFile = cacheFile;
        this.writer = writer;
        this.clock = clock;
    }

    /**
     * Load the cached record.
     *
     * @return the record, or {@link CacheRecord#EMPTY} if nothing usable is cached
     */
    public CacheRecord load() {
        synchronized (lock) {
            if (mirror != null) {
                return mirror;
            }
        }
        CacheRecord fromDisk = readFromDisk();
        synchronized (lock) {
            if (mirror == null) {
                mirror = fromDisk;
            }
            return mirror;
        }
    }

    /**
     * Record a successful remote verification.
     *
     * @param entitlements what the verifier reported
     * @param tokenHash SHA-256 of the verified token
     * @return the record now held by the cache
     */
    public CacheRecord save(VerifiedEntitlements entitlements, String tokenHash) {
        CacheRecord record = CacheRecord.of(clock.instant(), tokenHash, entitlements);
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer.write(cacheFile, GSON.toJson(CachedState.from(record)));
        } catch (IOException e) {
            LOG.warning("Failed to persist license verification cache " + cacheFile + ": " + e.getMessage());
        }
        synchronized (lock) {
            mirror = record;
        }
        return record;
    }

    /**
     * Remove the cache file and forget the in-memory record.
     */
    public void clear() {
        try {
            Files.deleteIfExists(cacheFile);
        } catch (IOException e) {
            LOG.warning("Failed to delete license verification cache " + cacheFile + ": " + e.getMessage());
        }
        synchronized (lock) {
            mirror = CacheRecord.EMPTY;
        }
    }

    private CacheRecord readFromDisk() {
        if (!Files.exists(cacheFile)) {
            return CacheRecord.EMPTY;
        }
        try {
            String json = Files.readString(cacheFile, StandardCharsets.UTF_8).strip();
            if (json.isEmpty()) {
                return CacheRecord.EMPTY;
            }
            CachedState state = GSON.fromJson(json, CachedState.class);
            return state != null ? state.toRecord() : CacheRecord.EMPTY;
        } catch (Exception e) {
            LOG.warning("Ignoring unreadable license verification cache " + cacheFile
                + " (" + e.getClass().getSimpleName() + ")");
            return CacheRecord.EMPTY;
        }
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class CachedState {
        String lastVerifiedAt;
        Double lastVerifiedAtEpoch;
        String licenseHash;
        Boolean valid;
        Long exp;
        String tier;
        List<String> features;
        String customerId;
        String organization;
        Integer seats;
        String error;

        static CachedState from(CacheRecord record) {
            CachedState state = new CachedState();
            state.lastVerifiedAt = record.lastVerifiedAt();
            state.lastVerifiedAtEpoch = record.lastVerifiedAtEpoch();
            state.licenseHash = record.licenseHash();
            state.valid = record.valid();
            state.exp = record.exp();
            state.tier = record.tier() != null ? record.tier().wireName() : null;
            state.features = record.features();
            state.customerId = record.customerId();
            state.organization = record.organization();
            state.seats = record.seats();
            state.error = record.error();
            return state;
        }

        CacheRecord toRecord() {
            return new CacheRecord(
                lastVerifiedAt,
                lastVerifiedAtEpoch,
                licenseHash,
                valid,
                exp,
                tier != null ? Tier.fromClaim(tier) : null,
                features,
                customerId,
                organization,
                seats,
                error
            );
        }
    }
}
