package org.foxesworld.viewbridge.script.cache;

// Author: Calista Verner

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.graalvm.polyglot.Source;

import java.time.Duration;
import java.util.Objects;

/**
 * Parsed script sources shared by every surface of the engine.
 *
 * Pages reloaded with the same scripts (the usual case for UI views) reuse the
 * {@link Source} instead of rebuilding it. Keys carry a content hash, not the text.
 */
public final class SourceCache {

    private final Cache<SourceKey, Source> sources;

    private SourceCache(Cache<SourceKey, Source> sources) {
        this.sources = Objects.requireNonNull(sources, "sources");
    }

    public static SourceCache defaults() {
        return new SourceCache(Caffeine.newBuilder()
                .maximumSize(512)
                .expireAfterAccess(Duration.ofMinutes(5))
                .build());
    }

    public static SourceCache bounded(long maximumSize) {
        return new SourceCache(Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build());
    }

    /** JS source named {@code name} for {@code code}, built on first use. */
    public Source get(String name, String code) {
        String n = (name == null || name.isEmpty()) ? "<anonymous>" : name;
        String c = code == null ? "" : code;
        return sources.get(SourceKey.of(n, c), k -> Source.newBuilder("js", c, n).buildLiteral());
    }

    public long estimatedSize() {
        return sources.estimatedSize();
    }

    public void invalidateAll() {
        sources.invalidateAll();
    }

    /**
     * Name plus length and FNV-1a hash of the content.
     */
    public static final class SourceKey {
        public final String name;
        public final int length;
        public final long contentHash;

        private SourceKey(String name, int length, long contentHash) {
            this.name = name;
            this.length = length;
            this.contentHash = contentHash;
        }

        public static SourceKey of(String name, String content) {
            return new SourceKey(Objects.requireNonNull(name, "name"), content.length(), fnv1a64(content));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SourceKey)) return false;
            SourceKey that = (SourceKey) o;
            return contentHash == that.contentHash && length == that.length && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            int h = name.hashCode();
            h = 31 * h + length;
            h = 31 * h + (int) (contentHash ^ (contentHash >>> 32));
            return h;
        }

        @Override
        public String toString() {
            return "SourceKey{" + name + ", len=" + length + ", hash=" + Long.toHexString(contentHash) + '}';
        }
    }

    static long fnv1a64(String s) {
        long h = 0xcbf29ce484222325L; // offset basis
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= 0x100000001b3L; // prime
        }
        return h;
    }
}
