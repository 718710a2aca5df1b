/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
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

package com.palantir.buildutils.versions;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.palantir.buildutils.http.TextFetcher;
import java.net.URI;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the {@code maven-metadata.xml} of many modules in parallel and merges everything the repositories
 * report into one {@link VersionHolder} per module.
 * <p>
 * Every module is a single job on the pool. A job asks each repository in turn; a repository that does not have
 * the module or fails to answer is skipped. The holders are shared between jobs and guarded by a read/write lock.
 */
public final class VersionInfoFetcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VersionInfoFetcher.class);

    public static final int DEFAULT_THREADS = 8;

    private final TextFetcher fetcher;
    private final ExecutorService executor;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<ModuleId, VersionHolder> holders = new HashMap<>();

    public VersionInfoFetcher(TextFetcher fetcher) {
        this(fetcher, DEFAULT_THREADS);
    }

    public VersionInfoFetcher(TextFetcher fetcher, int threads) {
        Preconditions.checkArgument(threads >= 1, "At least one thread is required, got %s", threads);
        this.fetcher = fetcher;
        this.executor = Executors.newFixedThreadPool(
                threads,
                new ThreadFactoryBuilder()
                        .setNameFormat("version-info-%d")
                        .setDaemon(true)
                        .build());
    }

    /**
     * Fetches metadata for {@code modules} from {@code repositories} and blocks until every job has finished.
     * Calling this again merges into the same holders, so one module can be looked up in several repository
     * layouts.
     *
     * @return a snapshot of the holders of the requested modules
     */
    public Map<ModuleId, VersionHolder> fetch(Collection<ModuleId> modules, List<MetadataRepository> repositories) {
        ImmutableList.Builder<Future<?>> futures = ImmutableList.builder();
        for (ModuleId module : modules) {
            lock.writeLock().lock();
            try {
                holders.computeIfAbsent(module, _ignored -> new VersionHolder());
            } finally {
                lock.writeLock().unlock();
            }

            futures.add(executor.submit(() -> fetchModule(module, repositories)));
        }

        futures.build().forEach(VersionInfoFetcher::await);

        lock.readLock().lock();
        try {
            ImmutableMap.Builder<ModuleId, VersionHolder> snapshot = ImmutableMap.builder();
            modules.stream().distinct().forEach(module -> snapshot.put(module, holders.get(module)));
            return snapshot.build();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void fetchModule(ModuleId module, List<MetadataRepository> repositories) {
        for (MetadataRepository repository : repositories) {
            URI uri = repository.metadataUri(module);
            try {
                Optional<String> document = fetcher.fetch(uri);
                if (document.isEmpty()) {
                    continue;
                }

                MavenMetadata metadata = MavenMetadataParser.parse(document.get());
                lock.writeLock().lock();
                try {
                    metadata.mergeInto(holders.get(module));
                } finally {
                    lock.writeLock().unlock();
                }
            } catch (RuntimeException e) {
                log.debug("Unable to read version metadata from {}", uri, e);
            }
        }
    }

    private static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for version metadata", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Failed to fetch version metadata", e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
