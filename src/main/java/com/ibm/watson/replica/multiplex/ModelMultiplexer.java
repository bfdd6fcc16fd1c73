/*
 * Copyright 2021 IBM Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy
 * of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.ibm.watson.replica.multiplex;

import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.cache.RemovalListener;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.ibm.watson.replica.ReplicaRequestContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded per-replica cache of models, keyed by multiplexed model id. Requests
 * carry the id of the model they target; handlers look it up with
 * {@link #getModel()}, loading it on first use. When the cache is full the least
 * recently used model is unloaded. Models which implement {@link AutoCloseable}
 * are closed when unloaded.
 *
 * @param <M> model type
 */
public class ModelMultiplexer<M> {
    private static final Logger logger = LogManager.getLogger(ModelMultiplexer.class);

    @FunctionalInterface
    public interface ModelLoader<M> {
        M load(String modelId) throws Exception;
    }

    private final LoadingCache<String, M> models;
    private final int maxNumModelsPerReplica;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public ModelMultiplexer(ModelLoader<M> loader, int maxNumModelsPerReplica) {
        Preconditions.checkArgument(maxNumModelsPerReplica > 0,
                "maxNumModelsPerReplica must be positive: %s", maxNumModelsPerReplica);
        this.maxNumModelsPerReplica = maxNumModelsPerReplica;
        RemovalListener<String, M> unloader = notification -> unload(notification.getKey(),
                notification.getValue(), notification.getCause().toString());
        this.models = CacheBuilder.newBuilder()
                .concurrencyLevel(1) // strict LRU ordering
                .maximumSize(maxNumModelsPerReplica)
                .removalListener(unloader)
                .build(new CacheLoader<String, M>() {
                    @Override
                    public M load(String modelId) throws Exception {
                        logger.info("Loading model " + modelId);
                        long before = System.nanoTime();
                        M model = loader.load(modelId);
                        Preconditions.checkNotNull(model, "loader returned null for model %s", modelId);
                        logger.info("Loaded model " + modelId + " in "
                                    + (System.nanoTime() - before) / 1000_000L + "ms");
                        return model;
                    }
                });
    }

    public int getMaxNumModelsPerReplica() {
        return maxNumModelsPerReplica;
    }

    /**
     * Returns the model with the given id, loading it first if necessary.
     *
     * @throws Exception thrown by the model loader
     */
    public M loadModel(String modelId) throws Exception {
        Preconditions.checkArgument(modelId != null && !modelId.isEmpty(), "model id must not be empty");
        Preconditions.checkState(!shutdown.get(), "multiplexer is shut down");
        try {
            return models.get(modelId);
        } catch (ExecutionException | UncheckedExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    /**
     * Returns the model targeted by the request currently being handled.
     *
     * @throws IllegalStateException if not called while handling a request
     *     which specifies a multiplexed model id
     */
    public M getModel() throws Exception {
        ReplicaRequestContext ctx = ReplicaRequestContext.current();
        if (ctx == null || ctx.getMultiplexedModelId().isEmpty()) {
            throw new IllegalStateException("The current request doesn't specify a multiplexed model id");
        }
        return loadModel(ctx.getMultiplexedModelId());
    }

    public Set<String> loadedModelIds() {
        return ImmutableSet.copyOf(models.asMap().keySet());
    }

    /**
     * Unloads all models. Subsequent calls have no effect.
     */
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            logger.info("Unloading " + models.size() + " multiplexed models");
            models.invalidateAll();
            models.cleanUp();
        }
    }

    private void unload(String modelId, M model, String reason) {
        logger.info("Unloading model " + modelId + " (" + reason + ")");
        if (model instanceof AutoCloseable) {
            try {
                ((AutoCloseable) model).close();
            } catch (Exception e) {
                logger.error("Error while unloading model " + modelId, e);
            }
        }
    }
}
