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

package com.ibm.watson.replica;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.protobuf.Internal;
import com.google.protobuf.Message;
import com.google.protobuf.MessageLite;
import com.ibm.watson.replica.http.HttpApp;
import com.ibm.watson.replica.http.HttpReceive;
import com.ibm.watson.replica.http.HttpRequest;
import com.ibm.watson.replica.http.HttpResponses;
import com.ibm.watson.replica.http.HttpScope;
import com.ibm.watson.replica.http.HttpSend;
import com.ibm.watson.replica.multiplex.MultiplexedHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the user's handler instance and mediates every call into it.
 * <p>
 * Method calls share the handler (read lock) while reconfiguration has
 * exclusive access to it (write lock); the lock is fair so that a pending
 * reconfigure isn't starved by a steady stream of requests.
 */
public class UserCallableHost {
    private static final Logger logger = LogManager.getLogger(UserCallableHost.class);

    static final String RECONFIGURE_METHOD = "reconfigure";
    static final String HEALTH_CHECK_METHOD = "checkHealth";

    private static final String UNKNOWN_METHOD = "unknown";

    private final Object deploymentDef;
    private final RequestArgs initArgs;
    private final DeploymentId deploymentId;
    private final Serializer serializer;
    private final ListeningExecutorService executor;

    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock(true);
    private final Lock readLock = rwLock.readLock();
    private final Lock writeLock = rwLock.writeLock();

    private final ReentrantLock destructorLock = new ReentrantLock();
    private boolean destructorDone; // guarded by destructorLock

    private volatile Object callable;
    private volatile MethodTable methodTable;
    private volatile UserMethod healthCheck;

    /**
     * @param deploymentDef a {@link DeploymentFunction} or the {@link Class} of the handler
     * @param executor      runs the producers of streaming methods which emit to a
     *                      {@link io.grpc.stub.StreamObserver}
     */
    public UserCallableHost(Object deploymentDef, RequestArgs initArgs, DeploymentId deploymentId,
                            Serializer serializer, ListeningExecutorService executor) {
        if (!(deploymentDef instanceof DeploymentFunction) && !(deploymentDef instanceof Class)) {
            throw new IllegalArgumentException("deployment definition must be a function or class, got "
                                               + (deploymentDef == null ? null : deploymentDef.getClass()));
        }
        this.deploymentDef = deploymentDef;
        this.initArgs = initArgs != null ? initArgs : RequestArgs.EMPTY;
        this.deploymentId = deploymentId;
        this.serializer = serializer;
        this.executor = executor;
    }

    public boolean isFunction() {
        return deploymentDef instanceof DeploymentFunction;
    }

    /**
     * @return the handler instance, or null if not yet initialized or destroyed
     */
    public Object getUserCallable() {
        return callable;
    }

    /**
     * Constructs the handler. Callers must ensure this is only called once.
     */
    public void initializeCallable() throws InitializationException {
        logger.info("Started initializing replica of deployment " + deploymentId + ".");
        writeLock.lock();
        try {
            if (isFunction()) {
                DeploymentFunction function = (DeploymentFunction) deploymentDef;
                methodTable = MethodTable.forFunction(function);
                callable = function;
            } else {
                Object instance = construct((Class<?>) deploymentDef);
                methodTable = MethodTable.forInstance(instance);
                healthCheck = methodTable.find(HEALTH_CHECK_METHOD);
                if (instance instanceof HttpApp) {
                    try {
                        ((HttpApp) instance).startup();
                    } catch (Exception e) {
                        throw new InitializationException("Startup hook of deployment " + deploymentId
                                                          + " failed: " + e, e);
                    }
                }
                callable = instance;
            }
        } finally {
            writeLock.unlock();
        }
        logger.info("Finished initializing replica of deployment " + deploymentId + ".");
    }

    private Object construct(Class<?> cls) throws InitializationException {
        for (Constructor<?> ctor : cls.getDeclaredConstructors()) {
            if (!Modifier.isPublic(ctor.getModifiers())) {
                continue;
            }
            Object[] values;
            try {
                values = ArgumentBinder.bind(ctor, cls.getSimpleName(), initArgs, null, null);
            } catch (UsageException ue) {
                continue;
            }
            ctor.trySetAccessible();
            try {
                return ctor.newInstance(values);
            } catch (InvocationTargetException ite) {
                Throwable cause = ite.getCause();
                throw new InitializationException("Exception while constructing deployment "
                                                  + deploymentId + ": " + cause, cause);
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new InitializationException("Failed to construct deployment " + deploymentId
                                                  + ": " + e, e);
            }
        }
        throw new InitializationException("No public constructor of " + cls.getName()
                                          + " accepts init arguments " + initArgs);
    }

    /**
     * Passes a new user config to the handler's {@code reconfigure(Map)} method,
     * while no other calls are in progress. A null config is ignored.
     *
     * @throws ConfigException    if the handler can't be reconfigured
     * @throws UserCodeException  if the reconfigure method throws a checked exception;
     *                            unchecked exceptions propagate as-is
     */
    public void callReconfigure(Map<String, Object> userConfig) throws ReplicaException, UserCodeException {
        if (userConfig == null) {
            return;
        }
        writeLock.lock();
        try {
            if (isFunction()) {
                throw new ConfigException("user config specified but deployment " + deploymentId
                                          + " is a function; reconfigure is only supported for class deployments");
            }
            checkInitialized();
            UserMethod reconfigure = methodTable.find(RECONFIGURE_METHOD, Map.class);
            if (reconfigure == null) {
                throw new ConfigException("user config specified but deployment " + deploymentId
                                          + " is missing a " + RECONFIGURE_METHOD + "(Map) method");
            }
            try {
                reconfigure.invoke(RequestArgs.of(userConfig), null, null);
            } catch (RuntimeException | UsageException e) {
                throw e;
            } catch (Exception e) {
                throw UserCodeException.wrap(RECONFIGURE_METHOD, e);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Calls a (non-streaming) method of the handler.
     * <p>
     * HTTP requests carry the ({@link HttpScope}, {@link HttpReceive}, {@link HttpSend})
     * triple as arguments and always return null: the response, including a
     * 500 response on failure, is sent through the {@link HttpSend}. gRPC requests
     * carry a single {@link GrpcRequest} and return a {@link GrpcResult}.
     *
     * @throws UserCodeException wrapping anything thrown by the user's method,
     *                           apart from cancellation which propagates as-is
     */
    public Object callUserMethod(RequestMetadata metadata, RequestArgs args) throws Exception {
        readLock.lock();
        try {
            checkInitialized();
            logger.info("Started executing request " + metadata.getRequestId());
            String methodName = UNKNOWN_METHOD;
            HttpSend httpSend = null;
            try {
                if (metadata.isHttpRequest()) {
                    List<Object> triple = checkHttpArgs(args);
                    HttpScope scope = (HttpScope) triple.get(0);
                    HttpReceive receive = (HttpReceive) triple.get(1);
                    httpSend = (HttpSend) triple.get(2);
                    Object instance = callable;
                    if (instance instanceof HttpApp) {
                        methodName = metadata.getCallMethod();
                        ((HttpApp) instance).call(scope, receive, httpSend);
                        return null;
                    }
                    UserMethod method = methodTable.resolve(metadata.getCallMethod(), 1);
                    methodName = method.getName();
                    RequestArgs userArgs = method.getArity() == 0 ? RequestArgs.EMPTY
                            : RequestArgs.of(new HttpRequest(scope, receive));
                    HttpResponses.send(invokeUnary(method, userArgs, null), httpSend);
                    return null;
                }
                if (metadata.isGrpcRequest()) {
                    GrpcRequestContext grpcContext = metadata.getGrpcContext();
                    UserMethod method = methodTable.resolve(metadata.getCallMethod(), 1);
                    methodName = method.getName();
                    Object result = invokeUnary(method, decodeGrpcArgs(method, args), grpcContext);
                    return new GrpcResult(grpcContext, encodeGrpc(result));
                }
                UserMethod method = methodTable.resolve(metadata.getCallMethod(), args.size());
                methodName = method.getName();
                return invokeUnary(method, args, null);
            } catch (Throwable t) {
                if (RequestStatus.isCancellation(t)) {
                    throw rethrow(t);
                }
                if (httpSend != null) {
                    sendInternalError(httpSend, t);
                }
                if (t instanceof ReplicaException) {
                    throw (ReplicaException) t;
                }
                throw UserCodeException.wrap(methodName, t);
            }
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Calls a streaming method of the handler: one which returns an
     * {@link java.util.Iterator} or {@link java.util.stream.Stream}, or which
     * emits to a {@link io.grpc.stub.StreamObserver} parameter. For gRPC requests
     * each item of the returned stream is a {@link GrpcResult}.
     * <p>
     * HTTP requests are streamed via {@link com.ibm.watson.replica.http.StreamingResponseBridge}.
     */
    public ResponseStream<Object> callUserMethodGenerator(RequestMetadata metadata, RequestArgs args)
            throws Exception {
        Preconditions.checkArgument(!metadata.isHttpRequest(),
                "HTTP requests must be streamed via StreamingResponseBridge");
        readLock.lock();
        try {
            checkInitialized();
            logger.info("Started executing streaming request " + metadata.getRequestId());
            String methodName = UNKNOWN_METHOD;
            try {
                final GrpcRequestContext grpcContext = metadata.getGrpcContext();
                final UserMethod method;
                final RequestArgs userArgs;
                final ItemMapper mapper;
                if (metadata.isGrpcRequest()) {
                    method = methodTable.resolve(metadata.getCallMethod(), 1);
                    userArgs = decodeGrpcArgs(method, args);
                    mapper = item -> new GrpcResult(grpcContext, encodeGrpc(item));
                } else {
                    method = methodTable.resolve(metadata.getCallMethod(), args.size());
                    userArgs = args;
                    mapper = ItemMapper.IDENTITY;
                }
                methodName = method.getName();
                if (method.getKind() == UserMethod.Kind.ASYNC_GENERATOR) {
                    return new ObserverResponseStream(methodName, mapper).start(executor, readLock,
                            observer -> method.invoke(userArgs, grpcContext, observer));
                }
                Object result = method.invoke(userArgs, grpcContext, null);
                if (!IteratorResponseStream.isSequence(result)) {
                    throw new UsageException("Method '" + methodName + "' returned a non-streaming result of type "
                                             + (result == null ? null : result.getClass().getName())
                                             + "; call it with a unary request");
                }
                return IteratorResponseStream.of(methodName, result, readLock, mapper);
            } catch (Throwable t) {
                if (RequestStatus.isCancellation(t)) {
                    throw rethrow(t);
                }
                if (t instanceof ReplicaException) {
                    throw (ReplicaException) t;
                }
                throw UserCodeException.wrap(methodName, t);
            }
        } finally {
            readLock.unlock();
        }
    }

    private Object invokeUnary(UserMethod method, RequestArgs args, GrpcRequestContext grpcContext)
            throws Exception {
        if (method.getKind() != UserMethod.Kind.UNARY) {
            throw new UsageException("Method '" + method.getName() + "' is a streaming method; "
                                     + "call it with a streaming request");
        }
        Object result = method.invoke(args, grpcContext, null);
        if (IteratorResponseStream.isSequence(result)) {
            if (result instanceof AutoCloseable) {
                ((AutoCloseable) result).close();
            }
            throw new UsageException("Method '" + method.getName() + "' returned a stream; "
                                     + "call it with a streaming request");
        }
        if (result instanceof CompletionStage) {
            result = ((CompletionStage<?>) result).toCompletableFuture();
        }
        if (result instanceof Future) {
            Future<?> future = (Future<?>) result;
            try {
                return future.get();
            } catch (InterruptedException ie) {
                future.cancel(true);
                throw ie;
            } catch (ExecutionException ee) {
                throw rethrow(ee.getCause());
            }
        }
        return result;
    }

    private static List<Object> checkHttpArgs(RequestArgs args) throws UsageException {
        List<Object> list = args.getArgs();
        if (list.size() != 3 || !args.getKwargs().isEmpty() || !(list.get(0) instanceof HttpScope)
            || !(list.get(1) instanceof HttpReceive) || !(list.get(2) instanceof HttpSend)) {
            throw new UsageException("HTTP requests must have (scope, receive, send) arguments, got " + args);
        }
        return list;
    }

    private RequestArgs decodeGrpcArgs(UserMethod method, RequestArgs args) throws UsageException, IOException {
        List<Object> list = args.getArgs();
        if (list.size() != 1 || !args.getKwargs().isEmpty() || !(list.get(0) instanceof GrpcRequest)) {
            throw new UsageException("gRPC requests must have a single GrpcRequest argument, got " + args);
        }
        Class<?> payloadType = method.getFirstArgumentType();
        if (payloadType == null) {
            return RequestArgs.EMPTY;
        }
        byte[] payload = ((GrpcRequest) list.get(0)).getUserRequest();
        if (Message.class.isAssignableFrom(payloadType)) {
            @SuppressWarnings("unchecked")
            Message prototype = Internal.getDefaultInstance((Class<? extends Message>) payloadType);
            return RequestArgs.of(prototype.getParserForType().parseFrom(payload));
        }
        return RequestArgs.of(serializer.deserialize(payload));
    }

    private byte[] encodeGrpc(Object result) throws IOException {
        return result instanceof MessageLite ? ((MessageLite) result).toByteArray()
                : serializer.serialize(result);
    }

    private static void sendInternalError(HttpSend send, Throwable t) {
        try {
            HttpResponses.internalError(t).send(send);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to send HTTP 500 response", e);
        }
    }

    /**
     * Runs the handler's {@code checkHealth()} method, if it has one.
     */
    public void callUserHealthCheck() throws HealthCheckException {
        UserMethod check = healthCheck;
        if (check == null) {
            return;
        }
        try {
            check.invoke(RequestArgs.EMPTY, null, null);
        } catch (Exception e) {
            throw new HealthCheckException("User health check of deployment " + deploymentId
                                           + " failed: " + e, e);
        }
    }

    /**
     * Tears down the handler. Only the first call has any effect; failures are
     * logged and suppressed.
     */
    public void callDestructor() {
        destructorLock.lock();
        try {
            if (destructorDone) {
                return;
            }
            destructorDone = true;
            Object instance = callable;
            try {
                if (instance instanceof AutoCloseable) {
                    ((AutoCloseable) instance).close();
                }
            } catch (Exception e) {
                logger.error("Exception during destructor of deployment " + deploymentId, e);
            }
            try {
                if (instance instanceof MultiplexedHandler) {
                    ((MultiplexedHandler) instance).getModelMultiplexer().shutdown();
                }
            } catch (RuntimeException e) {
                logger.error("Exception shutting down model multiplexer of deployment " + deploymentId, e);
            } finally {
                callable = null;
            }
        } finally {
            destructorLock.unlock();
        }
    }

    private void checkInitialized() {
        Preconditions.checkState(callable != null, "deployment %s is not initialized", deploymentId);
    }

    // visible for lock-consistency tests
    ReentrantReadWriteLock getLock() {
        return rwLock;
    }

    private static Exception rethrow(Throwable t) {
        if (t instanceof Error) {
            throw (Error) t;
        }
        return (Exception) t;
    }
}
