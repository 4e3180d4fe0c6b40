/*
 * Copyright 2013-2024 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package netscope.interception;

import brave.propagation.TraceContext;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import netscope.internal.Nullable;
import netscope.internal.Platform;
import netscope.propagation.datadog.DatadogPropagation;

/**
 * Correlates the lifecycle callbacks of a network transport into one {@link TaskInterception} per
 * task, and adds trace headers to first-party requests.
 *
 * <p>A transport integrates by calling, for each request:
 * <ol>
 *   <li>{@link #modify(HttpRequest, TransportSession)} before the request is sent</li>
 *   <li>{@link #taskCreated(NetworkTask, TransportSession)} once the task exists</li>
 *   <li>{@link #taskMetricsCollected(NetworkTask, ResourceMetrics)} and {@link
 *   #taskCompleted(NetworkTask, Throwable)}, in any order</li>
 * </ol>
 *
 * <p>Only {@link #modify} runs on the calling thread. The lifecycle callbacks are queued and
 * processed one at a time, in order, on a single background thread. The {@link
 * InterceptionHandler} is notified on that thread. Requests to {@linkplain
 * InterceptionConfiguration#internalUrls() internal URLs} are ignored by every method.
 *
 * <p>Nothing here fails the request: problems are logged and the request proceeds untracked or
 * unmodified.
 */
public final class TaskInterceptor implements Closeable {
  public static Builder newBuilder(InterceptionConfiguration configuration) {
    return new Builder(configuration);
  }

  public static final class Builder {
    final InterceptionConfiguration configuration;
    InterceptionTracer tracer = InterceptionTracer.NOOP;
    final List<InterceptionHandler> handlers = new ArrayList<>();

    Builder(InterceptionConfiguration configuration) {
      if (configuration == null) throw new NullPointerException("configuration == null");
      this.configuration = configuration;
    }

    /** Defaults to {@link InterceptionTracer#NOOP}, which disables trace headers. */
    public Builder tracer(InterceptionTracer tracer) {
      if (tracer == null) throw new NullPointerException("tracer == null");
      this.tracer = tracer;
      return this;
    }

    /**
     * Replaces any handlers added so far. A handler is required: use {@link
     * InterceptionHandler#NOOP} to discard interceptions.
     */
    public Builder handler(InterceptionHandler handler) {
      if (handler == null) throw new NullPointerException("handler == null");
      handlers.clear();
      handlers.add(handler);
      return this;
    }

    /**
     * Adds a handler notified after those already added. Ex. {@link TracingInterceptionHandler}
     * and {@link ResourceInterceptionHandler} together.
     */
    public Builder addHandler(InterceptionHandler handler) {
      if (handler == null) throw new NullPointerException("handler == null");
      handlers.add(handler);
      return this;
    }

    /** @throws NullPointerException if no handler was added */
    public TaskInterceptor build() {
      if (handlers.isEmpty()) throw new NullPointerException("handler == null");
      return new TaskInterceptor(this);
    }
  }

  final InterceptionConfiguration configuration;
  final UrlClassifier classifier;
  final InterceptionTracer tracer;
  final InterceptionHandler handler;
  final boolean injectTracingHeaders;
  final Map<String, String> additionalFirstPartyHeaders;
  final ExecutorService executor;
  // only read or written on the executor
  final Map<NetworkTask, TaskInterception> interceptionByTask = new LinkedHashMap<>();

  TaskInterceptor(Builder builder) {
    configuration = builder.configuration;
    classifier = UrlClassifier.create(configuration);
    tracer = builder.tracer;
    handler = CompositeInterceptionHandler.create(builder.handlers);
    injectTracingHeaders = configuration.tracingEnabled();
    if (configuration.tracingEnabled() && configuration.resourceTrackingEnabled()) {
      additionalFirstPartyHeaders = Collections.singletonMap(
        DatadogPropagation.ORIGIN, DatadogPropagation.RUM_ORIGIN);
    } else {
      additionalFirstPartyHeaders = Collections.emptyMap();
    }
    executor = Platform.get().newSerialExecutor("netscope-task-interceptor");
  }

  /** Like {@link #modify(HttpRequest, TransportSession)}, without session-specific hosts. */
  public HttpRequest modify(HttpRequest request) {
    return modify(request, null);
  }

  /**
   * Returns a copy of the request with trace headers added when it is first-party and tracing is
   * enabled, or the same request otherwise.
   *
   * <p>Each call creates a new span context. Call this once per request sent, as calling it again
   * on its own result replaces the trace headers.
   *
   * @param session when non-null, its additional first-party hosts also count as first-party
   */
  public HttpRequest modify(HttpRequest request, @Nullable TransportSession session) {
    if (request == null) throw new NullPointerException("request == null");
    String url = request.url();
    if (classifier.isInternal(url)) return request;
    if (!injectTracingHeaders || !classifier.isFirstParty(url, session)) return request;

    TraceContext context;
    try {
      context = tracer.newSpanContext();
    } catch (RuntimeException e) {
      Platform.get().log("error creating a span context for {0}", url, e);
      return request;
    }
    if (context == null) return request; // no tracer

    HttpRequest.Builder result = request.toBuilder();
    try {
      tracer.inject(context, result);
    } catch (RuntimeException e) {
      Platform.get().log("error injecting trace headers into {0}", url, e);
      return request;
    }
    for (Map.Entry<String, String> header : additionalFirstPartyHeaders.entrySet()) {
      result.header(header.getKey(), header.getValue());
    }
    return result.build();
  }

  /** Like {@link #taskCreated(NetworkTask, TransportSession)}, without session-specific hosts. */
  public void taskCreated(NetworkTask task) {
    taskCreated(task, null);
  }

  /**
   * Starts tracking the task, unless it has no original request or it is to an internal URL. The
   * handler is notified that the interception started. Calling this again for a task already
   * tracked has no effect.
   */
  public void taskCreated(final NetworkTask task, @Nullable final TransportSession session) {
    if (task == null) throw new NullPointerException("task == null");
    final HttpRequest request = task.originalRequest();
    if (request == null || classifier.isInternal(request.url())) return;

    enqueue("taskCreated", task, new Runnable() {
      @Override public void run() {
        if (interceptionByTask.containsKey(task)) {
          Platform.get().log("ignoring duplicate taskCreated for {0}", task, null);
          return;
        }
        boolean firstParty = classifier.isFirstParty(request.url(), session);
        TaskInterception interception = TaskInterception.create(request, firstParty)
          .withSpanContext(extractSpanContext(request));
        interceptionByTask.put(task, interception);
        handler.interceptionStarted(interception);
      }
    });
  }

  /** Records the metrics of a tracked task, completing its interception if it has completed. */
  public void taskMetricsCollected(final NetworkTask task, final ResourceMetrics metrics) {
    if (task == null) throw new NullPointerException("task == null");
    if (metrics == null) throw new NullPointerException("metrics == null");
    if (isInternal(task)) return;

    enqueue("taskMetricsCollected", task, new Runnable() {
      @Override public void run() {
        TaskInterception interception = interceptionByTask.get(task);
        if (interception == null) return; // not tracked
        update(task, interception.withMetrics(metrics));
      }
    });
  }

  /**
   * Records the outcome of a tracked task, completing its interception if metrics were already
   * collected.
   *
   * @param error null unless the task failed
   */
  public void taskCompleted(final NetworkTask task, @Nullable Throwable error) {
    if (task == null) throw new NullPointerException("task == null");
    if (isInternal(task)) return;

    // read the response now, as the transport may release it after this callback
    final ResourceCompletion completion = ResourceCompletion.create(task.response(), error);
    enqueue("taskCompleted", task, new Runnable() {
      @Override public void run() {
        TaskInterception interception = interceptionByTask.get(task);
        if (interception == null) return; // not tracked
        update(task, interception.withCompletion(completion));
      }
    });
  }

  /**
   * Returns how many tasks started, but haven't both completed and collected metrics. This waits
   * for lifecycle callbacks already queued.
   *
   * <p>Interceptions are never evicted, so a transport that skips a callback leaks them. This
   * count is how to notice.
   */
  public int pendingInterceptionCount() {
    try {
      Future<Integer> result = executor.submit(new Callable<Integer>() {
        @Override public Integer call() {
          return interceptionByTask.size();
        }
      });
      return result.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return -1;
    } catch (ExecutionException | RejectedExecutionException e) {
      Platform.get().log("error counting pending interceptions", e);
      return -1;
    }
  }

  /** Stops processing lifecycle callbacks. Callbacks queued before now are still processed. */
  @Override public void close() {
    executor.shutdown();
  }

  // Only called on the executor
  void update(NetworkTask task, TaskInterception interception) {
    if (!interception.isDone()) {
      interceptionByTask.put(task, interception);
      return;
    }
    interceptionByTask.remove(task);
    handler.interceptionCompleted(interception);
  }

  @Nullable TraceContext extractSpanContext(HttpRequest request) {
    try {
      return tracer.extract(request);
    } catch (RuntimeException e) {
      Platform.get().log("error extracting a span context from {0}", request.url(), e);
      return null;
    }
  }

  boolean isInternal(NetworkTask task) {
    HttpRequest request = task.originalRequest();
    return request != null && classifier.isInternal(request.url());
  }

  void enqueue(final String callback, final NetworkTask task, final Runnable work) {
    try {
      executor.execute(new Runnable() {
        @Override public void run() {
          try {
            work.run();
          } catch (RuntimeException e) {
            Platform.get().log("error processing " + callback + " for {0}", task, e);
          }
        }
      });
    } catch (RejectedExecutionException e) {
      Platform.get().log("dropped " + callback + " for {0} after close", task, e);
    }
  }

  @Override public String toString() {
    return "TaskInterceptor{configuration=" + configuration
      + ", tracer=" + tracer
      + ", handler=" + handler
      + "}";
  }
}
