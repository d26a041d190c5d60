package org.pragmatica.dnsb.compiler;

import org.pragmatica.lang.Functions.Fn2;
import org.pragmatica.lang.Promise;
import org.pragmatica.lang.Result;
import org.pragmatica.lang.utils.Causes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs per-service stage work concurrently and joins it.
 *
 * <p>Each unit becomes a {@link Promise} completed on a bounded pool. {@link #run} returns only
 * after every unit has finished, so a stage is a barrier: the next stage never sees partial
 * results. The first failure in declaration order is reported.
 */
final class StageRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final ExecutorService executor;

    private StageRunner(ExecutorService executor) {
        this.executor = executor;
    }

    static StageRunner stageRunner(int parallelism) {
        var counter = new AtomicInteger();
        return new StageRunner(Executors.newFixedThreadPool(Math.max(1, parallelism), runnable -> {
            var thread = new Thread(runnable, "dnsb-stage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }));
    }

    <T, R> Result<Map<String, R>> run(String stage, Map<String, T> units, Fn2<Result<R>, String, T> work) {
        log.info("Stage {}: {} unit(s)", stage, units.size());
        var names = new ArrayList<String>(units.keySet());
        var promises = new ArrayList<Promise<R>>();
        units.forEach((name, unit) -> promises.add(Promise.promise(promise -> executor.execute(() -> promise.resolve(invoke(work,
                                                                                                                             name,
                                                                                                                             unit))))));
        List<Result<R>> results = promises.stream()
                                          .map(Promise::await)
                                          .toList();
        return Result.allOf(results)
                     .map(values -> {
                              var byName = new LinkedHashMap<String, R>();
                              for (int i = 0; i < names.size(); i++) {
                                  byName.put(names.get(i), values.get(i));
                              }
                              return byName;
                          })
                     .onFailure(cause -> log.error("Stage {} failed: {}", stage, cause.message()));
    }

    private static <T, R> Result<R> invoke(Fn2<Result<R>, String, T> work, String name, T unit) {
        return Result.lift(Causes::fromThrowable, () -> work.apply(name, unit))
                     .flatMap(result -> result);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread()
                  .interrupt();
        }
    }
}
