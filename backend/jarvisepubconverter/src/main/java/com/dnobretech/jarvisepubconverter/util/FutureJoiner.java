package com.dnobretech.jarvisepubconverter.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Executa uma lista de tarefas e devolve os resultados na ordem em que foram criadas.
 * Os resultados são colhidos na ordem em que terminam: a primeira falha interrompe as
 * tarefas em execução, descarta as que ainda estão na fila e é relançada sem esperar as demais.
 */
public final class FutureJoiner {

    private FutureJoiner() {
    }

    /**
     * @param onFailure converte uma causa que não é {@link RuntimeException} na exceção a lançar;
     *                  também recebe o {@link InterruptedException} quando a espera é interrompida
     */
    public static <T> List<T> invokeAll(Executor executor,
                                        List<? extends Callable<T>> tasks,
                                        Function<Throwable, RuntimeException> onFailure) {
        ExecutorCompletionService<T> completion = new ExecutorCompletionService<>(executor);
        Map<Future<T>, Integer> positions = new IdentityHashMap<>();
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        try {
            for (Callable<T> task : tasks) {
                Future<T> future = completion.submit(task);
                positions.put(future, futures.size());
                futures.add(future);
            }
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            throw onFailure.apply(e);
        }

        List<T> out = new ArrayList<>(Collections.nCopies(tasks.size(), null));
        try {
            for (int done = 0; done < futures.size(); done++) {
                Future<T> future = completion.take();
                out.set(positions.get(future), future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw onFailure.apply(e);
        } catch (ExecutionException | CancellationException e) {
            cancelAll(futures);
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            throw onFailure.apply(cause);
        }
        return out;
    }

    // cancel(true) em FutureTask interrompe a thread que executa a tarefa
    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }
}
