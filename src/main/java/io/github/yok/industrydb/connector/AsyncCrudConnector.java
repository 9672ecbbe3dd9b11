package io.github.yok.industrydb.connector;

import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.types.ColumnarBatch;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.Getter;

/**
 * Runs the calls of a {@link CrudConnector} on an {@link Executor}.
 *
 * <p>
 * Every method returns immediately. A failed call completes its future exceptionally with a
 * {@link CompletionException} whose cause is the {@link IndustryDbException}. Cancelling a future
 * does not interrupt the running statement; its pooled connection is still returned when the
 * statement ends.
 * </p>
 *
 * <pre>
 * ExecutorService executor = Executors.newFixedThreadPool(4);
 * AsyncCrudConnector async = new AsyncCrudConnector(factory.create(descriptor), executor);
 * async.select("orders").thenAccept(batch -&gt; render(batch));
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public class AsyncCrudConnector implements AutoCloseable {

    @Getter
    private final CrudConnector delegate;

    private final Executor executor;

    /**
     * Wraps a connector.
     *
     * @param delegate connector doing the work; closed by {@link #close()}
     * @param executor executor running the blocking calls
     */
    public AsyncCrudConnector(CrudConnector delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Blocking call of the wrapped connector.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    private interface Call<T> {
        T run() throws IndustryDbException;
    }

    public CompletableFuture<ColumnarBatch> execute(String sql) {
        return submit(() -> delegate.execute(sql));
    }

    public CompletableFuture<ColumnarBatch> execute(String sql, List<?> params) {
        return submit(() -> delegate.execute(sql, params));
    }

    public CompletableFuture<OperationOutcome> executeUpdate(String sql, List<?> params) {
        return submit(() -> delegate.executeUpdate(sql, params));
    }

    public CompletableFuture<OperationOutcome> insert(String table, ColumnarBatch batch) {
        return submit(() -> delegate.insert(table, batch));
    }

    public CompletableFuture<ColumnarBatch> select(String table) {
        return submit(() -> delegate.select(table));
    }

    public CompletableFuture<ColumnarBatch> select(String table, List<String> columns,
            String predicate, List<?> params, Long rowCap) {
        return submit(() -> delegate.select(table, columns, predicate, params, rowCap));
    }

    public CompletableFuture<OperationOutcome> update(String table, Map<String, ?> values,
            String predicate, List<?> params) {
        return submit(() -> delegate.update(table, values, predicate, params));
    }

    public CompletableFuture<OperationOutcome> delete(String table, String predicate,
            List<?> params) {
        return submit(() -> delegate.delete(table, predicate, params));
    }

    public CompletableFuture<Boolean> isAlive() {
        return CompletableFuture.supplyAsync(delegate::isAlive, executor);
    }

    public boolean isClosed() {
        return delegate.isClosed();
    }

    public DatabaseType backendType() {
        return delegate.backendType();
    }

    /**
     * Closes the wrapped connector. The executor is left to its owner.
     */
    @Override
    public void close() {
        delegate.close();
    }

    private <T> CompletableFuture<T> submit(Call<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.run();
            } catch (IndustryDbException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
