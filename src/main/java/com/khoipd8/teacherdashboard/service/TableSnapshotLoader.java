package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.exception.TableStoreException;
import com.khoipd8.teacherdashboard.repository.TableStore;
import com.khoipd8.teacherdashboard.table.TableSchema;
import com.khoipd8.teacherdashboard.table.TableSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fetches the sheets one view needs. Fetches run in parallel and the snapshot is only handed back
 * once every one of them has finished; a single failed fetch fails the whole load.
 */
@Service
@Slf4j
public class TableSnapshotLoader {

    private final TableStore tableStore;
    private final Executor executor;

    public TableSnapshotLoader(TableStore tableStore, @Qualifier("tableFetchExecutor") Executor executor) {
        this.tableStore = tableStore;
        this.executor = executor;
    }

    public TableSnapshot load(TableSchema... schemas) {
        Map<TableSchema, CompletableFuture<List<List<String>>>> pending = new LinkedHashMap<>();
        for (TableSchema schema : schemas) {
            pending.computeIfAbsent(schema, s -> CompletableFuture.supplyAsync(
                    () -> tableStore.fetchRows(s.getSheetName(), s.range()), executor));
        }

        try {
            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TableStoreException) {
                throw (TableStoreException) cause;
            }
            throw new TableStoreException(null, "Sheet fetch failed: " + cause.getMessage(), cause);
        }

        Map<TableSchema, List<List<String>>> rows = new LinkedHashMap<>();
        pending.forEach((schema, future) -> rows.put(schema, future.join()));
        log.debug("Loaded snapshot of {} sheet(s)", rows.size());
        return new TableSnapshot(rows);
    }
}
