package com.ivamare.agentqueue.audit;

import com.ivamare.agentqueue.model.DlqMessage;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Operator access to dead-lettered messages.
 */
public interface DlqRepository {

    /**
     * Rows with {@code can_replay = true} matching the query, oldest first.
     */
    List<DlqMessage> findReplayable(DlqQuery query);

    /**
     * Flag rows as replayed so they are not selected again.
     *
     * @return number of rows updated
     */
    int markReplayed(Collection<Long> ids);

    /**
     * Delete rows dead-lettered before the cutoff.
     *
     * @return number of rows deleted
     */
    int purgeOlderThan(Instant cutoff);
}
