package com.cdcbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * The rows of one fired window for one shard (source partition).
 *
 * <p>The window covers {@code [windowStart, windowEnd)}. Row order inside a batch carries
 * no meaning. A batch flagged {@code late} holds records that arrived after their window
 * fired and were routed to the late output.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WindowBatch implements Serializable {

    private static final long serialVersionUID = 1L;

    private int shard;
    private long windowStart;
    private long windowEnd;
    private boolean late;
    /** Smallest source offset in the batch; disambiguates late batches of the same window. */
    private long firstOffset;
    @Builder.Default
    private List<Row> rows = new ArrayList<>();

    public int size() {
        return rows.size();
    }
}
