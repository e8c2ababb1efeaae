package com.cdcbridge.projection;

import com.cdcbridge.decode.RecordContract;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;

/**
 * Everything the generic pipeline needs to know about one source table: what a decoded
 * record must contain, how it maps to a row, and what the target table looks like.
 */
@Getter
@AllArgsConstructor
public class TableBinding implements Serializable {

    private static final long serialVersionUID = 1L;

    private final RecordContract contract;
    private final RowProjector projector;
    private final TableDefinition tableDefinition;
}
