package com.cdcbridge.projection;

import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.Row;

import java.io.Serializable;

/**
 * Stateless mapping from a decoded record to a row of the target table.
 *
 * <p>Input has already passed the record contract, so a shape or type mismatch here is a
 * programming error and implementations throw {@link IllegalStateException}.</p>
 */
@FunctionalInterface
public interface RowProjector extends Serializable {

    Row project(DecodedRecord record);
}
