package io.barhistory.merge;

import io.barhistory.core.DataBlock;

/**
 * One contiguous copy from a source block into the final series.
 */
public record MergeOp(DataBlock srcDataBlock, int srcIndexForCopy, int nbElementToCopy) {}
