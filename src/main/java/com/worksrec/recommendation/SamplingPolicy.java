package com.worksrec.recommendation;

public enum SamplingPolicy {
    // same slice as the guaranteed picks, so an item may appear twice
    TOP_SLICE,
    TAIL
}
