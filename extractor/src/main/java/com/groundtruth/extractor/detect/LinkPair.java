package com.groundtruth.extractor.detect;

/**
 * An ordered (source, target) pair of link columns and its vocabulary score.
 */
public record LinkPair(String source, String target, int score) {

    public String subtype() {
        return source + "->" + target;
    }

    public String columns() {
        return source + "," + target;
    }
}
