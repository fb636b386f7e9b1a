package com.signalfusion.common.model;

/**
 * Output of {@link com.signalfusion.common.scoring.RelevanceClassifier}.
 *
 * @param financial      whether the text discusses financial or market topics
 * @param confidence     keyword density based confidence in [0, 1]
 * @param keywordMatches number of distinct financial keywords found
 */
public record RelevanceVerdict(boolean financial, double confidence, int keywordMatches) {

    private static final RelevanceVerdict NONE = new RelevanceVerdict(false, 0.0, 0);

    public static RelevanceVerdict none() {
        return NONE;
    }
}
