package com.gemflush.orchestrator.publish;

import java.util.Locale;

/** Kind of site a reference lives on, with the trust score it carries. */
public enum ReferenceSourceType {
    GOVERNMENT(90, true),
    NEWS(85, true),
    ACADEMIC(85, true),
    DATABASE(80, true),
    DIRECTORY(75, true),
    REVIEW(70, true),
    OTHER(60, false),
    COMPANY(50, false);

    private final int trustScore;
    private final boolean serious;

    ReferenceSourceType(int trustScore, boolean serious) {
        this.trustScore = trustScore;
        this.serious    = serious;
    }

    public int trustScore()   { return trustScore; }
    public boolean serious()  { return serious; }

    /** Lenient parse of a model's label; unknown labels map to OTHER. */
    public static ReferenceSourceType fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
