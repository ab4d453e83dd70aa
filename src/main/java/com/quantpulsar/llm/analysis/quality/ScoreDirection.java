package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualitySeverity;

/** Which end of the [0,1] score range is bad. */
enum ScoreDirection {

    /** Higher is worse: fail when {@code score >= fail}, warn when {@code score >= warning}. */
    RISK {
        @Override
        QualitySeverity classify(double score, double warning, double fail) {
            if (score >= fail) {
                return QualitySeverity.FAIL;
            }
            return score >= warning ? QualitySeverity.WARNING : QualitySeverity.PASS;
        }
    },

    /** Higher is better: fail when {@code score <= fail}, warn when {@code score <= warning}. */
    QUALITY {
        @Override
        QualitySeverity classify(double score, double warning, double fail) {
            if (score <= fail) {
                return QualitySeverity.FAIL;
            }
            return score <= warning ? QualitySeverity.WARNING : QualitySeverity.PASS;
        }
    };

    abstract QualitySeverity classify(double score, double warning, double fail);
}
