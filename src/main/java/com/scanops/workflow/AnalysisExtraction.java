package com.scanops.workflow;

/**
 * Outcome of pulling labelled sections out of an analysis. {@link Recognized} means at least one
 * labelled section was found; {@link Unparsed} keeps the raw text when none was.
 */
public sealed interface AnalysisExtraction permits AnalysisExtraction.Recognized, AnalysisExtraction.Unparsed {

    String remediation();

    String exploitation();

    String verification();

    boolean recognized();

    record Recognized(String remediation, String exploitation, String verification) implements AnalysisExtraction {
        @Override
        public boolean recognized() {
            return true;
        }
    }

    record Unparsed(String rawText) implements AnalysisExtraction {
        @Override
        public String remediation() {
            return AnalysisTextExtractor.FALLBACK_REMEDIATION;
        }

        @Override
        public String exploitation() {
            return null;
        }

        @Override
        public String verification() {
            return null;
        }

        @Override
        public boolean recognized() {
            return false;
        }
    }
}
