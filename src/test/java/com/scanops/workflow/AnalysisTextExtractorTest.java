package com.scanops.workflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisTextExtractorTest {

    @Test
    void testLabelledSectionsAreRecognised() {
        String analysis = "Summary of the scan.\n\nRemediation: Upgrade OpenSSH to 9.x.\n\n"
                + "Impact: remote attackers can enumerate users.\n\nVerification: run ssh -V on the host.";

        AnalysisExtraction extraction = AnalysisTextExtractor.extract(analysis);

        assertInstanceOf(AnalysisExtraction.Recognized.class, extraction);
        assertTrue(extraction.recognized());
        assertEquals("Upgrade OpenSSH to 9.x.", extraction.remediation());
        assertEquals("remote attackers can enumerate users.", extraction.exploitation());
        assertEquals("run ssh -V on the host.", extraction.verification());
    }

    @Test
    void testMissingRemediationFallsBack() {
        AnalysisExtraction extraction = AnalysisTextExtractor.extract("Exploitation: default credentials accepted");

        assertTrue(extraction.recognized());
        assertEquals(AnalysisTextExtractor.FALLBACK_REMEDIATION, extraction.remediation());
        assertNull(extraction.verification());
    }

    @Test
    void testUnlabelledTextIsKeptRaw() {
        AnalysisExtraction extraction = AnalysisTextExtractor.extract("Nothing interesting was found on the host.");

        AnalysisExtraction.Unparsed unparsed = assertInstanceOf(AnalysisExtraction.Unparsed.class, extraction);
        assertEquals("Nothing interesting was found on the host.", unparsed.rawText());
        assertFalse(extraction.recognized());
        assertEquals(AnalysisTextExtractor.FALLBACK_REMEDIATION, extraction.remediation());
        assertNull(extraction.exploitation());
    }

    @Test
    void testSectionsAreTruncated() {
        AnalysisExtraction extraction = AnalysisTextExtractor.extract("Remediation: " + "x".repeat(3000));

        assertEquals(AnalysisTextExtractor.REMEDIATION_LIMIT, extraction.remediation().length());
    }

    @Test
    void testSingularLabelsAreRecognised() {
        AnalysisExtraction extraction = AnalysisTextExtractor.extract(
                "Recommendation: disable TLS 1.0.\n\nTest command: sslscan scanme.example.org");

        assertTrue(extraction.recognized());
        assertEquals("disable TLS 1.0.", extraction.remediation());
        assertEquals("sslscan scanme.example.org", extraction.verification());
    }
}
