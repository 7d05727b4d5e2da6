package com.todoflow.advisory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TodoContentExtractorTest {

    private final TodoContentExtractor extractor = new TodoContentExtractor();

    @Test
    void extract_shouldPreferMarkerLine() {
        String reasoning = "## Step 1: Setup\nWe need a workspace first\n  Action: Create the project folder  ";

        assertEquals("Action: Create the project folder", extractor.extract(reasoning));
    }

    @Test
    void extract_withoutMarker_shouldUseFirstMeaningfulLine() {
        String reasoning = "# Heading that is long\nshort\nCompare the two offers";

        assertEquals("Compare the two offers", extractor.extract(reasoning));
    }

    @Test
    void extract_withoutMeaningfulLine_shouldTruncate() {
        String reasoning = "#".repeat(120);

        String content = extractor.extract(reasoning);

        assertEquals(103, content.length());
        assertTrue(content.endsWith("..."));
    }

    @Test
    void extract_shortText_shouldReturnAsIs() {
        assertEquals("tiny", extractor.extract("tiny"));
    }
}
