package com.docanalyzer.processing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseParserTest {

    @Test
    void testExtractsTaggedResultAcrossLines() {
        String response = "Thinking about margins...\n<result>\nMargins expanded.\nDebt is stable.\n</result> trailing";

        assertThat(ResponseParser.extractResult(response)).contains("Margins expanded.\nDebt is stable.");
    }

    @Test
    void testFirstTagWins() {
        assertThat(ResponseParser.extractResult("<result>one</result><result>two</result>")).contains("one");
    }

    @Test
    void testUntaggedOrBlankResponsesHaveNoResult() {
        assertThat(ResponseParser.extractResult("Still reasoning about the balance sheet")).isEmpty();
        assertThat(ResponseParser.extractResult("<result>   </result>")).isEmpty();
        assertThat(ResponseParser.extractResult("<result>unterminated")).isEmpty();
        assertThat(ResponseParser.extractResult(null)).isEmpty();
    }
}
