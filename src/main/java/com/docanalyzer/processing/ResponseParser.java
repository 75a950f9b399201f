package com.docanalyzer.processing;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the final answer from a reasoning step. The model marks it with
 * {@code <result>...</result>}; anything else is intermediate reasoning.
 */
public final class ResponseParser {

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Content of the first result tag, stripped. Empty if there is no tag or it is blank.
     */
    public static Optional<String> extractResult(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher m = RESULT_TAG.matcher(response);
        if (!m.find()) {
            return Optional.empty();
        }
        String result = m.group(1).strip();
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }
}
