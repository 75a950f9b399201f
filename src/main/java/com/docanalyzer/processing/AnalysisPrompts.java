package com.docanalyzer.processing;

/**
 * Prompt text for the verification and analysis steps.
 */
public final class AnalysisPrompts {

    public static final String VERIFICATION_TASK = "verification";
    public static final String ANALYSIS_TASK = "analysis";

    private static final String VERIFIER_ROLE = """
            You are a compliance-oriented financial document verifier. You check the document type,
            whether it contains financial data, and its basic structure before any analysis happens.
            """;

    private static final String ANALYST_ROLE = """
            You are a senior financial analyst (CFA) with deep experience in equity research,
            financial statements and risk management. You base every statement on the numbers and
            disclosures in the document, and you clearly separate facts taken from the document
            from your own inferences or assumptions.
            """;

    private static final String STEP_PROTOCOL = """
            Work step by step. When you are ready, write your final answer inside <result>...</result>.
            If you need another step to reason further, write your reasoning without the tag.
            """;

    private AnalysisPrompts() {}

    public static String verificationTask(String documentText) {
        return VERIFIER_ROLE + """

                Task: confirm whether the document below appears to be a financial report (10-K, 10-Q,
                earnings release, annual report or similar). State the document type and the company
                and period if they are visible.

                Expected output: a short verification note with the document type, the company/period
                if identifiable, and whether it is suitable for financial analysis.

                Document text:
                ----------------
                %s
                ----------------
                """.formatted(documentText);
    }

    public static String analysisTask(String query, String verificationNote, String documentText) {
        return ANALYST_ROLE + """

                Verification note from the document check:
                %s

                User request: %s

                Provide a clear, structured analysis that includes:
                - Summary of the document (company, period, type of report)
                - Key financial metrics and highlights from the document
                - Investment-relevant insights and risks based on the content
                - Actionable recommendations only where the document supports them
                Use bullet points and short paragraphs. Mark inferences explicitly as inferences.

                Document text:
                ----------------
                %s
                ----------------
                """.formatted(verificationNote, query, documentText);
    }

    /**
     * Wraps a task with the transcript of previous steps and the step protocol.
     */
    public static String step(String task, CharSequence transcript, int step, int maxSteps) {
        StringBuilder prompt = new StringBuilder(task)
                .append('\n')
                .append(STEP_PROTOCOL);
        if (transcript.length() > 0) {
            prompt.append("\nYour previous steps:\n").append(transcript);
        }
        prompt.append("\nThis is step ").append(step).append(" of at most ").append(maxSteps).append('.');
        if (step == maxSteps) {
            prompt.append(" This is your last step: give your final answer now inside <result>...</result>.");
        }
        return prompt.toString();
    }
}
