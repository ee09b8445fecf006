package com.updesk.helpdesk.integration.ai;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.updesk.helpdesk.domain.Priority;

/**
 * Extracts urgency and solution from a two-line model answer:
 *
 * <pre>
 * Urgência: Alta
 * Solução: passo 1 ...
 * </pre>
 *
 * Matching is tolerant: labels are case-insensitive and anything the model writes
 * around them is ignored. Without a recognised urgency the priority is
 * {@link Priority#UNCLASSIFIED}; without a solution label the whole answer is used.
 */
public final class TriageResponseParser {

    private static final Pattern URGENCY = Pattern.compile(
        "Urg[êe]ncia:\\s*(Baixa|M[ée]dia|Alta)",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern SOLUTION = Pattern.compile(
        "Solu[çc][ãa]o:\\s*(.*)",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);

    private TriageResponseParser() {
    }

    public static AiSuggestion parse(String responseText) {
        String text = responseText == null ? "" : responseText;

        Matcher urgency = URGENCY.matcher(text);
        boolean urgencyFound = urgency.find();
        Priority priority = urgencyFound
            ? Priority.fromLabel(urgency.group(1)).orElse(Priority.UNCLASSIFIED)
            : Priority.UNCLASSIFIED;

        Matcher solution = SOLUTION.matcher(text);
        String solutionText;
        if (solution.find()) {
            solutionText = solution.group(1).strip();
        } else if (urgencyFound) {
            solutionText = (text.substring(0, urgency.start()) + text.substring(urgency.end())).strip();
        } else {
            solutionText = text.strip();
        }
        return new AiSuggestion(solutionText, priority);
    }
}
